package com.example.germanarticles;

import com.example.germanarticles.config.ArticleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(ArticleProperties.class)
public class GermanArticlesApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(GermanArticlesApplication.class, args);
		// The console profile answers a single lookup and exits with the runner's status.
		if (context.getEnvironment().matchesProfiles("console")) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
