package com.example.germanarticles.service;

import com.example.germanarticles.model.Candidate;

import java.util.List;

/**
 * Boundary to the text-generation model.
 */
public interface GenerationClient {

    /**
     * Sends the prompt to the model and returns its alternative completions.
     *
     * @param prompt the full prompt text
     * @return candidates in the order the provider returned them, possibly empty
     * @throws GenerationException if the model could not be reached or refused the call
     */
    List<Candidate> generate(String prompt);
}
