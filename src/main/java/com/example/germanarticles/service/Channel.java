package com.example.germanarticles.service;

/**
 * Presentation targets of a lookup result.
 */
public enum Channel {
    /** HTTP API: compact JSON. */
    API,
    /** Local console: indented JSON. */
    CONSOLE,
    /** Telegram chat: HTML markup. */
    CHAT
}
