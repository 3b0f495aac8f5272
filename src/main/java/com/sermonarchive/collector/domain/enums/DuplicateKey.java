package com.sermonarchive.collector.domain.enums;

/**
 * Which stored attribute a candidate collided with.
 */
public enum DuplicateKey {
    AUDIO_URL,
    FILE_PATH,
    TITLE
}
