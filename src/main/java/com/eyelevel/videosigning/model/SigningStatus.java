package com.eyelevel.videosigning.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Defines the lifecycle states of a {@link SignedVideo} job. Status only moves forward.
 */
public enum SigningStatus {
    /**
     * The submission is being accepted and no record exists yet. Never persisted.
     */
    PENDING,
    /**
     * The record is persisted and the background signing job is in flight.
     */
    PROCESSING,
    /**
     * The signer succeeded and the signed artifact is available.
     */
    COMPLETED,
    /**
     * Signing or integrity verification failed. The cause is recorded in the error detail.
     */
    FAILED;

    public static final Set<SigningStatus> TERMINAL = Set.of(COMPLETED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * @return The lower-case name clients see, e.g. {@code "processing"}.
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
