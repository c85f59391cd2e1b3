package com.eyelevel.demandletter.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a {@link DocumentJob}.
 * <p>
 * A job is created in {@link #PROCESSING} and moves exactly once to {@link #COMPLETED} or {@link #FAILED}.
 */
public enum JobStatus {
    /**
     * The upload was accepted and the document-generation webhook has not answered yet.
     */
    PROCESSING,
    /**
     * The webhook returned a document, which is attached to the job.
     */
    COMPLETED,
    /**
     * The dispatch failed; the job carries a reason and no artifact.
     */
    FAILED;

    /**
     * The lowercase name used on the wire, e.g. {@code "processing"}.
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromValue(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
