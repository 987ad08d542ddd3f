package de.mirkosertic.pdfbatch.batch;

public enum OutcomeStatus {
    SUCCEEDED,
    /** Converted, but under a suffixed name because the desired name was taken. */
    RENAMED,
    FAILED,
    /** Never started because the batch was stopped or no worker was left to take it. */
    NOT_PROCESSED
}
