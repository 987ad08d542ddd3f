package de.mirkosertic.pdfbatch.engine;

import java.io.IOException;

/**
 * Raised by conversion engines, sessions and the filename resolver. The {@link FailureReason}
 * decides whether the failure is item-level, worker-level or batch-level.
 */
public class ConversionException extends IOException {

    private final FailureReason reason;
    private final String failedInput;

    public ConversionException(final FailureReason reason, final String message) {
        this(reason, message, "", null);
    }

    public ConversionException(final FailureReason reason, final String message, final Throwable cause) {
        this(reason, message, "", cause);
    }

    public ConversionException(final FailureReason reason, final String message, final String failedInput,
                               final Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.failedInput = failedInput == null ? "" : failedInput;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getFailedInput() {
        return failedInput;
    }
}
