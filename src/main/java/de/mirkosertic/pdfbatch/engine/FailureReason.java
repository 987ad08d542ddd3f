package de.mirkosertic.pdfbatch.engine;

/**
 * Classifies why a conversion, a worker or a whole batch failed.
 */
public enum FailureReason {

    /** The engine could not be started at all. Ends the affected worker, not the batch. */
    ENGINE_UNAVAILABLE("Conversion engine unavailable"),

    /** The source file does not exist or cannot be read. */
    SOURCE_UNAVAILABLE("Source file unavailable"),

    /** The source file is open or locked by another application. */
    SOURCE_LOCKED("Source file is locked"),

    /** The engine accepted the call but did not return in time. */
    ENGINE_TIMEOUT("Conversion timed out"),

    /** The target path would exceed the configured maximum path length. */
    PATH_TOO_LONG("Target path too long"),

    /** The output directory cannot be created or written. Aborts the batch before it starts. */
    OUTPUT_DIRECTORY_UNAVAILABLE("Output directory unavailable"),

    /** Any other failure reported by the engine. */
    ENGINE_ERROR("Conversion engine error");

    private final String label;

    FailureReason(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return {@code true} if this failure ends the worker that observed it
     */
    public boolean isFatalToWorker() {
        return this == ENGINE_UNAVAILABLE;
    }
}
