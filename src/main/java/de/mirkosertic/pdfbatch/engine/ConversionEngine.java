package de.mirkosertic.pdfbatch.engine;

/**
 * An external, stateful conversion engine that handles one document at a time.
 * <p>
 * Every worker starts its own engine instance; instances are never shared between
 * workers, so implementations do not need to be thread-safe beyond {@link #startEngine()}.
 */
public interface ConversionEngine {

    /**
     * Human-readable engine name used in log lines.
     */
    String engineName();

    /**
     * Start a new, isolated engine instance.
     *
     * @throws ConversionException with {@link FailureReason#ENGINE_UNAVAILABLE} if the engine cannot be started
     */
    EngineHandle startEngine() throws ConversionException;
}
