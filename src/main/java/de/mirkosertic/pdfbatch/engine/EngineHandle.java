package de.mirkosertic.pdfbatch.engine;

import java.nio.file.Path;

/**
 * A running engine instance owned by exactly one worker.
 */
public interface EngineHandle {

    /**
     * Open a source document read-only.
     *
     * @throws ConversionException {@link FailureReason#SOURCE_UNAVAILABLE}, {@link FailureReason#SOURCE_LOCKED}
     *                             or {@link FailureReason#ENGINE_ERROR}
     */
    DocumentHandle openDocument(Path source) throws ConversionException;

    /**
     * Stop the engine instance and release its resources. May be called from a thread other
     * than the one that issued the engine calls, e.g. after a call timed out.
     */
    void stopEngine();
}
