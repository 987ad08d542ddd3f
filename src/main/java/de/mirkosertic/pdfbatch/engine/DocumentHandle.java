package de.mirkosertic.pdfbatch.engine;

import java.nio.file.Path;

/**
 * A document opened by an {@link EngineHandle}.
 */
public interface DocumentHandle extends AutoCloseable {

    /**
     * Export the document to the given target path. The export either produces the complete
     * target file or no file at all.
     */
    void exportAs(Path target) throws ConversionException;

    /**
     * Close the document without saving changes to the source.
     */
    @Override
    void close();
}
