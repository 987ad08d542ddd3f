package de.mirkosertic.pdfbatch.batch;

import java.nio.file.Path;

/**
 * One source document of a batch.
 *
 * @param sourcePath      the document to convert
 * @param desiredBaseName output base name after the naming rule was applied, without extension
 * @param index           1-based position in the submitted list
 */
public record WorkItem(Path sourcePath, String desiredBaseName, int index) {
}
