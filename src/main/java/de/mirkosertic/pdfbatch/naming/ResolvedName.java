package de.mirkosertic.pdfbatch.naming;

import java.nio.file.Path;

/**
 * A target path claimed in a batch's name registry.
 *
 * @param targetPath  the claimed, collision-free target
 * @param desiredPath the target that would have been used without a collision
 * @param renamed     {@code true} if a {@code " (n)"} suffix had to be added
 */
public record ResolvedName(Path targetPath, Path desiredPath, boolean renamed) {
}
