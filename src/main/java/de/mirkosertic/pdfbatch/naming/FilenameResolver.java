package de.mirkosertic.pdfbatch.naming;

import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Hands out collision-free output file names for one batch.
 * <p>
 * All access to the claimed-name registry goes through the synchronized methods of this class;
 * workers never see the registry itself. Claims are serialized, so two workers asking for the
 * same desired name always end up with different names.
 */
public class FilenameResolver {

    private static final Logger logger = LoggerFactory.getLogger(FilenameResolver.class);

    public static final int DEFAULT_MAX_PATH_LENGTH = 255;

    private final Path outputDirectory;
    private final String extension;
    private final int maxPathLength;
    private final Set<String> claimedNames = new HashSet<>();

    /**
     * @param outputDirectory directory all targets are placed in
     * @param extension       target extension including the dot, e.g. {@code .pdf}
     * @param maxPathLength   maximum length of the full target path
     */
    public FilenameResolver(final Path outputDirectory, final String extension, final int maxPathLength) {
        if (maxPathLength < 1) {
            throw new IllegalArgumentException("maxPathLength must be positive: " + maxPathLength);
        }
        this.outputDirectory = outputDirectory.toAbsolutePath().normalize();
        this.extension = extension.isEmpty() || extension.startsWith(".") ? extension : "." + extension;
        this.maxPathLength = maxPathLength;
    }

    /**
     * Claim every name already present in the output directory, so files from earlier runs
     * are never overwritten.
     *
     * @return number of names claimed
     */
    public synchronized int seedFromDirectory() throws IOException {
        int count = 0;
        try (Stream<Path> entries = Files.list(outputDirectory)) {
            for (final Path entry : (Iterable<Path>) entries::iterator) {
                if (claimedNames.add(entry.getFileName().toString())) {
                    count++;
                }
            }
        }
        logger.debug("Seeded {} existing names from {}", count, outputDirectory);
        return count;
    }

    /**
     * Claim a name explicitly. Returns {@code false} if it was already claimed.
     */
    public synchronized boolean claim(final String fileName) {
        return claimedNames.add(fileName);
    }

    public synchronized boolean isClaimed(final String fileName) {
        return claimedNames.contains(fileName);
    }

    public synchronized int claimedCount() {
        return claimedNames.size();
    }

    /**
     * Resolve and claim a target for the given desired base name.
     *
     * @throws ConversionException with {@link FailureReason#PATH_TOO_LONG} if the first free
     *                             candidate does not fit; nothing is claimed in that case
     */
    public synchronized ResolvedName resolve(final String desiredBaseName) throws ConversionException {
        final Path desiredPath = outputDirectory.resolve(desiredBaseName + extension);

        String candidate = desiredBaseName + extension;
        int suffix = 0;
        while (claimedNames.contains(candidate)) {
            suffix++;
            candidate = desiredBaseName + " (" + suffix + ")" + extension;
        }

        final Path targetPath = outputDirectory.resolve(candidate);
        final int length = targetPath.toString().length();
        if (length > maxPathLength) {
            throw new ConversionException(FailureReason.PATH_TOO_LONG,
                    "Target path has " + length + " characters, maximum is " + maxPathLength + ": " + targetPath);
        }
        claimedNames.add(candidate);
        if (suffix > 0) {
            logger.debug("Name '{}' already claimed, using '{}'", desiredPath.getFileName(), candidate);
        }
        return new ResolvedName(targetPath, desiredPath, suffix > 0);
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public String getExtension() {
        return extension;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }
}
