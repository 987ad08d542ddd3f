package de.mirkosertic.pdfbatch.input;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Turns command line arguments into the ordered list of source documents of a batch.
 * <p>
 * Files are taken as given, even if they do not exist (the batch reports them as failed).
 * Directories are walked recursively and contribute every file accepted by the
 * {@link FilePatternMatcher}, sorted by path.
 */
public class InputCollector {

    private static final Logger logger = LoggerFactory.getLogger(InputCollector.class);

    private final FilePatternMatcher matcher;

    public InputCollector(final FilePatternMatcher matcher) {
        this.matcher = matcher;
    }

    public List<Path> collect(final List<Path> arguments) throws IOException {
        final List<Path> sources = new ArrayList<>();
        for (final Path argument : arguments) {
            if (Files.isDirectory(argument)) {
                final int before = sources.size();
                try (final Stream<Path> paths = Files.walk(argument)) {
                    paths.filter(Files::isRegularFile)
                            .filter(matcher::shouldInclude)
                            .sorted()
                            .forEach(sources::add);
                }
                logger.info("Found {} document(s) in {}", sources.size() - before, argument);
            } else {
                if (!Files.exists(argument)) {
                    logger.warn("Input file does not exist: {}", argument);
                }
                sources.add(argument);
            }
        }
        return sources;
    }
}
