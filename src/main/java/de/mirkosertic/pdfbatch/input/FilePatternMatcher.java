package de.mirkosertic.pdfbatch.input;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Decides which files of an expanded input directory are convertible documents.
 * Include patterns are matched case-insensitively against the file name only.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;

    public FilePatternMatcher(final List<String> includePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern.toLowerCase(Locale.ROOT)))
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final String name = fileName.toString();
        // Office owner files and LibreOffice lock files are never documents
        if (name.startsWith("~$") || name.startsWith(".~lock.")) {
            return false;
        }

        // If no include patterns specified, include all
        if (includeMatchers.isEmpty()) {
            return true;
        }

        final Path lowerCased = Path.of(name.toLowerCase(Locale.ROOT));
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(lowerCased)) {
                return true;
            }
        }

        return false;
    }
}
