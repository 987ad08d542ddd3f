package de.mirkosertic.pdfbatch.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Transforms the base name of a source document into the desired base name of its output.
 */
public enum NamingRule {

    ORIGINAL_NAME("Original Name"),
    REMOVE_SQUARE_BRACKETS("Remove Square Brackets");

    /** Used when removing bracketed spans leaves nothing behind. */
    public static final String EMPTY_NAME_PLACEHOLDER = "untitled";

    private static final Logger logger = LoggerFactory.getLogger(NamingRule.class);

    private static final Pattern BRACKETED = Pattern.compile("\\[.*?]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final String label;

    NamingRule(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public String apply(final String baseName) {
        if (this == ORIGINAL_NAME) {
            return baseName;
        }
        String cleaned = BRACKETED.matcher(baseName).replaceAll("");
        cleaned = WHITESPACE_RUN.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.isEmpty() ? EMPTY_NAME_PLACEHOLDER : cleaned;
    }

    /**
     * Parse a rule from configuration or the command line. Accepts enum names (any case, dashes
     * allowed) and display labels. Unknown values fall back to {@link #ORIGINAL_NAME}.
     */
    public static NamingRule fromConfig(final String value) {
        if (value == null || value.isBlank()) {
            return ORIGINAL_NAME;
        }
        final String trimmed = value.trim();
        for (final NamingRule rule : values()) {
            if (rule.label.equalsIgnoreCase(trimmed)) {
                return rule;
            }
        }
        try {
            return NamingRule.valueOf(trimmed.toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
        } catch (final IllegalArgumentException e) {
            logger.warn("Unknown naming rule '{}', using '{}'", value, ORIGINAL_NAME.label);
            return ORIGINAL_NAME;
        }
    }

    /**
     * Strip the extension from a file name. Names starting with a dot keep it.
     */
    public static String baseNameOf(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    @Override
    public String toString() {
        return label;
    }
}
