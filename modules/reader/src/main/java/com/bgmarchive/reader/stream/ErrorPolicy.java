package com.bgmarchive.reader.stream;

import java.util.Locale;

/**
 * What a record stream does with a line that fails to decode.
 */
public enum ErrorPolicy {
    /** Drop the line and continue; nothing is retained. */
    SILENT("silent"),
    /** Stop the stream with a {@link RecordDecodeException}. */
    FAIL_FAST("fail-fast"),
    /** Drop the line, keep the failure for later reporting, and continue. */
    COLLECT("collect");

    private final String label;

    ErrorPolicy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a configuration value. Accepts the label ({@code fail-fast}) or the
     * constant name ({@code FAIL_FAST}), ignoring case and surrounding whitespace.
     */
    public static ErrorPolicy fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (ErrorPolicy p : values()) {
                if (p.label.equals(normalized)) return p;
            }
        }
        throw new IllegalArgumentException("Unknown error policy: " + value
                + " (expected silent, fail-fast or collect)");
    }
}
