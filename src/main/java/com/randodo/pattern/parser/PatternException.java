package com.randodo.pattern.parser;

/** Malformed pattern: unbalanced group, bad repetition spec, dangling escape. */
public class PatternException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String pattern;
    private final int index;

    public PatternException(String pattern, int index, String message) {
        super("[col " + index + "] " + message + " in pattern: " + pattern);
        this.pattern = pattern;
        this.index = index;
    }

    public String getPattern() {
        return pattern;
    }

    /** Zero-based position of the offending character; the pattern length for end of input. */
    public int getIndex() {
        return index;
    }
}
