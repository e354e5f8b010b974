package com.randodo.pattern;

/** A config line that is not a comment, a blank line or a valid {@code name = pattern} assignment. */
public class ConfigException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String line;

    public ConfigException(int lineNumber, String line, String message, Throwable cause) {
        super("[line " + lineNumber + "] " + message, cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** 1-based. */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
