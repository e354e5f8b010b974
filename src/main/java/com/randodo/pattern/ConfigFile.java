package com.randodo.pattern;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.randodo.debug.Debug;
import com.randodo.pattern.parser.Generator;
import com.randodo.pattern.parser.Optimizer;
import com.randodo.pattern.parser.PatternCompiler;
import com.randodo.pattern.parser.PatternException;
import com.randodo.pattern.parser.RandomSource;
import com.randodo.pattern.parser.VariableEnvironment;

/**
 * Reads {@code name = pattern} lines and compiles each pattern into the environment.
 *
 * <pre>
 *   # comment
 *   digit = [0-9]
 *   id    = ID-$digit{4}
 * </pre>
 *
 * Lines are compiled in file order against the environment as it stands, but
 * references are resolved only when generating, so a pattern may use a name
 * defined further down. Parsing stops at the first bad line.
 */
public final class ConfigFile {

    private static final String TAG = "randodo.config";

    /** One parsed assignment. */
    public static final class Entry {
        public final String name;
        public final String pattern;
        public final int line;

        public Entry(String name, String pattern, int line) {
            if (name == null) throw new IllegalArgumentException("name is null");
            if (pattern == null) throw new IllegalArgumentException("pattern is null");
            this.name = name;
            this.pattern = pattern;
            this.line = line;
        }

        @Override
        public String toString() {
            return name + " = " + pattern;
        }
    }

    /** Line source. Returns null once exhausted. */
    @FunctionalInterface
    public interface LineReader {
        String readLine() throws IOException;
    }

    private enum LineState {
        DEFAULT,
        READING_NAME,
        WHITESPACE_AFTER_NAME,
        WHITESPACE_BEFORE_VALUE,
        READING_VALUE
    }

    private final VariableEnvironment environment;
    private final RandomSource.Factory randomSources;
    private final List<Entry> lines = new ArrayList<>();
    private boolean optimize = true;

    public ConfigFile(RandomSource.Factory randomSources) {
        this(new VariableEnvironment(), randomSources);
    }

    public ConfigFile(VariableEnvironment environment, RandomSource.Factory randomSources) {
        if (environment == null) throw new IllegalArgumentException("environment is null");
        if (randomSources == null) throw new IllegalArgumentException("randomSources is null");
        this.environment = environment;
        this.randomSources = randomSources;
    }

    public void setOptimize(boolean optimize) { this.optimize = optimize; }

    public boolean isOptimize() { return optimize; }

    public void parse(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            parse(reader);
        }
    }

    public void parse(Reader reader) throws IOException {
        BufferedReader buffered = (reader instanceof BufferedReader)
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        parse(buffered::readLine);
    }

    /** Parses in-memory text, one assignment per line. */
    public void parseText(String text) {
        try {
            parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringReader does not fail
        }
    }

    public void parse(LineReader reader) throws IOException {
        int lineNum = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNum++;
            parseLine(line, lineNum);
        }
        Debug.get().d(TAG, "Parsed " + lineNum + " lines, " + environment.size() + " names defined");
    }

    /** Compiles an ad-hoc pattern against the current environment without defining it. */
    public Generator.Node compile(String pattern) {
        Generator.Node root = PatternCompiler.compile(pattern, environment, randomSources);
        return optimize ? Optimizer.optimize(root) : root;
    }

    public List<Entry> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public VariableEnvironment getEnvironment() {
        return environment;
    }

    private void parseLine(String line, int lineNum) {
        LineState state = LineState.DEFAULT;
        StringBuilder name = new StringBuilder();
        StringBuilder value = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            switch (state) {
                case DEFAULT:
                    switch (c) {
                        case ' ': break;
                        case '#': return; // comment
                        default:
                            name.append(c);
                            state = LineState.READING_NAME;
                    }
                    break;
                case READING_NAME:
                    switch (c) {
                        case ' ':
                            state = LineState.WHITESPACE_AFTER_NAME;
                            break;
                        case '=':
                            state = LineState.WHITESPACE_BEFORE_VALUE;
                            break;
                        default:
                            name.append(c);
                    }
                    break;
                case WHITESPACE_AFTER_NAME:
                    switch (c) {
                        case ' ': break;
                        case '=':
                            state = LineState.WHITESPACE_BEFORE_VALUE;
                            break;
                        default:
                            throw error(lineNum, line, "Unexpected chars after variable name", null);
                    }
                    break;
                case WHITESPACE_BEFORE_VALUE:
                    if (c != ' ') {
                        state = LineState.READING_VALUE;
                        value.append(c);
                    }
                    break;
                case READING_VALUE:
                    value.append(c);
                    break;
            }
        }

        if (state == LineState.DEFAULT) return; // blank line

        if (state != LineState.READING_VALUE) {
            throw error(lineNum, line, "Finished parsing line in an unexpected state", null);
        }

        Entry entry = new Entry(name.toString(), value.toString(), lineNum);
        Generator.Node root;
        try {
            root = compile(entry.pattern);
        } catch (PatternException e) {
            throw error(lineNum, line, e.getMessage(), e);
        }
        try {
            environment.define(entry.name, root);
        } catch (IllegalStateException e) {
            throw error(lineNum, line, e.getMessage(), e);
        }
        lines.add(entry);
        Debug.get().d(TAG, "Defined " + entry.name + " (line " + lineNum + ")");
    }

    private ConfigException error(int lineNum, String line, String msg, Throwable cause) {
        Debug.get().w(TAG, "[line " + lineNum + "] " + msg + ": " + line);
        return new ConfigException(lineNum, line, msg, cause);
    }
}
