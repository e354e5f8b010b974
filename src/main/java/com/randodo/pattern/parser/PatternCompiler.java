package com.randodo.pattern.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.randodo.debug.Debug;
import com.randodo.pattern.parser.Generator.Alternation;
import com.randodo.pattern.parser.Generator.CharacterClass;
import com.randodo.pattern.parser.Generator.Constant;
import com.randodo.pattern.parser.Generator.Node;
import com.randodo.pattern.parser.Generator.Repetition;
import com.randodo.pattern.parser.Generator.Series;
import com.randodo.pattern.parser.Generator.VariableReference;

/**
 * Turns one pattern into a generator tree.
 *
 * <pre>
 *   pattern   := branch ('|' branch)*
 *   branch    := atom*
 *   atom      := literal | '[' class ']' | '(' pattern ')' | '$' name | atom '{' reps '}'
 *   reps      := digits | digits? ',' digits?
 * </pre>
 *
 * The result is always an {@link Alternation} with at least one {@link Series} branch.
 * The environment is only captured by {@link VariableReference} nodes; it is never modified here.
 * A compiler instance is single-use.
 */
public class PatternCompiler {

    enum State {
        DEFAULT,
        CHARACTER_CLASS,  // [abc]
        VARIABLE_NAME,    // $foo
        REPETITION_SPEC,  // {1,10} or {10} or {,10}
        ESCAPE            // \x
    }

    private static final int EOL = -1;

    private final String pattern;
    private final VariableEnvironment environment;
    private final RandomSource.Factory randomSources;

    private State state = State.DEFAULT;
    private final Deque<State> stateStack = new ArrayDeque<>();

    // frames.get(size - 2) collects branches of the innermost group, frames.get(size - 1) is the branch being built
    private final List<List<Node>> frames = new ArrayList<>();

    // pending literal text, variable name, repetition digits or class chars, depending on state
    private final StringBuilder buffer = new StringBuilder();
    private final List<Integer> bounds = new ArrayList<>(2);
    private boolean rangePending = false;

    private int current = 0;
    private boolean used = false;

    public PatternCompiler(String pattern, VariableEnvironment environment, RandomSource.Factory randomSources) {
        if (pattern == null) throw new IllegalArgumentException("pattern is null");
        if (environment == null) throw new IllegalArgumentException("environment is null");
        if (randomSources == null) throw new IllegalArgumentException("randomSources is null");
        this.pattern = pattern;
        this.environment = environment;
        this.randomSources = randomSources;
    }

    public static Node compile(String pattern, VariableEnvironment environment, RandomSource.Factory randomSources) {
        return new PatternCompiler(pattern, environment, randomSources).compile();
    }

    public Alternation compile() {
        if (used) throw new IllegalStateException("PatternCompiler instances are single-use");
        used = true;

        frames.add(Generator.newFrame());
        frames.add(Generator.newFrame());

        for (current = 0; current < pattern.length(); current++) {
            process(pattern.charAt(current));
        }
        current = pattern.length();
        process(EOL);

        List<Node> last = currentFrame();
        Alternation root = (Alternation) last.get(last.size() - 1);
        Debug.get().t("randodo.compile", "Compiled pattern: " + pattern);
        return root;
    }

    private void process(int c) {
        boolean reapply;
        do {
            reapply = false;
            switch (state) {
                case DEFAULT:
                    processDefault(c);
                    break;
                case REPETITION_SPEC:
                    processRepetitionSpec(c);
                    break;
                case VARIABLE_NAME:
                    if (c != EOL && isNameChar((char) c)) {
                        buffer.append((char) c);
                    } else {
                        flushVariable();
                        restoreState();
                        reapply = true; // the terminator belongs to the enclosing context
                    }
                    break;
                case CHARACTER_CLASS:
                    reapply = processCharacterClass(c);
                    break;
                case ESCAPE:
                    if (c == EOL) throw error("Dangling '\\' at end of pattern");
                    restoreState();
                    if (state == State.CHARACTER_CLASS) classChar((char) c);
                    else buffer.append((char) c);
                    break;
            }
        } while (reapply);
    }

    private void processDefault(int c) {
        switch (c) {
            case '\\':
                enterState(State.ESCAPE);
                break;
            case '$':
                flushConstant();
                enterState(State.VARIABLE_NAME);
                break;
            case '(':
                flushConstant();
                enterState(State.DEFAULT);
                frames.add(Generator.newFrame());
                frames.add(Generator.newFrame());
                break;
            case ')':
                flushConstant();
                if (frames.size() < 3) throw error("Unmatched ')'");
                closeBranch();
                closeAlternation();
                restoreState();
                break;
            case '{':
                flushConstant();
                enterState(State.REPETITION_SPEC);
                break;
            case '[':
                flushConstant();
                rangePending = false;
                enterState(State.CHARACTER_CLASS);
                break;
            case '|':
                flushConstant();
                List<Node> branch = frames.set(frames.size() - 1, Generator.newFrame());
                frames.get(frames.size() - 2).add(new Series(branch));
                break;
            case EOL:
                flushConstant();
                if (frames.size() != 2) throw error("Unclosed '('");
                closeBranch();
                List<Node> branches = frames.set(0, Generator.newFrame());
                currentFrame().add(new Alternation(branches, randomSources.create()));
                break;
            default:
                buffer.append((char) c);
        }
    }

    private void processRepetitionSpec(int c) {
        if (c != EOL && isDigit((char) c)) {
            buffer.append((char) c);
            return;
        }
        if (c == EOL) throw error("Unterminated repetition spec");
        if (c != ',' && c != '}') throw error("Unexpected '" + (char) c + "' in repetition spec");

        bounds.add(parseBound());
        if (c == ',') {
            if (bounds.size() > 1) throw error("Too many repetition bounds");
            return;
        }

        if (bounds.size() == 1) bounds.add(bounds.get(0));
        int min = bounds.get(0);
        int max = bounds.get(1);
        bounds.clear();
        if (min > max) throw error("Repetition min " + min + " exceeds max " + max);
        if ((long) max - min >= Integer.MAX_VALUE) throw error("Repetition range too wide");

        List<Node> branch = currentFrame();
        if (branch.isEmpty()) throw error("Repetition without a preceding element");
        Node previous = branch.remove(branch.size() - 1);
        branch.add(new Repetition(min, max, previous, randomSources.create()));
        restoreState();
    }

    /** @return true if {@code c} must be processed again in the restored state */
    private boolean processCharacterClass(int c) {
        switch (c) {
            case '\\':
                enterState(State.ESCAPE);
                return false;
            case '-':
                rangePending = true;
                return false;
            case ']':
                restoreState();
                flushCharacterClass();
                return false;
            case EOL:
                // lenient: an unclosed class runs to the end of the pattern
                restoreState();
                flushCharacterClass();
                return true;
            default:
                classChar((char) c);
                return false;
        }
    }

    private void classChar(char c) {
        if (!rangePending) {
            buffer.append(c);
            return;
        }
        rangePending = false;
        if (buffer.length() == 0) return; // nothing to range from
        char from = buffer.charAt(buffer.length() - 1);
        if (from >= c) return; // reversed or empty range is dropped
        for (int ch = from + 1; ch <= c; ch++) {
            buffer.append((char) ch);
        }
    }

    private int parseBound() {
        if (buffer.length() == 0) return 0;
        String digits = buffer.toString();
        buffer.setLength(0);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error("Repetition bound out of range: " + digits);
        }
    }

    // -------------------------
    // Frames
    // -------------------------

    private List<Node> currentFrame() {
        return frames.get(frames.size() - 1);
    }

    private List<Node> popFrame() {
        return frames.remove(frames.size() - 1);
    }

    private void closeBranch() {
        Series series = new Series(popFrame());
        currentFrame().add(series);
    }

    private void closeAlternation() {
        Alternation alternation = new Alternation(popFrame(), randomSources.create());
        currentFrame().add(alternation);
    }

    private void flushConstant() {
        if (buffer.length() == 0) return;
        currentFrame().add(new Constant(buffer.toString()));
        buffer.setLength(0);
    }

    private void flushVariable() {
        if (buffer.length() == 0) return;
        currentFrame().add(new VariableReference(buffer.toString(), environment));
        buffer.setLength(0);
    }

    private void flushCharacterClass() {
        rangePending = false;
        if (buffer.length() == 0) return;
        currentFrame().add(new CharacterClass(buffer.toString(), randomSources.create()));
        buffer.setLength(0);
    }

    // -------------------------
    // States
    // -------------------------

    private void enterState(State s) {
        stateStack.push(state);
        state = s;
    }

    private void restoreState() {
        state = stateStack.pop();
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isDigit(c);
    }

    private PatternException error(String msg) {
        return new PatternException(pattern, current, msg);
    }
}
