package com.randodo.pattern.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.randodo.debug.Debug;

public class Generator {

    public interface Node {
        /** Appends generated text to {@code output}. */
        void evaluate(StringBuilder output);

        /** True iff this node can only ever produce the empty string. */
        boolean isEmpty();

        /** Simplifies children in place. Idempotent. */
        void optimize();

        <R> R accept(Visitor<R> visitor);
    }

    public interface Visitor<R> {
        R visitConstant(Constant node);
        R visitCharacterClass(CharacterClass node);
        R visitRepetition(Repetition node);
        R visitSeries(Series node);
        R visitAlternation(Alternation node);
        R visitVariableReference(VariableReference node);
    }

    /** Evaluates {@code node} into a fresh string. */
    public static String generate(Node node) {
        StringBuilder out = new StringBuilder();
        node.evaluate(out);
        return out.toString();
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class Constant implements Node {
        public final String text;

        public Constant(String text) {
            this.text = text;
        }

        @Override
        public void evaluate(StringBuilder output) {
            output.append(text);
        }

        @Override
        public boolean isEmpty() {
            return text.isEmpty();
        }

        @Override
        public void optimize() {}

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    public static final class CharacterClass implements Node {
        public final String chars; // duplicates allowed, each occurrence weighs one draw slot
        private final int[] codePoints; // a surrogate pair is one draw slot
        private final RandomSource random;

        public CharacterClass(String chars, RandomSource random) {
            this.chars = chars;
            this.codePoints = chars.codePoints().toArray();
            this.random = random;
        }

        /** Number of draw slots, counted in code points. */
        public int size() {
            return codePoints.length;
        }

        @Override
        public void evaluate(StringBuilder output) {
            if (codePoints.length == 0) return;
            output.appendCodePoint(codePoints[random.pick(codePoints.length)]);
        }

        @Override
        public boolean isEmpty() {
            return chars.isEmpty();
        }

        @Override
        public void optimize() {}

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharacterClass(this);
        }
    }

    public static final class VariableReference implements Node {
        public final String name;
        private final VariableEnvironment environment; // not owned

        public VariableReference(String name, VariableEnvironment environment) {
            this.name = name;
            this.environment = environment;
        }

        @Override
        public void evaluate(StringBuilder output) {
            Node target = environment.lookup(name);
            if (target == null) {
                Debug.get().d("randodo.var", "Undefined variable: " + name);
                return;
            }
            target.evaluate(output);
        }

        /** Always false: answering would mean resolving the reference, which may be cyclic. */
        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public void optimize() {}

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableReference(this);
        }
    }

    // -------------------------
    // Composites
    // -------------------------

    public static final class Repetition implements Node {
        public final int min;
        public final int max;
        public final Node child;
        private final RandomSource random;

        public Repetition(int min, int max, Node child, RandomSource random) {
            if (min < 0 || min > max) {
                throw new IllegalArgumentException("Bad repetition bounds {" + min + "," + max + "}");
            }
            this.min = min;
            this.max = max;
            this.child = child;
            this.random = random;
        }

        @Override
        public void evaluate(StringBuilder output) {
            int howMany = min + random.pick(max - min + 1);
            for (int i = 0; i < howMany; i++) {
                child.evaluate(output);
            }
        }

        @Override
        public boolean isEmpty() {
            return min == 0 && max == 0;
        }

        @Override
        public void optimize() {
            child.optimize();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepetition(this);
        }
    }

    public static final class Series implements Node {
        private final List<Node> children;

        /** Copies {@code children}; later changes to the caller's list are not seen. */
        public Series(List<Node> children) {
            this.children = new ArrayList<>(children);
        }

        public List<Node> children() {
            return Collections.unmodifiableList(children);
        }

        @Override
        public void evaluate(StringBuilder output) {
            for (Node child : children) {
                child.evaluate(output);
            }
        }

        @Override
        public boolean isEmpty() {
            return children.isEmpty();
        }

        @Override
        public void optimize() {
            for (Node child : children) {
                child.optimize();
            }
            // stable: survivors keep their relative order
            Iterator<Node> it = children.iterator();
            while (it.hasNext()) {
                if (it.next().isEmpty()) it.remove();
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSeries(this);
        }
    }

    public static final class Alternation implements Node {
        private final List<Node> branches;
        private final RandomSource random;

        /** Copies {@code branches}, which must hold at least one branch. */
        public Alternation(List<Node> branches, RandomSource random) {
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("Alternation needs at least one branch");
            }
            this.branches = new ArrayList<>(branches);
            this.random = random;
        }

        public List<Node> branches() {
            return Collections.unmodifiableList(branches);
        }

        @Override
        public void evaluate(StringBuilder output) {
            branches.get(random.pick(branches.size())).evaluate(output);
        }

        /** Not computed: false even when every branch is empty. */
        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public void optimize() {
            for (Node branch : branches) {
                branch.optimize();
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlternation(this);
        }
    }

    static List<Node> newFrame() {
        return new ArrayList<Node>();
    }
}
