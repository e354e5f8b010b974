package com.randodo.pattern;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import com.randodo.pattern.parser.Generator;
import com.randodo.pattern.parser.PlainRandomSource;
import com.randodo.pattern.parser.RandomSource;
import com.randodo.pattern.parser.VariableEnvironment;

/**
 * Random text generator engine.
 *
 * - Template files: one {@code name = pattern} per line, '#' comments
 * - Patterns: literals, [a-z0-9] classes, (a|b) groups, x{3} / x{2,5} repetition,
 *   $name references, \ escapes
 * - Randomness: one source per choice point, created by the configured factory
 *     - default: java.util.Random per node, seeded from a master Random
 *     - setSeed(long) makes the output of a whole file reproducible
 *
 * Settings apply to patterns compiled after they are set.
 */
public class Randodo {

    private final VariableEnvironment environment = new VariableEnvironment();
    private RandomSource.Factory randomSources = PlainRandomSource.seededFrom(new Random());
    private boolean optimize = true;

    public Randodo() {}

    public Randodo(RandomSource.Factory randomSources) {
        setRandomSources(randomSources);
    }

    public void setRandomSources(RandomSource.Factory randomSources) {
        if (randomSources == null) throw new IllegalArgumentException("randomSources is null");
        this.randomSources = randomSources;
    }

    public void setSeed(long seed) {
        this.randomSources = PlainRandomSource.seededFrom(new Random(seed));
    }

    public void setOptimize(boolean optimize) { this.optimize = optimize; }

    public VariableEnvironment environment() { return environment; }

    /** Loads a template file. Stops at the first bad line with a {@link ConfigException}. */
    public List<ConfigFile.Entry> load(Path file) throws IOException {
        ConfigFile config = newConfigFile();
        config.parse(file);
        return config.getLines();
    }

    /** Loads template text held in memory. */
    public List<ConfigFile.Entry> load(String text) {
        ConfigFile config = newConfigFile();
        config.parseText(text);
        return config.getLines();
    }

    /** Compiles {@code pattern} and binds it to {@code name}, replacing any earlier binding. */
    public void define(String name, String pattern) {
        environment.define(name, compile(pattern));
    }

    /** Compiles a pattern against the names defined so far without binding it. */
    public Generator.Node compile(String pattern) {
        return newConfigFile().compile(pattern);
    }

    /** @return generated text for {@code name}, or "" if the name is not defined */
    public String generate(String name) {
        Generator.Node root = environment.lookup(name);
        return (root == null) ? "" : Generator.generate(root);
    }

    public List<String> generate(String name, int count) {
        if (count < 0) throw new IllegalArgumentException("count < 0: " + count);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(generate(name));
        }
        return out;
    }

    public Set<String> names() {
        return environment.names();
    }

    /** Rejects any later definition. Call once every file is loaded. */
    public void freeze() {
        environment.freeze();
    }

    private ConfigFile newConfigFile() {
        ConfigFile config = new ConfigFile(environment, randomSources);
        config.setOptimize(optimize);
        return config;
    }
}
