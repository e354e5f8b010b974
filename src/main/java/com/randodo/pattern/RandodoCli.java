package com.randodo.pattern;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.randodo.debug.Debug;
import com.randodo.debug.DebugLevel;
import com.randodo.pattern.json.GeneratorJson;
import com.randodo.pattern.parser.PatternException;

public final class RandodoCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_UNREADABLE = 3;

    private static final String USAGE =
            "Usage: RandodoCli --config=<file> [--name=<var>] [--count=N] [--seed=S]"
            + " [--format=text|json] [--dump] [--verbose]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> flags = parseArgs(args);

        String configPath = flags.get("config");
        if (configPath == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        final int count;
        try {
            count = Integer.parseInt(flags.getOrDefault("count", "1"));
        } catch (NumberFormatException e) {
            err.println("Bad --count: " + flags.get("count"));
            return EXIT_USAGE;
        }
        if (count < 0) {
            err.println("Bad --count: " + count);
            return EXIT_USAGE;
        }

        String format = flags.getOrDefault("format", "text");
        if (!format.equals("text") && !format.equals("json")) {
            err.println("Bad --format: " + format);
            return EXIT_USAGE;
        }

        if (flags.containsKey("verbose")) {
            Debug.useConsole(err, DebugLevel.TRACE);
        }

        Randodo engine = new Randodo();
        if (flags.containsKey("seed")) {
            try {
                engine.setSeed(Long.parseLong(flags.get("seed")));
            } catch (NumberFormatException e) {
                err.println("Bad --seed: " + flags.get("seed"));
                return EXIT_USAGE;
            }
        }

        Path path = Path.of(configPath);
        if (!Files.isReadable(path)) {
            err.println("Failed to read config file: " + path);
            return EXIT_UNREADABLE;
        }

        try {
            engine.load(path);
        } catch (IOException e) {
            err.println("Failed to read config file: " + path);
            e.printStackTrace(err);
            return EXIT_UNREADABLE;
        } catch (ConfigException | PatternException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        engine.freeze();

        List<String> names = new ArrayList<>();
        if (flags.containsKey("name")) {
            String name = flags.get("name");
            if (!engine.environment().exists(name)) {
                err.println("Unknown name: " + name);
                return EXIT_USAGE;
            }
            names.add(name);
        } else {
            names.addAll(engine.names());
        }

        if (flags.containsKey("dump")) {
            ObjectNode dump = GeneratorJson.mapper().createObjectNode();
            for (String name : names) {
                dump.set(name, GeneratorJson.toJson(engine.environment().lookup(name)));
            }
            out.println(GeneratorJson.pretty(dump));
            return EXIT_OK;
        }

        if (format.equals("json")) {
            ArrayNode arr = GeneratorJson.mapper().createArrayNode();
            for (String name : names) {
                arr.add(GeneratorJson.samplesToJson(name, engine.generate(name, count)));
            }
            out.println(arr.toString());
        } else {
            boolean prefix = names.size() > 1;
            for (String name : names) {
                for (String sample : engine.generate(name, count)) {
                    out.println(prefix ? name + " = " + sample : sample);
                }
            }
        }
        return EXIT_OK;
    }

    /**
     * Minimal arg parser:
     *   --config=/path/names.txt --name=id --count=10
     *   --seed=42 --format=json --dump --verbose
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private RandodoCli() {}
}
