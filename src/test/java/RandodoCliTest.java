import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.randodo.debug.Debug;
import com.randodo.pattern.RandodoCli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RandodoCliTest {

    private static final ObjectMapper om = new ObjectMapper();

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @AfterEach
    void resetDebugSink() {
        Debug.get().setSink(null);
    }

    private int run(String... args) {
        return RandodoCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String[] outLines() {
        return out.toString(StandardCharsets.UTF_8).split("\\R");
    }

    private Path config(String text) throws IOException {
        Path file = dir.resolve("config.rdd");
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void parseArgs_flagsAndSwitches() {
        Map<String, String> flags = RandodoCli.parseArgs(new String[] { "--config=a=b.txt", "--dump", "stray" });
        assertEquals("a=b.txt", flags.get("config"));
        assertEquals("true", flags.get("dump"));
        assertEquals(2, flags.size());
    }

    @Test
    void missingConfig_isUsageError() {
        assertEquals(RandodoCli.EXIT_USAGE, run("--count=3"));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }

    @Test
    void badCountOrFormat_isUsageError() throws IOException {
        Path file = config("a = x\n");
        assertEquals(RandodoCli.EXIT_USAGE, run("--config=" + file, "--count=many"));
        assertEquals(RandodoCli.EXIT_USAGE, run("--config=" + file, "--count=-1"));
        assertEquals(RandodoCli.EXIT_USAGE, run("--config=" + file, "--format=xml"));
        assertEquals(RandodoCli.EXIT_USAGE, run("--config=" + file, "--seed=abc"));
    }

    @Test
    void unreadableFile() {
        assertEquals(RandodoCli.EXIT_UNREADABLE, run("--config=" + dir.resolve("missing.rdd")));
    }

    @Test
    void badConfigLine() throws IOException {
        Path file = config("a = x\nnot an assignment\n");
        assertEquals(RandodoCli.EXIT_CONFIG_ERROR, run("--config=" + file));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[line 2]"));
    }

    @Test
    void unknownName() throws IOException {
        Path file = config("a = x\n");
        assertEquals(RandodoCli.EXIT_USAGE, run("--config=" + file, "--name=b"));
    }

    @Test
    void text_singleName_printsBareSamples() throws IOException {
        Path file = config("greeting = hello\nother = bye\n");
        assertEquals(RandodoCli.EXIT_OK, run("--config=" + file, "--name=greeting", "--count=3"));
        assertArrayEquals(new String[] { "hello", "hello", "hello" }, outLines());
    }

    @Test
    void text_allNames_arePrefixed() throws IOException {
        Path file = config("a = 1\nb = 2\n");
        assertEquals(RandodoCli.EXIT_OK, run("--config=" + file));
        assertArrayEquals(new String[] { "a = 1", "b = 2" }, outLines());
    }

    @Test
    void json_format() throws IOException {
        Path file = config("id = X[0-9]{2}\n");
        assertEquals(RandodoCli.EXIT_OK, run("--config=" + file, "--format=json", "--count=4", "--seed=3"));

        JsonNode arr = om.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(1, arr.size());
        assertEquals("id", arr.get(0).path("name").asText());
        JsonNode samples = arr.get(0).path("samples");
        assertEquals(4, samples.size());
        for (JsonNode s : samples) {
            assertTrue(s.asText().matches("X[0-9]{2}"), s.asText());
        }
    }

    @Test
    void seed_makesRunsRepeatable() throws IOException {
        Path file = config("token = [a-z0-9]{12}\n");
        run("--config=" + file, "--count=5", "--seed=7");
        String first = out.toString(StandardCharsets.UTF_8);
        out.reset();
        run("--config=" + file, "--count=5", "--seed=7");
        assertEquals(first, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void dump_printsTree() throws IOException {
        Path file = config("a = x|y\n");
        assertEquals(RandodoCli.EXIT_OK, run("--config=" + file, "--dump"));

        JsonNode dump = om.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals("alternation", dump.path("a").path("type").asText());
        assertEquals(2, dump.path("a").path("branches").size());
    }

    @Test
    void verbose_logsToErrorStreamOnly() throws IOException {
        Path file = config("a = x\n");
        assertEquals(RandodoCli.EXIT_OK, run("--config=" + file, "--verbose"));

        assertArrayEquals(new String[] { "x" }, outLines());
        String log = err.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("[TRACE][randodo.compile] Compiled pattern: x"), log);
        assertTrue(log.contains("[DEBUG][randodo.config] Defined a (line 1)"), log);
    }
}
