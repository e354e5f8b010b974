import com.randodo.debug.Debug;
import com.randodo.pattern.ConfigException;
import com.randodo.pattern.ConfigFile;
import com.randodo.pattern.Randodo;
import com.randodo.pattern.parser.Generator;
import com.randodo.pattern.parser.PatternCompiler;
import com.randodo.pattern.parser.SequenceRandomSource;
import com.randodo.pattern.parser.VariableEnvironment;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs with whatever sink {@link Debug} starts with. No test in this class installs one,
 * so these cases cover the logging calls made before any caller configures the hub.
 */
public class DebugDefaultSinkTest {

    @Test
    void defaultSink_isInstalled() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("randodo.test", "dropped", new RuntimeException("x")));
    }

    @Test
    void compile_withoutConfiguredSink() {
        Generator.Node root = PatternCompiler.compile("abc", new VariableEnvironment(), SequenceRandomSource.perNode());
        assertEquals("abc", Generator.generate(root));
    }

    @Test
    void engineDefine_withoutConfiguredSink() {
        Randodo engine = new Randodo();
        engine.define("x", "abc");
        assertEquals("abc", engine.generate("x"));
        assertEquals("", engine.generate("missing"));
    }

    @Test
    void configParse_withoutConfiguredSink() {
        ConfigFile config = new ConfigFile(SequenceRandomSource.perNode());
        config.parseText("a = 1\nb = $a$ghost");
        assertEquals("1", Generator.generate(config.getEnvironment().lookup("b")));
        assertThrows(ConfigException.class, () -> config.parseText("bad line"));
    }
}
