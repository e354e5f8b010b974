import com.randodo.pattern.parser.Generator;
import com.randodo.pattern.parser.VariableEnvironment;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VariableEnvironmentTest {

    @Test
    void define_lookup_inInsertionOrder() {
        VariableEnvironment env = new VariableEnvironment();
        env.define("b", new Generator.Constant("B"));
        env.define("a", new Generator.Constant("A"));

        assertEquals(List.of("b", "a"), new ArrayList<>(env.names()));
        assertEquals("A", Generator.generate(env.lookup("a")));
        assertTrue(env.exists("b"));
        assertFalse(env.exists("c"));
        assertNull(env.lookup("c"));
    }

    @Test
    void redefine_replacesButKeepsPosition() {
        VariableEnvironment env = new VariableEnvironment();
        env.define("x", new Generator.Constant("1"));
        env.define("y", new Generator.Constant("2"));
        env.define("x", new Generator.Constant("3"));

        assertEquals(2, env.size());
        assertEquals(List.of("x", "y"), new ArrayList<>(env.names()));
        assertEquals("3", Generator.generate(env.lookup("x")));
    }

    @Test
    void names_isReadOnly() {
        VariableEnvironment env = new VariableEnvironment();
        env.define("x", new Generator.Constant("1"));
        assertThrows(UnsupportedOperationException.class, () -> env.names().remove("x"));
    }

    @Test
    void freeze_rejectsDefinitions() {
        VariableEnvironment env = new VariableEnvironment();
        env.define("x", new Generator.Constant("1"));
        env.freeze();

        assertTrue(env.isFrozen());
        assertThrows(IllegalStateException.class, () -> env.define("y", new Generator.Constant("2")));
        assertThrows(IllegalStateException.class, () -> env.define("x", new Generator.Constant("2")));
        assertEquals("1", Generator.generate(env.lookup("x")));
    }

    @Test
    void define_rejectsMissingArguments() {
        VariableEnvironment env = new VariableEnvironment();
        assertThrows(IllegalArgumentException.class, () -> env.define("", new Generator.Constant("1")));
        assertThrows(IllegalArgumentException.class, () -> env.define("x", null));
    }
}
