package com.falkordb.cyphersat;

import com.falkordb.cyphersat.solver.Binding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that exercise the demo Main class code paths.
 */
public class MainTest {

    @Test
    @DisplayName("Test demo binds the only KNOWS path between persons")
    public void testRunDemo() {
        Optional<Binding> binding = Main.runDemo();

        assertTrue(binding.isPresent());
        assertEquals(Optional.of("alice"), binding.get().get("n"));
        assertEquals(Optional.of("k1"), binding.get().get("r"));
        assertEquals(Optional.of("bob"), binding.get().get("m"));
    }

    @Test
    @DisplayName("Test main runs without throwing")
    public void testMain() {
        assertDoesNotThrow(() -> Main.main(new String[0]));
    }

    @Test
    @DisplayName("Test Main cannot be instantiated")
    public void testPrivateConstructor() throws Exception {
        Constructor<Main> constructor = Main.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        InvocationTargetException thrown = assertThrows(
            InvocationTargetException.class, constructor::newInstance);
        assertInstanceOf(AssertionError.class, thrown.getCause());
    }
}
