package io.controlplane.util;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EnvironmentUtils
 */
class EnvironmentUtilsTest {

    private final Function<String, String> env = Map.of(
        "NODE_ID", "  node-7 ",
        "BLANK", "   ",
        "NODE_INDEX", "2",
        "TOTAL_NODES", "three"
    )::get;

    @Test
    void testGetEnvWithValidValue() {
        assertEquals("node-7", EnvironmentUtils.getEnv(env, "NODE_ID", "default-value"));
    }

    @Test
    void testGetEnvWithMissingValue() {
        assertEquals("default-value", EnvironmentUtils.getEnv(env, "NON_EXISTENT_ENV_VAR_12345", "default-value"));
    }

    @Test
    void testGetEnvWithBlankValue() {
        assertEquals("default-value", EnvironmentUtils.getEnv(env, "BLANK", "default-value"));
    }

    @Test
    void testGetIntEnv() {
        assertEquals(2, EnvironmentUtils.getIntEnv(env, "NODE_INDEX", 0));
        assertEquals(1, EnvironmentUtils.getIntEnv(env, "TOTAL_NODES", 1));
        assertEquals(5, EnvironmentUtils.getIntEnv(env, "MISSING", 5));
        assertNull(EnvironmentUtils.getIntEnv(env, "MISSING", null));
    }
}
