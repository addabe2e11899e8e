package com.ryuqq.taskorchestrator.core.invocation;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InvocationContext 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InvocationContextTest {

    private static InvocationContext of(String... tokens) {
        return InvocationContext.of(ArgumentParser.parse(tokens), Map.of(), Paths.get("."));
    }

    @Test
    void extract_KeyValueAndDoubleDashForms_ReturnValue() {
        assertEquals(Optional.of("v"), of("k=v").extract("k"));
        assertEquals(Optional.of("v"), of("--k=v").extract("k"));
    }

    @Test
    void extract_RepeatedKey_ReturnsLastValue() {
        assertEquals(Optional.of("v2"), of("k=v1", "k=v2").extract("k"));
    }

    @Test
    void extract_MissingOrNullKey_ReturnsEmpty() {
        InvocationContext context = of("--flag", "pos");

        assertEquals(Optional.empty(), context.extract("missing"));
        assertEquals(Optional.empty(), context.extract("flag"));
        assertEquals(Optional.empty(), context.extract(null));
    }

    @Test
    void has_FlagOrNamedArgument_ReturnsTrue() {
        assertTrue(of("--k").has("k"));
        assertTrue(of("k=v").has("k"));
        assertTrue(of("--k=v").has("k"));
    }

    @Test
    void has_PositionalOrMissing_ReturnsFalse() {
        InvocationContext context = of("k");

        assertFalse(context.has("k"));
        assertFalse(context.has("other"));
        assertFalse(context.has(null));
    }

    @Test
    void environment_IsSnapshotCopy() {
        // Given
        Map<String, String> environment = new HashMap<>();
        environment.put("HOME", "/home/ci");

        // When
        InvocationContext context = InvocationContext.of(ArgumentParser.parse(), environment, Paths.get("."));
        environment.put("HOME", "/changed");

        // Then
        assertEquals("/home/ci", context.environment().get("HOME"));
        assertThrows(UnsupportedOperationException.class, () -> context.environment().put("X", "Y"));
    }

    @Test
    void workingDirectory_IsAbsoluteAndNormalized() {
        // When
        InvocationContext context = InvocationContext.of(ArgumentParser.parse(), Map.of(), Paths.get("a/../b"));

        // Then
        Path workingDirectory = context.workingDirectory();
        assertTrue(workingDirectory.isAbsolute());
        assertEquals(workingDirectory.normalize(), workingDirectory);
        assertTrue(workingDirectory.endsWith("b"));
    }

    @Test
    void moduleName_OptionalWhenBuiltProgrammatically() {
        assertEquals(Optional.empty(), of().moduleName());

        InvocationContext named = InvocationContext.of("deploy", ArgumentParser.parse(), Map.of(), Paths.get("."));
        assertEquals(Optional.of("deploy"), named.moduleName());
    }

    @Test
    void capture_UsesProcessEnvironmentAndUserDir() {
        // When
        InvocationContext context = InvocationContext.capture("build", List.of("a", "--all"));

        // Then
        assertEquals(Optional.of("build"), context.moduleName());
        assertEquals(List.of("a"), context.positional());
        assertTrue(context.flags().contains("all"));
        assertEquals(System.getenv(), context.environment());
        assertEquals(Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize(), context.workingDirectory());
    }

    @Test
    void of_NullArguments_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> InvocationContext.of(null, Map.of(), Paths.get(".")));
        assertThrows(IllegalArgumentException.class,
            () -> InvocationContext.of(ArgumentParser.parse(), null, Paths.get(".")));
        assertThrows(IllegalArgumentException.class,
            () -> InvocationContext.of(ArgumentParser.parse(), Map.of(), null));
    }
}
