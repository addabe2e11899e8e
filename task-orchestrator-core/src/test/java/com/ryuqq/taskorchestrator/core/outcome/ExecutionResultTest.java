package com.ryuqq.taskorchestrator.core.outcome;

import com.ryuqq.taskorchestrator.core.model.TaskName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionResult 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionResultTest {

    private static final TaskName NAME = TaskName.of("build");

    @Test
    void of_OkOutcome_IsSuccess() {
        // When
        ExecutionResult result = ExecutionResult.of(NAME, Ok.of("artifact"), Duration.ofMillis(5));

        // Then
        assertTrue(result.isSuccess());
        assertEquals(Optional.of("artifact"), result.value());
        assertEquals(Optional.empty(), result.failure());
        assertEquals(OptionalInt.empty(), result.exitCodeIfPresent());
        assertEquals("", result.stdout());
        assertEquals("", result.stderr());
    }

    @Test
    void constructor_FailOutcome_ExposesFailure() {
        // Given
        Fail fail = Fail.of(Fail.exitCode(1), "exit 1");

        // When
        ExecutionResult result = new ExecutionResult(NAME, fail, "out", "err", 1, null);

        // Then
        assertFalse(result.isSuccess());
        assertEquals(Optional.of(fail), result.failure());
        assertEquals(Optional.empty(), result.value());
        assertEquals(OptionalInt.of(1), result.exitCodeIfPresent());
        assertEquals(Duration.ZERO, result.elapsed());
        assertTrue(result.toString().contains("TASK_EXIT_1"));
    }

    @Test
    void constructor_NullStreams_BecomeEmpty() {
        // When
        ExecutionResult result = new ExecutionResult(NAME, Ok.empty(), null, null, 0, Duration.ZERO);

        // Then
        assertEquals("", result.stdout());
        assertEquals("", result.stderr());
    }

    @Test
    void constructor_NullNameOrOutcome_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionResult.of(null, Ok.empty(), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> ExecutionResult.of(NAME, null, Duration.ZERO));
    }
}
