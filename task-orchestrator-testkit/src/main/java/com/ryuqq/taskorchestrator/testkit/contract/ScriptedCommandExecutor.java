package com.ryuqq.taskorchestrator.testkit.contract;

import com.ryuqq.taskorchestrator.core.exception.TaskExecutionException;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import com.ryuqq.taskorchestrator.core.outcome.Outcome;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted in-memory implementation of {@link CommandExecutor} for testing.
 *
 * <p>Each task name can be given a behavior; unscripted tasks succeed immediately.
 * No subprocess is ever started, so scheduler contracts can be verified deterministically.</p>
 *
 * <p><strong>Thread-safety:</strong> Scripts and invocation records use concurrent collections;
 * tasks of one priority group call {@link #execute(TaskDescriptor, InvocationContext)} concurrently.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedCommandExecutor executor = new ScriptedCommandExecutor()
 *     .failWithExitCode("lint", 2)
 *     .respondWith("test", descriptor -&gt; {
 *         Thread.sleep(50);
 *         return Ok.of("passed");
 *     });
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedCommandExecutor implements CommandExecutor {

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final List<TaskName> executed = new CopyOnWriteArrayList<>();

    /**
     * Scripted task behavior.
     */
    @FunctionalInterface
    public interface Behavior {

        /**
         * Runs the scripted task.
         *
         * @param descriptor the task being executed
         * @return the outcome to report
         * @throws Exception reported as {@code Fail("TASK_ERROR")}
         */
        Outcome run(TaskDescriptor descriptor) throws Exception;
    }

    /**
     * Scripts a behavior for a task.
     *
     * @param taskName the task name
     * @param behavior the behavior
     * @return this executor
     */
    public ScriptedCommandExecutor respondWith(String taskName, Behavior behavior) {
        if (taskName == null || behavior == null) {
            throw new IllegalArgumentException("taskName and behavior cannot be null");
        }
        behaviors.put(taskName, behavior);
        return this;
    }

    /**
     * Scripts a task to succeed with a value.
     *
     * @param taskName the task name
     * @param value the success value
     * @return this executor
     */
    public ScriptedCommandExecutor succeedWith(String taskName, Object value) {
        return respondWith(taskName, descriptor -> Ok.of(value));
    }

    /**
     * Scripts a task to fail as if its process exited with the given code.
     *
     * @param taskName the task name
     * @param exitCode the exit code (non-zero)
     * @return this executor
     */
    public ScriptedCommandExecutor failWithExitCode(String taskName, int exitCode) {
        return respondWith(taskName, descriptor -> Fail.of(Fail.exitCode(exitCode),
            "Task '" + taskName + "' exited with code " + exitCode,
            new TaskExecutionException(descriptor.name(), exitCode)));
    }

    /**
     * Scripts a task to succeed after the given delay.
     *
     * @param taskName the task name
     * @param delay the delay
     * @return this executor
     */
    public ScriptedCommandExecutor succeedAfter(String taskName, Duration delay) {
        return respondWith(taskName, descriptor -> {
            Thread.sleep(delay.toMillis());
            return Ok.empty();
        });
    }

    @Override
    public ExecutionResult execute(TaskDescriptor descriptor, InvocationContext context) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        executed.add(descriptor.name());
        long startNanos = System.nanoTime();

        Behavior behavior = behaviors.get(descriptor.name().getValue());
        Outcome outcome;
        if (behavior == null) {
            outcome = Ok.empty();
        } else {
            try {
                outcome = behavior.run(descriptor);
                if (outcome == null) {
                    outcome = Fail.of(Fail.TASK_ERROR, "Script for task '" + descriptor.name() + "' returned no outcome");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = Fail.of(Fail.TASK_INTERRUPTED, "Task '" + descriptor.name() + "' interrupted", e);
            } catch (Exception e) {
                outcome = Fail.of(Fail.TASK_ERROR, "Task '" + descriptor.name() + "' failed: " + e.getMessage(), e);
            }
        }

        Integer exitCode = null;
        if (outcome instanceof Fail fail && fail.cause() instanceof TaskExecutionException failure) {
            exitCode = failure.getExitCode();
        }
        return new ExecutionResult(descriptor.name(), outcome, "", "", exitCode,
            Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Tasks executed so far, in invocation order.
     *
     * @return the task names
     */
    public List<TaskName> getExecutedTasks() {
        return List.copyOf(executed);
    }

    /**
     * Checks whether a task was executed.
     *
     * @param taskName the task name
     * @return true if executed at least once
     */
    public boolean wasExecuted(String taskName) {
        return executed.stream().anyMatch(name -> name.getValue().equals(taskName));
    }

    /**
     * Clears scripts and invocation records.
     */
    public void clear() {
        behaviors.clear();
        executed.clear();
    }
}
