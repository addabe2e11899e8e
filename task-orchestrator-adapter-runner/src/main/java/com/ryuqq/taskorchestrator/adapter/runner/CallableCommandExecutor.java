package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.exception.TaskExecutionException;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.CallableCommand;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import com.ryuqq.taskorchestrator.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Callable Task 실행기.
 *
 * <p>{@link CallableCommand}의 동작을 호출 스레드에서 직접 실행합니다.
 * 반환값이 {@link CompletionStage} 또는 {@link Future}이면 완료될 때까지 대기한 뒤
 * 그 결과를 성공 값으로 사용합니다.</p>
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>정상 반환 → {@link Ok} (값 = 반환값)</li>
 *   <li>예외 → {@code Fail("TASK_ERROR")}, unchecked 예외는 그대로, checked 예외는
 *       {@link TaskExecutionException}으로 감싸 cause에 기록</li>
 *   <li>대기 중 인터럽트 → {@code Fail("TASK_INTERRUPTED")}, 인터럽트 플래그 복원</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CallableCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CallableCommandExecutor.class);

    @Override
    public ExecutionResult execute(TaskDescriptor descriptor, InvocationContext context) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (!(descriptor.command() instanceof CallableCommand callable)) {
            throw new IllegalArgumentException(
                "CallableCommandExecutor cannot run " + descriptor.command() + " (task: " + descriptor.name() + ")");
        }

        TaskName name = descriptor.name();
        long startNanos = System.nanoTime();
        Outcome outcome;
        try {
            Object value = await(callable.action().run(descriptor.parameters()));
            outcome = Ok.of(value);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task '{}' interrupted", name);
            outcome = Fail.of(Fail.TASK_INTERRUPTED, "Task '" + name + "' interrupted", e);
        } catch (ExecutionException e) {
            outcome = failure(name, e.getCause() == null ? e : e.getCause());
        } catch (Exception e) {
            outcome = failure(name, e);
        }
        return ExecutionResult.of(name, outcome, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private static Object await(Object value) throws InterruptedException, ExecutionException {
        if (value instanceof CompletionStage<?> stage) {
            return stage.toCompletableFuture().get();
        }
        if (value instanceof Future<?> future) {
            return future.get();
        }
        return value;
    }

    private static Fail failure(TaskName name, Throwable error) {
        Throwable cause = error instanceof RuntimeException ? error : new TaskExecutionException(name, error);
        return Fail.of(Fail.TASK_ERROR, "Task '" + name + "' failed: " + error.getMessage(), cause);
    }
}
