package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.TaskCommand;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Ok;

import java.time.Duration;

/**
 * 명령 종류에 따라 실행기를 선택하는 기본 {@link CommandExecutor}.
 *
 * <ul>
 *   <li>Shell → {@link ShellCommandExecutor}</li>
 *   <li>Callable → {@link CallableCommandExecutor}</li>
 *   <li>No-op → 즉시 {@link Ok}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DispatchingCommandExecutor implements CommandExecutor {

    private final CommandExecutor shellExecutor;
    private final CommandExecutor callableExecutor;

    /**
     * 생성자 (기본 셸 설정).
     */
    public DispatchingCommandExecutor() {
        this(new ShellConfig());
    }

    /**
     * 생성자.
     *
     * @param shellConfig 셸 설정
     * @throws IllegalArgumentException shellConfig가 null인 경우
     */
    public DispatchingCommandExecutor(ShellConfig shellConfig) {
        this(new ShellCommandExecutor(shellConfig), new CallableCommandExecutor());
    }

    /**
     * 생성자 (실행기 주입).
     *
     * @param shellExecutor Shell Task 실행기
     * @param callableExecutor Callable Task 실행기
     * @throws IllegalArgumentException 실행기가 null인 경우
     */
    public DispatchingCommandExecutor(CommandExecutor shellExecutor, CommandExecutor callableExecutor) {
        if (shellExecutor == null) {
            throw new IllegalArgumentException("shellExecutor cannot be null");
        }
        if (callableExecutor == null) {
            throw new IllegalArgumentException("callableExecutor cannot be null");
        }
        this.shellExecutor = shellExecutor;
        this.callableExecutor = callableExecutor;
    }

    @Override
    public ExecutionResult execute(TaskDescriptor descriptor, InvocationContext context) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        TaskCommand command = descriptor.command();
        if (command.isShell()) {
            return shellExecutor.execute(descriptor, context);
        }
        if (command.isCallable()) {
            return callableExecutor.execute(descriptor, context);
        }
        return ExecutionResult.of(descriptor.name(), Ok.empty(), Duration.ZERO);
    }
}
