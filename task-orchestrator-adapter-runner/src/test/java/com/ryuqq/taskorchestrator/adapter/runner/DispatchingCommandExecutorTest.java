package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.ArgumentParser;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.NoOpCommand;
import com.ryuqq.taskorchestrator.core.model.Priority;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.model.TaskParameters;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * DispatchingCommandExecutor 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DispatchingCommandExecutorTest {

    @Mock
    private CommandExecutor shellExecutor;

    @Mock
    private CommandExecutor callableExecutor;

    private DispatchingCommandExecutor executor;
    private InvocationContext invocation;

    @BeforeEach
    void setUp() {
        executor = new DispatchingCommandExecutor(shellExecutor, callableExecutor);
        invocation = InvocationContext.of(ArgumentParser.parse(), Map.of(), Paths.get("."));
    }

    @Test
    void execute_Shell_Task는_Shell_실행기로_위임() {
        // given
        TaskDescriptor descriptor = TaskDescriptor.shell("s", "echo", 1);
        ExecutionResult expected = ExecutionResult.of(descriptor.name(), Ok.empty(), Duration.ZERO);
        when(shellExecutor.execute(descriptor, invocation)).thenReturn(expected);

        // when
        ExecutionResult result = executor.execute(descriptor, invocation);

        // then
        assertThat(result).isSameAs(expected);
        verifyNoInteractions(callableExecutor);
    }

    @Test
    void execute_Callable_Task는_Callable_실행기로_위임() {
        // given
        TaskDescriptor descriptor = TaskDescriptor.callable("c", parameters -> null, 1);
        when(callableExecutor.execute(any(), any()))
            .thenReturn(ExecutionResult.of(descriptor.name(), Ok.empty(), Duration.ZERO));

        // when
        executor.execute(descriptor, invocation);

        // then
        verify(callableExecutor).execute(descriptor, invocation);
        verifyNoInteractions(shellExecutor);
    }

    @Test
    void execute_NoOp_Task는_즉시_성공() {
        // given
        TaskDescriptor descriptor = new TaskDescriptor(TaskName.of("n"), NoOpCommand.INSTANCE,
            Priority.of(1), TaskParameters.empty());

        // when
        ExecutionResult result = executor.execute(descriptor, invocation);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEmpty();
        verifyNoInteractions(shellExecutor, callableExecutor);
    }

    @Test
    void constructor_실행기가_null이면_예외() {
        assertThatThrownBy(() -> new DispatchingCommandExecutor(null, callableExecutor))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("shellExecutor cannot be null");
        assertThatThrownBy(() -> new DispatchingCommandExecutor(shellExecutor, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("callableExecutor cannot be null");
    }
}
