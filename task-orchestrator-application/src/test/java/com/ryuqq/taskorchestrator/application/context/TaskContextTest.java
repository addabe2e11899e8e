package com.ryuqq.taskorchestrator.application.context;

import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator;
import com.ryuqq.taskorchestrator.core.model.TaskSpec;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import com.ryuqq.taskorchestrator.core.outcome.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TaskContext 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TaskContextTest {

    @Mock
    private TaskOrchestrator orchestrator;

    private TaskContext context;

    @BeforeEach
    void setUp() {
        context = TaskContextBuilder.create()
            .moduleName("build")
            .tokens("web", "env=prod", "--verbose", "--level=3")
            .environment(Map.of("HOME", "/home/dev"))
            .workingDirectory(Paths.get("/tmp/project"))
            .orchestrator(orchestrator)
            .capability("greet", options -> Ok.of("hello " + options.getString("who").orElse("world")))
            .capability("broken", options -> {
                throw new IllegalStateException("offline");
            })
            .capability("silent", options -> null)
            .capability("sleepy", options -> {
                throw new InterruptedException("stop");
            })
            .build();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ========================================
    // 인자 / 환경
    // ========================================

    @Test
    void extract_명명_인자_조회() {
        assertThat(context.extract("env")).contains("prod");
        assertThat(context.extract("level")).contains("3");
        assertThat(context.extract("missing")).isEmpty();
        assertThat(context.extract("missing", "dev")).isEqualTo("dev");
    }

    @Test
    void has_플래그와_명명_인자() {
        assertThat(context.has("verbose")).isTrue();
        assertThat(context.has("env")).isTrue();
        assertThat(context.has("web")).isFalse();
    }

    @Test
    void 환경과_작업_디렉터리_조회() {
        assertThat(context.positional()).containsExactly("web");
        assertThat(context.env("HOME")).contains("/home/dev");
        assertThat(context.env("PATH")).isEmpty();
        assertThat(context.env(null)).isEmpty();
        assertThat(context.workingDirectory()).isEqualTo(Paths.get("/tmp/project"));
        assertThat(context.invocation().moduleName()).contains("build");
    }

    @Test
    void cmd_null_조각은_제외() {
        // given
        String flag = context.has("all") ? "-a" : null;

        // when
        List<String> args = context.cmd("ls", flag, "-la");

        // then
        assertThat(args).containsExactly("ls", "-la");
        assertThat(context.cmd()).isEmpty();
        assertThat(context.cmd((String[]) null)).isEmpty();
    }

    // ========================================
    // start
    // ========================================

    @Test
    void start_현재_호출_정보로_오케스트레이터에_위임() {
        // given
        Map<String, Object> tasks = Map.of("compile", TaskSpec.of("make", 1));
        RunOutcome expected = RunOutcome.settled(List.of(), List.of());
        when(orchestrator.start(eq(tasks), any())).thenReturn(expected);

        // when
        RunOutcome outcome = context.start(tasks);

        // then
        assertThat(outcome).isSameAs(expected);
        verify(orchestrator).start(tasks, context.invocation());
    }

    // ========================================
    // capability
    // ========================================

    @Test
    void invoke_등록된_capability_실행() {
        // when
        Outcome outcome = context.invoke("greet", Map.of("who", "team"));

        // then
        assertThat(outcome).isEqualTo(Ok.of("hello team"));
        assertThat(context.capabilityNames()).containsExactly("greet", "broken", "silent", "sleepy");
    }

    @Test
    void invoke_알_수_없는_capability는_예외() {
        assertThatThrownBy(() -> context.invoke("missing", Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown capability 'missing'")
            .hasMessageContaining("greet");
    }

    @Test
    void invoke_예외는_Fail로_변환() {
        // when
        Outcome outcome = context.invoke("broken", null);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail fail = (Fail) outcome;
        assertThat(fail.errorCode()).isEqualTo(TaskContext.CAPABILITY_ERROR);
        assertThat(fail.message()).contains("offline");
        assertThat(fail.cause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void invoke_null_결과는_Fail() {
        // when
        Outcome outcome = context.invoke("silent", Map.of());

        // then
        assertThat(outcome.isFail()).isTrue();
        assertThat(((Fail) outcome).errorCode()).isEqualTo(TaskContext.CAPABILITY_ERROR);
    }

    @Test
    void invoke_인터럽트는_플래그_복원() {
        // when
        Outcome outcome = context.invoke("sleepy", Map.of());

        // then
        assertThat(((Fail) outcome).errorCode()).isEqualTo(Fail.TASK_INTERRUPTED);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
