package com.ryuqq.taskorchestrator.application.module;

import com.ryuqq.taskorchestrator.application.context.TaskContext;
import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskModuleRegistry 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskModuleRegistryTest {

    private static TaskModule module(String name) {
        return new TaskModule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public RunOutcome run(TaskContext context) {
                return RunOutcome.settled(List.of(), List.of());
            }
        };
    }

    @Test
    void 이름순으로_모듈_조회() {
        // given
        TaskModule build = module("build");
        TaskModule deploy = module("deploy");

        // when
        TaskModuleRegistry registry = new TaskModuleRegistry(List.of(deploy, build));

        // then
        assertThat(registry.names()).containsExactly("build", "deploy");
        assertThat(registry.find("build")).containsSame(build);
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.modules()).containsExactly(build, deploy);
    }

    @Test
    void 중복_이름은_먼저_등록된_모듈_유지() {
        // given
        TaskModule first = module("build");
        TaskModule second = module("build");

        // when
        TaskModuleRegistry registry = new TaskModuleRegistry(List.of(first, second));

        // then
        assertThat(registry.names()).containsExactly("build");
        assertThat(registry.find("build")).containsSame(first);
    }

    @Test
    void 빈_이름은_예외() {
        assertThatThrownBy(() -> new TaskModuleRegistry(List.of(module(" "))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be null or blank");
        assertThatThrownBy(() -> new TaskModuleRegistry(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_ServiceLoader_등록이_없으면_빈_레지스트리() {
        // when
        TaskModuleRegistry registry = TaskModuleRegistry.load(TaskModuleRegistryTest.class.getClassLoader());

        // then
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void description_기본값은_빈_문자열() {
        assertThat(module("build").description()).isEmpty();
    }
}
