package com.ryuqq.taskorchestrator.cli.module;

import com.ryuqq.taskorchestrator.application.context.TaskContext;
import com.ryuqq.taskorchestrator.application.module.TaskModule;
import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.core.model.TaskAction;
import com.ryuqq.taskorchestrator.core.model.TaskSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 개발 환경 점검 모듈.
 *
 * <p>{@code task-orchestrator doctor --all} 또는 {@code task-orchestrator doctor java git}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DoctorModule implements TaskModule {

    @Override
    public String name() {
        return "doctor";
    }

    @Override
    public String description() {
        return "Checks the local toolchain";
    }

    @Override
    public RunOutcome run(TaskContext context) {
        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put("java", TaskSpec.of(
            (TaskAction) parameters -> System.getProperty("java.version"), 1));
        tasks.put("workdir", TaskSpec.of(
            (TaskAction) parameters -> context.workingDirectory().toString(), 1));
        tasks.put("git", TaskSpec.of(String.join(" ", context.cmd("git", "--version")), 2));
        tasks.put("docker", TaskSpec.of(String.join(" ", context.cmd("docker", "version",
            context.has("short") ? "--format={{.Server.Version}}" : null)), 3));
        return context.start(tasks);
    }
}
