package com.ryuqq.taskorchestrator.cli;

import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener;
import com.ryuqq.taskorchestrator.core.model.Priority;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.util.List;

/**
 * 스케줄러 진행 상황을 콘솔에 출력하는 리스너.
 *
 * <p>Task 이벤트는 작업 스레드에서 호출되므로 출력 단위마다 writer를 잠급니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ConsoleSchedulerListener implements SchedulerListener {

    private final PrintWriter out;
    private final Ansi ansi;
    private final boolean quiet;

    ConsoleSchedulerListener(PrintWriter out, Ansi ansi, boolean quiet) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (ansi == null) {
            throw new IllegalArgumentException("ansi cannot be null");
        }
        this.out = out;
        this.ansi = ansi;
        this.quiet = quiet;
    }

    @Override
    public void onGroupStarted(Priority priority, List<TaskDescriptor> group) {
        print("@|bold,fg(yellow) [PRIORITY " + priority + "]|@ starting " + group.size()
            + " task" + (group.size() != 1 ? "s" : ""));
    }

    @Override
    public void onTaskFinished(TaskDescriptor descriptor, ExecutionResult result) {
        if (result.isSuccess()) {
            print("  @|fg(green) OK|@ " + descriptor.name() + " (" + result.elapsed().toMillis() + "ms)");
            return;
        }
        String code = result.failure().map(Fail::errorCode).orElse("FAIL");
        print("  @|fg(red) FAIL|@ " + descriptor.name() + " [" + code + "] "
            + result.failure().map(Fail::message).orElse(""));
        if (!result.stderr().isEmpty()) {
            print(result.stderr());
        }
    }

    @Override
    public void onTaskSkipped(TaskDescriptor descriptor) {
        print("  @|fg(magenta) SKIP|@ " + descriptor.name());
    }

    @Override
    public void onRunSettled(RunOutcome outcome) {
        if (outcome.isNothingSelected()) {
            return;
        }
        int failed = outcome.getFailedTasks().size();
        int passed = outcome.getResults().size() - failed;
        print("@|bold Done|@ @|fg(green) " + passed + " passed|@"
            + (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")
            + (outcome.getSkipped().isEmpty() ? "" : ", " + outcome.getSkipped().size() + " skipped"));
    }

    private void print(String markup) {
        if (quiet) {
            return;
        }
        synchronized (out) {
            out.println(ansi.string(markup));
            out.flush();
        }
    }
}
