package com.ryuqq.taskorchestrator.cli;

import com.ryuqq.taskorchestrator.adapter.runner.DispatchingCommandExecutor;
import com.ryuqq.taskorchestrator.adapter.runner.PriorityGroupScheduler;
import com.ryuqq.taskorchestrator.adapter.runner.SchedulerConfig;
import com.ryuqq.taskorchestrator.adapter.runner.SelectorConfig;
import com.ryuqq.taskorchestrator.application.context.TaskContext;
import com.ryuqq.taskorchestrator.application.context.TaskContextBuilder;
import com.ryuqq.taskorchestrator.application.module.TaskModule;
import com.ryuqq.taskorchestrator.application.module.TaskModuleRegistry;
import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.core.exception.ArgumentParseException;
import com.ryuqq.taskorchestrator.core.exception.SchedulingAbortedException;
import com.ryuqq.taskorchestrator.core.exception.TaskNotFoundException;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 오케스트레이터 진입점 명령.
 *
 * <p>{@code task-orchestrator [options] <module> [tokens...]} 형태로 호출합니다.
 * 옵션은 모듈 이름 앞에서만 인식되며, 모듈 이름 뒤의 토큰은 그대로 인자 파서에 전달됩니다.</p>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>{@value #EXIT_SUCCESS}: 모든 Task 성공</li>
 *   <li>{@value #EXIT_FAILED}: Task 실패 또는 모듈 오류</li>
 *   <li>{@value #EXIT_USAGE}: 알 수 없는 모듈, 사용법 오류</li>
 *   <li>{@value #EXIT_TASK_NOT_FOUND}: 선택된 Task 없음, 존재하지 않는 Task 지정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "task-orchestrator",
    mixinStandardHelpOptions = true,
    version = "Task Orchestrator 1.0.0",
    description = "Runs a task module's priority-grouped tasks"
)
public final class TaskOrchestratorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestratorCommand.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_TASK_NOT_FOUND = 3;

    @Spec
    private CommandSpec spec;

    @Option(names = "--list", description = "List the available task modules and exit")
    private boolean list;

    @Option(names = "--all-flag", paramLabel = "<name>", defaultValue = "all",
        description = "Flag that selects every task (default: ${DEFAULT-VALUE})")
    private String allFlag;

    @Option(names = "--default-priority", paramLabel = "<n>", defaultValue = "500",
        description = "Priority of tasks that declare none (default: ${DEFAULT-VALUE})")
    private int defaultPriority;

    @Option(names = "--quiet", description = "Do not print per-task progress")
    private boolean quiet;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<module>", description = "Task module to run")
    private String moduleName;

    @Parameters(index = "1..*", paramLabel = "<tokens>", description = "Arguments passed to the module")
    private List<String> tokens = new ArrayList<>();

    private final TaskModuleRegistry registry;
    private final CommandExecutor executor;
    private final Map<String, String> environment;
    private final Path workingDirectory;

    /**
     * 생성자 (ServiceLoader로 모듈 탐색, 현재 프로세스 환경 사용).
     */
    public TaskOrchestratorCommand() {
        this(TaskModuleRegistry.load(), new DispatchingCommandExecutor(),
            System.getenv(), Paths.get(System.getProperty("user.dir")));
    }

    /**
     * 생성자.
     *
     * @param registry 모듈 레지스트리
     * @param executor Task 실행기
     * @param environment 환경 변수 스냅샷 원본
     * @param workingDirectory 작업 디렉터리
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TaskOrchestratorCommand(TaskModuleRegistry registry, CommandExecutor executor,
                                   Map<String, String> environment, Path workingDirectory) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (workingDirectory == null) {
            throw new IllegalArgumentException("workingDirectory cannot be null");
        }
        this.registry = registry;
        this.executor = executor;
        this.environment = environment;
        this.workingDirectory = workingDirectory;
    }

    /**
     * 모듈 이름 뒤의 토큰을 옵션으로 해석하지 않도록 설정된 CommandLine 생성.
     *
     * @param command 명령
     * @return CommandLine
     */
    public static CommandLine commandLine(TaskOrchestratorCommand command) {
        return new CommandLine(command)
            .setStopAtPositional(true)
            .setUnmatchedOptionsArePositionalParams(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine(new TaskOrchestratorCommand()).execute(args));
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        CommandLine.Help.Ansi ansi = spec.commandLine().getColorScheme().ansi();

        if (list) {
            for (TaskModule module : registry.modules()) {
                String description = module.description();
                out.println(description.isEmpty() ? module.name() : module.name() + " - " + description);
            }
            out.flush();
            return EXIT_SUCCESS;
        }

        if (moduleName == null) {
            err.println("Missing task module; available: " + registry.names());
            spec.commandLine().usage(err, ansi);
            return EXIT_USAGE;
        }

        Optional<TaskModule> module = registry.find(moduleName);
        if (module.isEmpty()) {
            err.println("Unknown task module '" + moduleName + "'; available: " + registry.names());
            return EXIT_USAGE;
        }

        ConsoleSchedulerListener listener = new ConsoleSchedulerListener(out, ansi, quiet);
        PriorityGroupScheduler scheduler = new PriorityGroupScheduler(
            executor,
            new SchedulerConfig().withDefaultPriority(defaultPriority),
            new SelectorConfig().withRunAllFlag(allFlag),
            listener);

        try {
            TaskContext context = TaskContextBuilder.create()
                .moduleName(moduleName)
                .tokens(tokens)
                .environment(environment)
                .workingDirectory(workingDirectory)
                .orchestrator(scheduler)
                .build();

            log.debug("Running task module '{}' with tokens {}", moduleName, tokens);
            RunOutcome outcome = module.get().run(context);
            return exitCode(outcome, err);
        } catch (TaskNotFoundException e) {
            err.println(e.getMessage());
            return EXIT_TASK_NOT_FOUND;
        } catch (ArgumentParseException e) {
            err.println("Invalid arguments: " + e.getMessage());
            return EXIT_USAGE;
        } catch (SchedulingAbortedException e) {
            err.println(e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Task module '" + moduleName + "' interrupted");
            return EXIT_FAILED;
        } catch (Exception e) {
            log.error("Task module '{}' failed", moduleName, e);
            err.println("Task module '" + moduleName + "' failed: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int exitCode(RunOutcome outcome, PrintWriter err) {
        if (outcome == null) {
            err.println("Task module '" + moduleName + "' returned no outcome");
            return EXIT_FAILED;
        }
        if (outcome.isSuccess()) {
            return EXIT_SUCCESS;
        }
        if (outcome.isNothingSelected()) {
            err.println("No task selected; pass task names or --" + allFlag
                + ". Available: " + outcome.getAvailableTasks());
            return EXIT_TASK_NOT_FOUND;
        }
        err.println("Failed task(s): " + outcome.getFailedTasks()
            + (outcome.getSkipped().isEmpty() ? "" : "; skipped: " + outcome.getSkipped()));
        return EXIT_FAILED;
    }
}
