package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.exception.TaskExecutionException;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.ShellCommand;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.outcome.Ok;
import com.ryuqq.taskorchestrator.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shell Task 실행기.
 *
 * <p>명령 문자열을 설정된 셸({@code sh -c} 또는 {@code cmd.exe /c})로 서브프로세스 실행합니다.</p>
 *
 * <p><strong>실행 환경:</strong></p>
 * <ul>
 *   <li>작업 디렉터리: {@link InvocationContext#workingDirectory()}</li>
 *   <li>환경 변수: 자식 프로세스 환경을 {@link InvocationContext#environment()} 스냅샷으로 교체</li>
 *   <li>표준 입력: 즉시 닫음</li>
 *   <li>표준 출력/에러: 별도 스레드에서 동시에 수집 (파이프 버퍼 교착 방지)</li>
 * </ul>
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>exit 0 → {@link Ok} (값 = stdout)</li>
 *   <li>exit n ≠ 0 → {@code Fail("TASK_EXIT_n")}, cause = {@link TaskExecutionException}</li>
 *   <li>프로세스 시작 실패 → {@code Fail("TASK_LAUNCH")}</li>
 *   <li>대기 중 인터럽트 → 프로세스 강제 종료, {@code Fail("TASK_INTERRUPTED")}</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 상태가 없으므로 여러 스레드에서 동시에 호출할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShellCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandExecutor.class);

    private final ShellConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public ShellCommandExecutor() {
        this(new ShellConfig());
    }

    /**
     * 생성자.
     *
     * @param config 셸 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ShellCommandExecutor(ShellConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public ExecutionResult execute(TaskDescriptor descriptor, InvocationContext context) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (!(descriptor.command() instanceof ShellCommand shell)) {
            throw new IllegalArgumentException(
                "ShellCommandExecutor cannot run " + descriptor.command() + " (task: " + descriptor.name() + ")");
        }

        TaskName name = descriptor.name();
        List<String> command = new ArrayList<>(config.shellCommand());
        command.add(shell.commandLine());
        log.debug("Task '{}' running: {} (dir: {})", name, shell.commandLine(), context.workingDirectory());

        long startNanos = System.nanoTime();
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                .directory(context.workingDirectory().toFile())
                .redirectErrorStream(false);
            Map<String, String> environment = builder.environment();
            environment.clear();
            environment.putAll(context.environment());
            process = builder.start();
        } catch (IOException | RuntimeException e) {
            log.error("Task '{}' could not be launched", name, e);
            return ExecutionResult.of(name,
                Fail.of(Fail.TASK_LAUNCH, "Task '" + name + "' could not be launched: " + e.getMessage(), e),
                elapsedSince(startNanos));
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Task '{}' stdin could not be closed", name, e);
        }

        StreamCollector stdout = new StreamCollector(name, process.getInputStream(), false);
        StreamCollector stderr = new StreamCollector(name, process.getErrorStream(), true);
        Thread stdoutThread = stdout.start("stdout");
        Thread stderrThread = stderr.start("stderr");

        int exitCode;
        try {
            exitCode = process.waitFor();
            stdoutThread.join();
            stderrThread.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.warn("Task '{}' interrupted while waiting for its process", name);
            return new ExecutionResult(name,
                Fail.of(Fail.TASK_INTERRUPTED, "Task '" + name + "' interrupted", e),
                stdout.text(), stderr.text(), null, elapsedSince(startNanos));
        }

        Duration elapsed = elapsedSince(startNanos);
        Outcome outcome;
        if (exitCode == 0) {
            outcome = Ok.of(stdout.text());
        } else {
            outcome = Fail.of(Fail.exitCode(exitCode),
                "Task '" + name + "' exited with code " + exitCode,
                new TaskExecutionException(name, exitCode));
        }
        return new ExecutionResult(name, outcome, stdout.text(), stderr.text(), exitCode, elapsed);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * 서브프로세스 출력 스트림 수집기.
     */
    private final class StreamCollector implements Runnable {

        private final TaskName name;
        private final InputStream stream;
        private final boolean errorStream;
        private final List<String> lines = new ArrayList<>();

        private StreamCollector(TaskName name, InputStream stream, boolean errorStream) {
            this.name = name;
            this.stream = stream;
            this.errorStream = errorStream;
        }

        private Thread start(String suffix) {
            Thread thread = new Thread(this, "task-" + name + "-" + suffix);
            thread.setDaemon(true);
            thread.start();
            return thread;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, Charset.defaultCharset()))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (lines) {
                        lines.add(line);
                    }
                    echo(line);
                }
            } catch (IOException e) {
                log.warn("Task '{}' output could not be read", name, e);
            }
        }

        private void echo(String line) {
            if (!config.echoOutput()) {
                return;
            }
            if (errorStream) {
                log.warn("[{}] {}", name, line);
            } else {
                log.info("[{}] {}", name, line);
            }
        }

        private String text() {
            synchronized (lines) {
                return String.join("\n", lines);
            }
        }
    }
}
