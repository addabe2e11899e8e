package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener;
import com.ryuqq.taskorchestrator.application.orchestrator.TaskOrchestrator;
import com.ryuqq.taskorchestrator.core.exception.TaskNotFoundException;
import com.ryuqq.taskorchestrator.core.executor.CommandExecutor;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.Priority;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;
import com.ryuqq.taskorchestrator.core.outcome.Fail;
import com.ryuqq.taskorchestrator.core.statemachine.RunState;
import com.ryuqq.taskorchestrator.core.statemachine.RunStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 우선순위 그룹 스케줄러 ({@link TaskOrchestrator} 기본 구현체).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * start(taskMap, context)
 *   ↓
 * IDLE → SELECTING: 정규화 + run-set 선택
 *   ├─ 선택 없음 → SETTLED_FAILURE (RunOutcome.nothingSelected)
 *   └─ 없는 이름 지정 → SETTLED_FAILURE + TaskNotFoundException
 *   ↓
 * GROUPING: 우선순위별 그룹화 (TreeMap, 오름차순)
 *   └─ 빈 run-set → SETTLED_SUCCESS
 *   ↓
 * RUNNING: 그룹마다
 *   1. 그룹의 모든 Task를 스레드 풀에 한 번에 제출
 *   2. 모든 Task 종료까지 대기 (barrier)
 *   3. 실패가 있으면 남은 그룹의 Task를 skipped로 기록하고 중단
 *   ↓
 * SETTLED_SUCCESS | SETTLED_FAILURE
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>호출마다 전용 스레드 풀 생성 (이름: {@code task-orchestrator-N}), 종료 시 shutdown</li>
 *   <li>기본은 무제한 캐시 풀: 같은 그룹의 Task가 모두 함께 시작됨</li>
 *   <li>{@link SchedulerConfig#maxParallelism()} &gt; 0이면 고정 크기 풀로 동시 실행 수 제한</li>
 *   <li>barrier 대기는 인터럽트로 중단되지 않음: 실패 그룹도 모든 Task가 끝난 뒤 보고 (인터럽트 플래그는 복원)</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 호출 간 공유 상태가 없으므로 여러 스레드에서 동시에
 * {@link #start(Map, InvocationContext)}를 호출할 수 있습니다 (중첩 호출 포함).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PriorityGroupScheduler implements TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PriorityGroupScheduler.class);

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final CommandExecutor executor;
    private final SchedulerConfig config;
    private final TaskDescriptorNormalizer normalizer;
    private final TaskSelector selector;
    private final SchedulerListener listener;

    /**
     * 생성자 (기본 실행기, 기본 설정).
     */
    public PriorityGroupScheduler() {
        this(new DispatchingCommandExecutor());
    }

    /**
     * 생성자 (기본 설정).
     *
     * @param executor Task 실행기
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public PriorityGroupScheduler(CommandExecutor executor) {
        this(executor, new SchedulerConfig(), new SelectorConfig(), SchedulerListener.NOOP);
    }

    /**
     * 생성자.
     *
     * @param executor Task 실행기
     * @param config 스케줄러 설정
     * @param selectorConfig 선택 설정
     * @param listener 실행 이벤트 수신자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PriorityGroupScheduler(CommandExecutor executor, SchedulerConfig config,
                                  SelectorConfig selectorConfig, SchedulerListener listener) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (selectorConfig == null) {
            throw new IllegalArgumentException("selectorConfig cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.executor = executor;
        this.config = config;
        this.normalizer = new TaskDescriptorNormalizer(Priority.of(config.defaultPriority()));
        this.selector = new TaskSelector(selectorConfig);
        this.listener = listener;
    }

    @Override
    public RunOutcome start(Map<String, ?> taskMap, InvocationContext context) {
        if (taskMap == null) {
            throw new IllegalArgumentException("taskMap cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        RunState state = RunStateTransition.transition(RunState.IDLE, RunState.SELECTING);
        List<TaskDescriptor> descriptors = normalizer.normalize(taskMap);
        TaskSelector.Selection selection;
        try {
            selection = selector.select(descriptors, context);
        } catch (TaskNotFoundException e) {
            RunStateTransition.transition(state, RunState.SETTLED_FAILURE);
            log.warn("{}", e.getMessage());
            throw e;
        }

        if (selection.nothingSelected()) {
            RunStateTransition.transition(state, RunState.SETTLED_FAILURE);
            List<TaskName> available = descriptors.stream().map(TaskDescriptor::name).collect(Collectors.toUnmodifiableList());
            log.warn("No task selected; pass task names, --{} or task=<names>. Available: {}",
                selector.runAllFlag(), available);
            RunOutcome outcome = RunOutcome.nothingSelected(available);
            notify(l -> l.onRunSettled(outcome));
            return outcome;
        }

        state = RunStateTransition.transition(state, RunState.GROUPING);
        List<TaskDescriptor> runSet = selection.runSet();
        NavigableMap<Priority, List<TaskDescriptor>> groups = group(runSet);
        notify(l -> l.onRunStarted(context, runSet));

        if (groups.isEmpty()) {
            RunStateTransition.transition(state, RunState.SETTLED_SUCCESS);
            log.info("Run-set is empty; nothing to execute");
            RunOutcome outcome = RunOutcome.settled(List.of(), List.of());
            notify(l -> l.onRunSettled(outcome));
            return outcome;
        }

        state = RunStateTransition.transition(state, RunState.RUNNING);
        log.info("Running {} task(s) in {} priority group(s): {}", runSet.size(), groups.size(), groups.keySet());
        RunOutcome outcome = runGroups(groups, context);
        RunStateTransition.transition(state, outcome.getState());

        if (outcome.isSuccess()) {
            log.info("Run settled successfully ({} task(s))", outcome.getResults().size());
        } else {
            log.error("Run failed: failed={}, skipped={}", outcome.getFailedTasks(), outcome.getSkipped());
        }
        notify(l -> l.onRunSettled(outcome));
        return outcome;
    }

    /**
     * 우선순위별 그룹화 (오름차순, 그룹 내 선언 순서 유지).
     *
     * @param runSet 실행할 Task
     * @return 우선순위 → Task 목록
     */
    static NavigableMap<Priority, List<TaskDescriptor>> group(List<TaskDescriptor> runSet) {
        NavigableMap<Priority, List<TaskDescriptor>> groups = new TreeMap<>();
        for (TaskDescriptor descriptor : runSet) {
            groups.computeIfAbsent(descriptor.priority(), priority -> new ArrayList<>()).add(descriptor);
        }
        return groups;
    }

    private RunOutcome runGroups(NavigableMap<Priority, List<TaskDescriptor>> groups, InvocationContext context) {
        List<ExecutionResult> results = new ArrayList<>();
        List<TaskName> skipped = new ArrayList<>();
        ExecutorService pool = newPool();
        try {
            Iterator<Map.Entry<Priority, List<TaskDescriptor>>> iterator = groups.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<Priority, List<TaskDescriptor>> entry = iterator.next();
                List<ExecutionResult> groupResults = runGroup(pool, entry.getKey(), entry.getValue(), context);
                results.addAll(groupResults);

                boolean failed = groupResults.stream().anyMatch(result -> !result.isSuccess());
                if (failed) {
                    // 이후 그룹은 시작하지 않음
                    while (iterator.hasNext()) {
                        for (TaskDescriptor descriptor : iterator.next().getValue()) {
                            skipped.add(descriptor.name());
                            log.debug("Task '{}' skipped", descriptor.name());
                            notify(l -> l.onTaskSkipped(descriptor));
                        }
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return RunOutcome.settled(results, skipped);
    }

    private List<ExecutionResult> runGroup(ExecutorService pool, Priority priority,
                                           List<TaskDescriptor> group, InvocationContext context) {
        log.info("Starting priority group {} with {} task(s)", priority.value(), group.size());
        notify(l -> l.onGroupStarted(priority, group));

        List<Future<ExecutionResult>> futures = new ArrayList<>(group.size());
        for (TaskDescriptor descriptor : group) {
            futures.add(pool.submit(() -> runTask(descriptor, context)));
        }

        List<ExecutionResult> results = new ArrayList<>(group.size());
        for (int i = 0; i < group.size(); i++) {
            results.add(awaitUninterruptibly(group.get(i), futures.get(i)));
        }

        long failures = results.stream().filter(result -> !result.isSuccess()).count();
        log.info("Priority group {} settled ({} succeeded, {} failed)",
            priority.value(), results.size() - failures, failures);
        notify(l -> l.onGroupSettled(priority, results));
        return results;
    }

    private ExecutionResult runTask(TaskDescriptor descriptor, InvocationContext context) {
        log.debug("Task '{}' started (priority {})", descriptor.name(), descriptor.priority().value());
        notify(l -> l.onTaskStarted(descriptor));

        ExecutionResult result;
        try {
            result = executor.execute(descriptor, context);
            if (result == null) {
                result = ExecutionResult.of(descriptor.name(),
                    Fail.of(Fail.TASK_ERROR, "Executor returned no result for task '" + descriptor.name() + "'"),
                    Duration.ZERO);
            }
        } catch (RuntimeException e) {
            result = ExecutionResult.of(descriptor.name(),
                Fail.of(Fail.TASK_ERROR, "Task '" + descriptor.name() + "' failed: " + e.getMessage(), e),
                Duration.ZERO);
        }

        if (result.isSuccess()) {
            log.debug("Task '{}' succeeded in {} ms", descriptor.name(), result.elapsed().toMillis());
        } else {
            Fail fail = result.failure().orElseThrow();
            log.error("Task '{}' failed [{}]: {}", descriptor.name(), fail.errorCode(), fail.message(), fail.cause());
        }

        ExecutionResult finished = result;
        notify(l -> l.onTaskFinished(descriptor, finished));
        return finished;
    }

    /**
     * 인터럽트와 무관하게 Task 종료까지 대기.
     *
     * @param descriptor Task
     * @param future 제출된 Task
     * @return 실행 결과
     */
    private ExecutionResult awaitUninterruptibly(TaskDescriptor descriptor, Future<ExecutionResult> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    return ExecutionResult.of(descriptor.name(),
                        Fail.of(Fail.TASK_ERROR, "Task '" + descriptor.name() + "' failed: " + cause.getMessage(), cause),
                        Duration.ZERO);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ExecutorService newPool() {
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "task-orchestrator-" + THREAD_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        if (config.isBounded()) {
            return Executors.newFixedThreadPool(config.maxParallelism(), threadFactory);
        }
        return Executors.newCachedThreadPool(threadFactory);
    }

    private void notify(Consumer<SchedulerListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            log.warn("SchedulerListener threw an exception; ignoring", e);
        }
    }
}
