package com.ryuqq.taskorchestrator.testkit.contract;

import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;
import com.ryuqq.taskorchestrator.application.orchestrator.SchedulerListener;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.Priority;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.outcome.ExecutionResult;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link SchedulerListener} that records every scheduler event in arrival order.
 *
 * <p>Events are appended to a single thread-safe log, so the relative order of
 * task starts and finishes across worker threads can be asserted. The listener also
 * tracks how many tasks were running at the same time.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingSchedulerListener implements SchedulerListener {

    /**
     * Recorded event type.
     */
    public enum EventType {
        RUN_STARTED,
        GROUP_STARTED,
        TASK_STARTED,
        TASK_FINISHED,
        GROUP_SETTLED,
        TASK_SKIPPED,
        RUN_SETTLED
    }

    /**
     * One recorded event.
     *
     * @param type the event type
     * @param subject task name, priority value, or empty for run events
     */
    public record Event(EventType type, String subject) {
        @Override
        public String toString() {
            return subject.isEmpty() ? type.name() : type + ":" + subject;
        }
    }

    private final List<Event> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private volatile RunOutcome lastOutcome;

    @Override
    public void onRunStarted(InvocationContext context, List<TaskDescriptor> runSet) {
        events.add(new Event(EventType.RUN_STARTED, ""));
    }

    @Override
    public void onGroupStarted(Priority priority, List<TaskDescriptor> group) {
        events.add(new Event(EventType.GROUP_STARTED, String.valueOf(priority.value())));
    }

    @Override
    public void onTaskStarted(TaskDescriptor descriptor) {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        events.add(new Event(EventType.TASK_STARTED, descriptor.name().getValue()));
    }

    @Override
    public void onTaskFinished(TaskDescriptor descriptor, ExecutionResult result) {
        events.add(new Event(EventType.TASK_FINISHED, descriptor.name().getValue()));
        running.decrementAndGet();
    }

    @Override
    public void onGroupSettled(Priority priority, List<ExecutionResult> results) {
        events.add(new Event(EventType.GROUP_SETTLED, String.valueOf(priority.value())));
    }

    @Override
    public void onTaskSkipped(TaskDescriptor descriptor) {
        events.add(new Event(EventType.TASK_SKIPPED, descriptor.name().getValue()));
    }

    @Override
    public void onRunSettled(RunOutcome outcome) {
        lastOutcome = outcome;
        events.add(new Event(EventType.RUN_SETTLED, ""));
    }

    /**
     * All events in arrival order.
     *
     * @return snapshot of the event log
     */
    public List<Event> getEvents() {
        return List.copyOf(events);
    }

    /**
     * Subjects of events of one type, in arrival order.
     *
     * @param type the event type
     * @return task names or priority values
     */
    public List<String> subjects(EventType type) {
        return events.stream()
            .filter(event -> event.type() == type)
            .map(Event::subject)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Position of an event in the log.
     *
     * @param type the event type
     * @param subject the subject
     * @return index, or -1 if the event was not recorded
     */
    public int indexOf(EventType type, String subject) {
        return events.indexOf(new Event(type, subject));
    }

    /**
     * Highest number of tasks observed running at the same time.
     *
     * @return maximum concurrency
     */
    public int getMaxConcurrentTasks() {
        return maxRunning.get();
    }

    /**
     * Outcome passed to the last {@code onRunSettled} call.
     *
     * @return the outcome, or empty if no run settled yet
     */
    public Optional<RunOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    /**
     * Clears the log and counters.
     */
    public void clear() {
        events.clear();
        running.set(0);
        maxRunning.set(0);
        lastOutcome = null;
    }
}
