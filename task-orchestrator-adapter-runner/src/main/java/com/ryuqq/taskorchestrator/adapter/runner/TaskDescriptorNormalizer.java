package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.model.CallableCommand;
import com.ryuqq.taskorchestrator.core.model.NoOpCommand;
import com.ryuqq.taskorchestrator.core.model.Priority;
import com.ryuqq.taskorchestrator.core.model.ShellCommand;
import com.ryuqq.taskorchestrator.core.model.TaskAction;
import com.ryuqq.taskorchestrator.core.model.TaskCommand;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;
import com.ryuqq.taskorchestrator.core.model.TaskParameters;
import com.ryuqq.taskorchestrator.core.model.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 다양한 형태의 Task 정의를 {@link TaskDescriptor}로 정규화.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>{@code String} → Shell, 기본 우선순위</li>
 *   <li>{@link TaskAction} / {@link Runnable} / {@link Callable} → Callable, 기본 우선순위</li>
 *   <li>{@link TaskSpec} 또는 {@code command/priority/options} 키의 {@code Map} → 명시적 필드
 *       (priority 생략 시 기본값, options는 Callable 파라미터, Shell에서는 무시)</li>
 *   <li>{@code null} 또는 command 없는 구조화 정의 → No-op</li>
 *   <li>{@link TaskDescriptor} → 맵 키를 이름으로 사용하여 그대로 사용</li>
 * </ul>
 *
 * <p>결과는 입력 맵의 반복 순서를 유지합니다. 잘못된 정의는 Task 이름을 포함한
 * {@link IllegalArgumentException}으로 즉시 거부되며, 이 경우 어떤 Task도 실행되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskDescriptorNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TaskDescriptorNormalizer.class);

    static final String KEY_COMMAND = "command";
    static final String KEY_PRIORITY = "priority";
    static final String KEY_OPTIONS = "options";
    private static final Set<String> STRUCTURED_KEYS = Set.of(KEY_COMMAND, KEY_PRIORITY, KEY_OPTIONS);

    private final Priority defaultPriority;

    /**
     * 생성자 (기본 우선순위 500).
     */
    public TaskDescriptorNormalizer() {
        this(Priority.defaultPriority());
    }

    /**
     * 생성자.
     *
     * @param defaultPriority 우선순위를 생략한 Task에 사용할 값
     * @throws IllegalArgumentException defaultPriority가 null인 경우
     */
    public TaskDescriptorNormalizer(Priority defaultPriority) {
        if (defaultPriority == null) {
            throw new IllegalArgumentException("defaultPriority cannot be null");
        }
        this.defaultPriority = defaultPriority;
    }

    /**
     * 오케스트레이션 맵 정규화.
     *
     * @param taskMap Task 이름 → 정의
     * @return 정규화된 Task (입력 순서)
     * @throws IllegalArgumentException taskMap이 null이거나 정의가 잘못된 경우
     */
    public List<TaskDescriptor> normalize(Map<String, ?> taskMap) {
        if (taskMap == null) {
            throw new IllegalArgumentException("taskMap cannot be null");
        }
        List<TaskDescriptor> descriptors = new ArrayList<>(taskMap.size());
        for (Map.Entry<String, ?> entry : taskMap.entrySet()) {
            TaskName name = toName(entry.getKey());
            descriptors.add(toDescriptor(name, entry.getValue()));
        }
        return descriptors;
    }

    private TaskName toName(String key) {
        try {
            return TaskName.of(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid task name '" + key + "': " + e.getMessage(), e);
        }
    }

    private TaskDescriptor toDescriptor(TaskName name, Object definition) {
        try {
            if (definition instanceof TaskDescriptor descriptor) {
                return new TaskDescriptor(name, descriptor.command(), descriptor.priority(), descriptor.parameters());
            }
            if (definition instanceof TaskSpec spec) {
                return structured(name, spec.command(), spec.priority(), spec.options());
            }
            if (definition instanceof Map<?, ?> map) {
                return fromMap(name, map);
            }
            return new TaskDescriptor(name, toCommand(definition), defaultPriority, TaskParameters.empty());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid definition for task '" + name + "': " + e.getMessage(), e);
        }
    }

    private TaskDescriptor fromMap(TaskName name, Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String text) || !STRUCTURED_KEYS.contains(text)) {
                log.debug("Ignoring unknown key '{}' in definition of task '{}'", key, name);
            }
        }
        return structured(name, map.get(KEY_COMMAND), toPriority(map.get(KEY_PRIORITY)), toOptions(map.get(KEY_OPTIONS)));
    }

    private TaskDescriptor structured(TaskName name, Object command, Integer priority, Map<String, ?> options) {
        TaskCommand taskCommand = toCommand(command);
        Priority resolved = priority == null ? defaultPriority : Priority.of(priority);
        // options는 Callable 전용
        TaskParameters parameters = taskCommand.isCallable() ? TaskParameters.of(options) : TaskParameters.empty();
        return new TaskDescriptor(name, taskCommand, resolved, parameters);
    }

    private TaskCommand toCommand(Object command) {
        if (command == null) {
            return NoOpCommand.INSTANCE;
        }
        if (command instanceof String commandLine) {
            return ShellCommand.of(commandLine);
        }
        if (command instanceof TaskAction action) {
            return CallableCommand.of(action);
        }
        if (command instanceof Runnable runnable) {
            return CallableCommand.of(parameters -> {
                runnable.run();
                return null;
            });
        }
        if (command instanceof Callable<?> callable) {
            return CallableCommand.of(parameters -> callable.call());
        }
        throw new IllegalArgumentException("unsupported command type " + command.getClass().getName());
    }

    private Integer toPriority(Object priority) {
        if (priority == null) {
            return null;
        }
        if (priority instanceof Integer || priority instanceof Long
            || priority instanceof Short || priority instanceof Byte) {
            try {
                return Math.toIntExact(((Number) priority).longValue());
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("priority is out of int range: " + priority, e);
            }
        }
        if (priority instanceof Double || priority instanceof Float) {
            double value = ((Number) priority).doubleValue();
            if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("priority is not an int value: " + priority);
            }
            return (int) value;
        }
        if (priority instanceof String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("priority is not an integer: '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException("unsupported priority type " + priority.getClass().getName());
    }

    private Map<String, ?> toOptions(Object options) {
        if (options == null) {
            return null;
        }
        if (!(options instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("options must be a Map (current: " + options.getClass().getName() + ")");
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException("options keys must be strings (current: " + entry.getKey() + ")");
            }
            converted.put(key, entry.getValue());
        }
        return converted;
    }
}
