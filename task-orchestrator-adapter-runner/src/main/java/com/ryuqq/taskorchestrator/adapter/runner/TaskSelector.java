package com.ryuqq.taskorchestrator.adapter.runner;

import com.ryuqq.taskorchestrator.core.exception.TaskNotFoundException;
import com.ryuqq.taskorchestrator.core.invocation.InvocationContext;
import com.ryuqq.taskorchestrator.core.model.TaskDescriptor;
import com.ryuqq.taskorchestrator.core.model.TaskName;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 호출 인자로부터 실행할 Task 집합(run-set)을 결정.
 *
 * <p><strong>선택 규칙 (먼저 만족하는 규칙 적용):</strong></p>
 * <ol>
 *   <li>Task 이름과 일치하는 위치 인자가 있으면 → 일치한 Task만 (중복 제거)</li>
 *   <li>전체 실행 플래그({@code --all})가 있으면 → 맵 전체</li>
 *   <li>선택 키({@code task=a,b})가 있으면 → 지정한 Task, 없는 이름은 {@link TaskNotFoundException}
 *       (이름이 하나도 없으면 선택 없음)</li>
 *   <li>그 외 → 선택 없음 (아무것도 실행하지 않음)</li>
 * </ol>
 *
 * <p>run-set은 항상 맵 선언 순서를 따르며 우선순위는 변경하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskSelector {

    private final SelectorConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public TaskSelector() {
        this(new SelectorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 선택 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public TaskSelector(SelectorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * run-set 결정.
     *
     * @param descriptors 정규화된 Task (선언 순서)
     * @param context 호출 정보
     * @return 선택 결과
     * @throws TaskNotFoundException 선택 키에 존재하지 않는 이름이 포함된 경우
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Selection select(List<TaskDescriptor> descriptors, InvocationContext context) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        Set<String> positional = new LinkedHashSet<>(context.positional());
        List<TaskDescriptor> matched = descriptors.stream()
            .filter(descriptor -> positional.contains(descriptor.name().getValue()))
            .collect(Collectors.toList());
        if (!matched.isEmpty()) {
            return Selection.of(matched);
        }

        if (context.flags().contains(config.runAllFlag())) {
            return Selection.of(descriptors);
        }

        Optional<String> explicit = context.extract(config.selectionKey());
        if (explicit.isPresent()) {
            return explicitSelection(descriptors, explicit.get());
        }

        return Selection.none();
    }

    /**
     * 전체 실행 플래그 이름.
     *
     * @return 플래그 이름 ({@code --} 제외)
     */
    String runAllFlag() {
        return config.runAllFlag();
    }

    private Selection explicitSelection(List<TaskDescriptor> descriptors, String value) {
        Set<String> requested = new LinkedHashSet<>();
        for (String part : value.split(",")) {
            String name = part.strip();
            if (!name.isEmpty()) {
                requested.add(name);
            }
        }
        // task= 또는 task=, 는 선택 없음으로 처리
        if (requested.isEmpty()) {
            return Selection.none();
        }

        List<String> available = names(descriptors);
        List<String> missing = new ArrayList<>();
        for (String name : requested) {
            if (!available.contains(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new TaskNotFoundException(missing, available);
        }
        return Selection.of(descriptors.stream()
            .filter(descriptor -> requested.contains(descriptor.name().getValue()))
            .collect(Collectors.toList()));
    }

    /**
     * Task 이름 목록 (선언 순서).
     *
     * @param descriptors 정규화된 Task
     * @return 이름 목록
     */
    static List<String> names(List<TaskDescriptor> descriptors) {
        return descriptors.stream()
            .map(descriptor -> descriptor.name().getValue())
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 선택 결과.
     *
     * @param runSet 실행할 Task (선언 순서)
     * @param nothingSelected 선택 규칙을 하나도 만족하지 않았으면 true
     */
    public record Selection(List<TaskDescriptor> runSet, boolean nothingSelected) {

        /**
         * Compact constructor.
         *
         * @throws IllegalArgumentException runSet이 null인 경우
         */
        public Selection {
            if (runSet == null) {
                throw new IllegalArgumentException("runSet cannot be null");
            }
            runSet = List.copyOf(runSet);
        }

        static Selection of(List<TaskDescriptor> runSet) {
            return new Selection(runSet, false);
        }

        static Selection none() {
            return new Selection(List.of(), true);
        }

        /**
         * 선택된 Task 이름.
         *
         * @return 이름 목록 (선언 순서)
         */
        public List<TaskName> names() {
            return runSet.stream().map(TaskDescriptor::name).collect(Collectors.toUnmodifiableList());
        }
    }
}
