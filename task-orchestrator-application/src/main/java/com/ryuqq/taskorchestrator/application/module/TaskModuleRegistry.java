package com.ryuqq.taskorchestrator.application.module;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * 이름으로 찾을 수 있는 Task 모듈 목록.
 *
 * <p>같은 이름의 모듈이 여러 개면 먼저 발견된 모듈을 사용하고 경고를 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskModuleRegistry.class);

    private final Map<String, TaskModule> modules;

    /**
     * 생성자.
     *
     * @param modules 모듈 목록
     * @throws IllegalArgumentException modules가 null이거나 이름이 빈 모듈이 있는 경우
     */
    public TaskModuleRegistry(Iterable<? extends TaskModule> modules) {
        if (modules == null) {
            throw new IllegalArgumentException("modules cannot be null");
        }
        Map<String, TaskModule> byName = new TreeMap<>();
        for (TaskModule module : modules) {
            String name = module.name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("TaskModule name cannot be null or blank: " + module.getClass().getName());
            }
            TaskModule existing = byName.putIfAbsent(name, module);
            if (existing != null) {
                log.warn("Duplicate task module '{}': keeping {}, ignoring {}",
                    name, existing.getClass().getName(), module.getClass().getName());
            }
        }
        this.modules = Collections.unmodifiableMap(byName);
    }

    /**
     * 클래스패스의 {@link ServiceLoader}로 모듈 검색.
     *
     * @return TaskModuleRegistry 인스턴스
     */
    public static TaskModuleRegistry load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * 지정한 ClassLoader의 {@link ServiceLoader}로 모듈 검색.
     *
     * @param classLoader ClassLoader
     * @return TaskModuleRegistry 인스턴스
     */
    public static TaskModuleRegistry load(ClassLoader classLoader) {
        TaskModuleRegistry registry = new TaskModuleRegistry(ServiceLoader.load(TaskModule.class, classLoader));
        log.debug("Discovered {} task module(s): {}", registry.modules.size(), registry.names());
        return registry;
    }

    /**
     * 이름으로 모듈 조회.
     *
     * @param name 모듈 이름
     * @return 모듈 (없으면 empty)
     */
    public Optional<TaskModule> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * 등록된 모듈 이름 (정렬됨).
     *
     * @return 모듈 이름 목록
     */
    public List<String> names() {
        return List.copyOf(modules.keySet());
    }

    /**
     * 등록된 모듈 (이름 순).
     *
     * @return 모듈 목록
     */
    public List<TaskModule> modules() {
        return List.copyOf(modules.values());
    }
}
