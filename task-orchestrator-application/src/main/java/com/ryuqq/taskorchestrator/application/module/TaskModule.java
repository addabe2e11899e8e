package com.ryuqq.taskorchestrator.application.module;

import com.ryuqq.taskorchestrator.application.context.TaskContext;
import com.ryuqq.taskorchestrator.application.orchestrator.RunOutcome;

/**
 * 소비자 Task 모듈 SPI.
 *
 * <p>CLI에서 {@code <entry> <module-name> [tokens...]}로 호출되는 단위입니다.
 * 모듈은 주입된 {@link TaskContext}로 인자를 읽고 Task 맵을 만들어
 * {@link TaskContext#start(java.util.Map)}를 호출합니다.</p>
 *
 * <p><strong>등록:</strong> {@code META-INF/services/com.ryuqq.taskorchestrator.application.module.TaskModule}
 * 파일에 구현 클래스 이름을 적으면 {@link TaskModuleRegistry#load()}가 찾습니다.
 * 구현체는 public no-arg 생성자가 필요합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskModule {

    /**
     * 모듈 이름 (CLI 첫 번째 인자와 일치해야 함).
     *
     * @return 모듈 이름
     */
    String name();

    /**
     * 한 줄 설명 (모듈 목록 출력용).
     *
     * @return 설명 (기본값 빈 문자열)
     */
    default String description() {
        return "";
    }

    /**
     * 모듈 실행.
     *
     * @param context 주입된 Capability 객체
     * @return 집계된 실행 결과
     * @throws Exception 모듈 자체의 실패 (Task 실패는 RunOutcome으로 보고)
     */
    RunOutcome run(TaskContext context) throws Exception;
}
