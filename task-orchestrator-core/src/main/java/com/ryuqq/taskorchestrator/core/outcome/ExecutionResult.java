package com.ryuqq.taskorchestrator.core.outcome;

import com.ryuqq.taskorchestrator.core.model.TaskName;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 단일 Task의 실행 결과.
 *
 * <p>Shell Task와 Callable Task 모두 이 형태로 환원됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>taskName:</strong> 실행한 Task 이름</li>
 *   <li><strong>outcome:</strong> Ok(반환값) 또는 Fail(오류 코드, 메시지, 원인)</li>
 *   <li><strong>stdout / stderr:</strong> Shell Task의 캡처된 출력 (Callable은 빈 문자열)</li>
 *   <li><strong>exitCode:</strong> Shell Task의 종료 코드 (Callable 또는 시작 실패 시 null)</li>
 *   <li><strong>elapsed:</strong> 실행 소요 시간</li>
 * </ul>
 *
 * @param taskName Task 이름
 * @param outcome 실행 결과
 * @param stdout 표준 출력
 * @param stderr 표준 오류
 * @param exitCode 종료 코드 (null 가능)
 * @param elapsed 소요 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionResult(
    TaskName taskName,
    Outcome outcome,
    String stdout,
    String stderr,
    Integer exitCode,
    Duration elapsed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskName 또는 outcome이 null인 경우
     */
    public ExecutionResult {
        if (taskName == null) {
            throw new IllegalArgumentException("taskName cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /**
     * 출력 없는 결과 생성 (Callable, No-op).
     *
     * @param taskName Task 이름
     * @param outcome 실행 결과
     * @param elapsed 소요 시간
     * @return ExecutionResult 인스턴스
     */
    public static ExecutionResult of(TaskName taskName, Outcome outcome, Duration elapsed) {
        return new ExecutionResult(taskName, outcome, "", "", null, elapsed);
    }

    /**
     * 성공 여부.
     *
     * @return Outcome이 Ok이면 true
     */
    public boolean isSuccess() {
        return outcome.isOk();
    }

    /**
     * 성공 시 반환값 조회.
     *
     * @return 반환값 (실패했거나 값이 없으면 empty)
     */
    public Optional<Object> value() {
        if (outcome instanceof Ok ok) {
            return Optional.ofNullable(ok.value());
        }
        return Optional.empty();
    }

    /**
     * 실패 정보 조회.
     *
     * @return Fail (성공이면 empty)
     */
    public Optional<Fail> failure() {
        if (outcome instanceof Fail fail) {
            return Optional.of(fail);
        }
        return Optional.empty();
    }

    /**
     * 종료 코드 조회.
     *
     * @return 종료 코드 (Shell Task가 아니면 empty)
     */
    public OptionalInt exitCodeIfPresent() {
        return exitCode == null ? OptionalInt.empty() : OptionalInt.of(exitCode);
    }

    @Override
    public String toString() {
        return "ExecutionResult{task=" + taskName
            + ", outcome=" + (isSuccess() ? "OK" : failure().map(Fail::errorCode).orElse("FAIL"))
            + (exitCode != null ? ", exitCode=" + exitCode : "")
            + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
