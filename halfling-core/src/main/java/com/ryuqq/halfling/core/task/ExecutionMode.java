package com.ryuqq.halfling.core.task;

/**
 * Task 실행 방식.
 *
 * <p>생성 시 고정되며 파생된 Task에 상속됩니다.
 * PARALLEL은 fan-out 조합자({@code Tasks.mapply}, {@code Tasks.zip} 등)만 지정합니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public enum ExecutionMode {

    /**
     * 직렬 실행 (action을 큐 순서대로 하나씩 적용).
     */
    SERIAL,

    /**
     * 병렬 실행 (하위 Task들을 동시에 실행한 뒤 gather 함수로 결합).
     */
    PARALLEL
}
