package com.ryuqq.halfling.core.spi;

/**
 * 비동기 실행 단위를 시작하는 SPI.
 *
 * <p>{@code Task.runAsync}와 병렬 인터프리터의 분기 실행(fan-out)은
 * 모두 이 인터페이스를 통해서만 동시성을 도입합니다.
 * 구현체를 교체해도 Task의 의미는 바뀌지 않습니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@code ThreadPerTaskLauncher}: 호출마다 새 스레드 (기본값)</li>
 *   <li>{@code BoundedPoolLauncher}: 고정 크기 스레드 풀 (halfling-adapter-runner)</li>
 *   <li>{@code InlineLauncher}: 호출 스레드에서 즉시 실행 (halfling-adapter-runner)</li>
 * </ul>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>launch()는 work를 정확히 한 번 실행해야 합니다.</li>
 *   <li>실행할 수 없는 경우 {@link java.util.concurrent.RejectedExecutionException}을 던집니다.
 *       호출자는 이를 해당 분기의 Failure로 변환합니다.</li>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 *   <li>취소는 지원하지 않습니다. 시작된 작업은 끝까지 실행됩니다.</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 병렬 인터프리터는 분기가 모두 끝날 때까지 현재 스레드를 블로킹합니다.
 * 크기가 제한된 구현체에서 병렬 그룹이 깊게 중첩되면 모든 워커가 대기 상태에 빠질 수 있습니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public interface TaskLauncher {

    /**
     * work 실행 시작.
     *
     * <p>이 메서드는 비블로킹으로 즉시 반환되어야 합니다. ({@code InlineLauncher} 제외)</p>
     *
     * @param work 실행할 작업
     * @throws java.util.concurrent.RejectedExecutionException 작업을 받을 수 없는 경우
     */
    void launch(Runnable work);
}
