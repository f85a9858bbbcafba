/**
 * Runner Adapter Layer - TaskLauncher 구현체.
 *
 * <p>이 패키지는 core의 {@link com.ryuqq.halfling.core.spi.TaskLauncher} SPI 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.halfling.adapter.runner.BoundedPoolLauncher} - 고정 크기 워커 풀</li>
 *   <li>{@link com.ryuqq.halfling.adapter.runner.InlineLauncher} - 호출 스레드에서 즉시 실행</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BoundedPoolLauncher, InlineLauncher)
 *   ↓ implements
 * core/spi (TaskLauncher)
 *   ↑ used by
 * core/task (Task.run(launcher), Task.runAsync(launcher))
 * </pre>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
package com.ryuqq.halfling.adapter.runner;
