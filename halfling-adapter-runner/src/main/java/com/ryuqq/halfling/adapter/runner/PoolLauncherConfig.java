package com.ryuqq.halfling.adapter.runner;

/**
 * BoundedPoolLauncher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>poolSize: 워커 스레드 수 (기본 availableProcessors × 2)</li>
 *   <li>threadNamePrefix: 워커 스레드 이름 접두어 (기본 "halfling-pool-")</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중인 작업 대기 시간 (기본 30000ms = 30초)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>I/O 위주 Task: poolSize 증가</li>
 *   <li>중첩 병렬 Task: 동시에 대기하는 부모 Task 수보다 poolSize를 크게 유지</li>
 * </ul>
 *
 * @author Halfling Team
 * @since 1.0.0
 * @param poolSize 워커 스레드 수 (1 이상이어야 함)
 * @param threadNamePrefix 스레드 이름 접두어 (비어 있으면 안 됨)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record PoolLauncherConfig(
    int poolSize,
    String threadNamePrefix,
    long shutdownTimeoutMs
) {

    private static final String DEFAULT_THREAD_NAME_PREFIX = "halfling-pool-";
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 30000;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: poolSize=availableProcessors×2, threadNamePrefix="halfling-pool-",
     * shutdownTimeoutMs=30000ms</p>
     */
    public PoolLauncherConfig() {
        this(Runtime.getRuntime().availableProcessors() * 2, DEFAULT_THREAD_NAME_PREFIX, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PoolLauncherConfig {
        if (poolSize <= 0) {
            throw new IllegalArgumentException(
                "poolSize must be positive (current: " + poolSize + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * poolSize만 변경한 새 인스턴스 생성.
     */
    public PoolLauncherConfig withPoolSize(int poolSize) {
        return new PoolLauncherConfig(poolSize, threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public PoolLauncherConfig withThreadNamePrefix(String threadNamePrefix) {
        return new PoolLauncherConfig(poolSize, threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public PoolLauncherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new PoolLauncherConfig(poolSize, threadNamePrefix, shutdownTimeoutMs);
    }
}
