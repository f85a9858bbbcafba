package com.ryuqq.halfling.adapter.runner;

import com.ryuqq.halfling.core.spi.TaskLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 크기 스레드 풀 기반 TaskLauncher.
 *
 * <p>Task마다 스레드를 만드는 대신 poolSize개의 워커 스레드를 재사용합니다.
 * 워커가 모두 바쁘면 작업은 큐에서 대기합니다.</p>
 *
 * <p><strong>주의:</strong> 병렬 Task는 하위 Task가 끝날 때까지 실행 스레드를 점유합니다.
 * 풀 안에서 실행되는 Task가 다시 병렬 Task를 실행하는 경우,
 * 대기 중인 부모 수가 poolSize 이상이면 하위 Task가 실행될 워커가 없어 진행되지 않습니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * new BoundedPoolLauncher(config)
 *   ↓
 * launch(work) ... (반복)
 *   ↓
 * shutdown() → 진행 중인 작업 대기 (shutdownTimeoutMs) → 초과 시 shutdownNow()
 *   ↓
 * launch(work) → RejectedExecutionException
 * </pre>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class BoundedPoolLauncher implements TaskLauncher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedPoolLauncher.class);

    private final PoolLauncherConfig config;
    private final ExecutorService workerExecutor;
    private final AtomicLong launched = new AtomicLong();

    /**
     * 기본 설정으로 생성합니다.
     */
    public BoundedPoolLauncher() {
        this(new PoolLauncherConfig());
    }

    /**
     * 생성자.
     *
     * @param config 풀 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BoundedPoolLauncher(PoolLauncherConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.poolSize(), threadFactory(config.threadNamePrefix()));
        log.info("BoundedPoolLauncher started (poolSize: {}, prefix: {})", config.poolSize(), config.threadNamePrefix());
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicLong sequence = new AtomicLong();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 작업을 풀에 제출합니다.
     *
     * @param work 실행할 작업
     * @throws IllegalArgumentException work가 null인 경우
     * @throws RejectedExecutionException shutdown 이후 호출된 경우
     */
    @Override
    public void launch(Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        workerExecutor.execute(work);
        launched.incrementAndGet();
    }

    /**
     * 풀을 종료합니다.
     *
     * <p>새 작업을 거부하고 진행 중인 작업이 완료되도록 shutdownTimeoutMs만큼 대기합니다.
     * 시간 안에 끝나지 않으면 shutdownNow()로 워커를 인터럽트합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (workerExecutor.isShutdown()) {
            return;
        }
        log.info("Shutting down BoundedPoolLauncher (launched: {})", launched.get());
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Workers did not finish within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    /**
     * try-with-resources 지원. 인터럽트되면 인터럽트 플래그를 복원합니다.
     */
    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    public boolean isTerminated() {
        return workerExecutor.isTerminated();
    }

    /**
     * 지금까지 제출된 작업 수.
     *
     * @return 제출된 작업 수
     */
    public long launchedCount() {
        return launched.get();
    }

    /**
     * 이 Launcher의 설정.
     *
     * @return 생성 시 전달된 설정
     */
    public PoolLauncherConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "BoundedPoolLauncher{poolSize=" + config.poolSize() + ", shutdown=" + isShutdown() + "}";
    }
}
