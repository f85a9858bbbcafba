package com.ryuqq.halfling.core.launcher;

import com.ryuqq.halfling.core.spi.TaskLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 호출마다 새 스레드를 만드는 기본 Launcher.
 *
 * <p>스케줄러나 풀이 없으므로 fan-out 크기에 비례해 스레드가 생성됩니다.
 * 높은 fan-out에서는 스레드 자원이 무제한으로 늘어날 수 있으며,
 * 이를 제한하려면 {@code BoundedPoolLauncher}를 사용합니다.</p>
 *
 * <p>기본적으로 비데몬 스레드를 사용합니다. {@code runAsync()}로 시작한 작업은
 * 호출한 main 스레드가 먼저 끝나도 완료될 때까지 실행됩니다.
 * 타임아웃으로 포기된 작업이 JVM 종료를 막지 않아야 한다면
 * {@link #ThreadPerTaskLauncher(String, boolean)}로 데몬 스레드를 선택합니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class ThreadPerTaskLauncher implements TaskLauncher {

    private static final Logger log = LoggerFactory.getLogger(ThreadPerTaskLauncher.class);

    private static final String DEFAULT_THREAD_NAME_PREFIX = "halfling-task-";
    private static final ThreadPerTaskLauncher SHARED = new ThreadPerTaskLauncher();

    private final String threadNamePrefix;
    private final boolean daemon;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 기본 설정 생성자 (prefix "halfling-task-", 비데몬 스레드).
     */
    public ThreadPerTaskLauncher() {
        this(DEFAULT_THREAD_NAME_PREFIX, false);
    }

    /**
     * 생성자.
     *
     * @param threadNamePrefix 스레드 이름 prefix
     * @param daemon 데몬 스레드 여부
     * @throws IllegalArgumentException threadNamePrefix가 null이거나 빈 문자열인 경우
     */
    public ThreadPerTaskLauncher(String threadNamePrefix, boolean daemon) {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        this.threadNamePrefix = threadNamePrefix;
        this.daemon = daemon;
    }

    /**
     * 공유 인스턴스 조회.
     *
     * <p>{@code Task.run()}, {@code Task.runAsync()} 등 Launcher를 지정하지 않은 호출에서 사용됩니다.</p>
     *
     * @return 공유 ThreadPerTaskLauncher
     */
    public static ThreadPerTaskLauncher shared() {
        return SHARED;
    }

    @Override
    public void launch(Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        Thread thread = new Thread(work, threadNamePrefix + sequence.incrementAndGet());
        thread.setDaemon(daemon);
        log.trace("Launching {}", thread.getName());
        thread.start();
    }

    /**
     * 지금까지 시작한 스레드 수.
     *
     * @return 시작한 스레드 수
     */
    public long launchedCount() {
        return sequence.get();
    }

    @Override
    public String toString() {
        return "ThreadPerTaskLauncher{prefix=" + threadNamePrefix + ", daemon=" + daemon + "}";
    }
}
