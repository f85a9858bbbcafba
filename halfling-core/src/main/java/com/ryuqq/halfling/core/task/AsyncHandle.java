package com.ryuqq.halfling.core.task;

import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.result.Result;
import com.ryuqq.halfling.core.spi.TaskLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 비동기로 채워지는 Result 셀.
 *
 * <p>대기 중(pending)이거나 Result를 담고 있는 두 상태만 가집니다.
 * 셀은 소유한 계산이 정확히 한 번 기록하고, 관찰자는 읽기만 합니다.</p>
 *
 * <p><strong>블로킹 규칙:</strong></p>
 * <ul>
 *   <li>{@link #isDone()}, {@link #peek()}: 절대 블로킹하지 않음</li>
 *   <li>{@link #await()}: 완료될 때까지 블로킹</li>
 *   <li>{@link #await(long, Result)}: 타임아웃 시 fallback 반환 (계산은 계속 진행됨)</li>
 * </ul>
 *
 * @param <V> 결과 값 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class AsyncHandle<V> {

    private static final Logger log = LoggerFactory.getLogger(AsyncHandle.class);

    private final CompletableFuture<Result<V>> cell;

    private AsyncHandle(CompletableFuture<Result<V>> cell) {
        this.cell = cell;
    }

    /**
     * 이미 완료된 핸들 생성.
     *
     * @param result 담을 Result
     * @param <V> 값 타입
     * @return 완료된 AsyncHandle
     * @throws IllegalArgumentException result가 null인 경우
     */
    public static <V> AsyncHandle<V> completed(Result<V> result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new AsyncHandle<>(CompletableFuture.completedFuture(result));
    }

    /**
     * Launcher로 work를 시작하고 그 결과를 받을 핸들을 즉시 반환합니다.
     *
     * <p>Launcher가 작업을 거부하면 핸들은 Failure로 완료됩니다.
     * work 자체가 예외를 던지는 경우에도 핸들은 Failure로 완료되어 대기자가 영원히 블로킹되지 않습니다.</p>
     *
     * @param launcher 작업을 시작할 Launcher
     * @param work 실행할 계산
     * @param <V> 값 타입
     * @return 대기 중인 (또는 즉시 완료된) AsyncHandle
     * @throws IllegalArgumentException launcher 또는 work가 null인 경우
     */
    public static <V> AsyncHandle<V> launch(TaskLauncher launcher, Supplier<Result<V>> work) {
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        CompletableFuture<Result<V>> cell = new CompletableFuture<>();
        try {
            launcher.launch(() -> complete(cell, work));
        } catch (RejectedExecutionException e) {
            log.warn("Launcher {} rejected work", launcher, e);
            cell.complete(Result.failure(ErrorInfo.from(e)));
        }
        return new AsyncHandle<>(cell);
    }

    private static <V> void complete(CompletableFuture<Result<V>> cell, Supplier<Result<V>> work) {
        try {
            cell.complete(work.get());
        } catch (RuntimeException e) {
            log.error("Unexpected exception while running task", e);
            cell.complete(Result.failure(ErrorInfo.from(e)));
        } catch (Error e) {
            cell.complete(Result.failure(ErrorInfo.from(e)));
            throw e;
        }
    }

    /**
     * 완료 여부 (비블로킹).
     *
     * @return Result가 채워져 있으면 true
     */
    public boolean isDone() {
        return cell.isDone();
    }

    /**
     * 현재 Result 조회 (비블로킹).
     *
     * @return 채워진 Result 또는 null (대기 중)
     */
    public Result<V> peek() {
        return cell.getNow(null);
    }

    /**
     * 완료될 때까지 대기.
     *
     * <p>대기 중 인터럽트되면 인터럽트 플래그를 복원하고 Failure를 반환합니다.</p>
     *
     * @return 채워진 Result
     */
    public Result<V> await() {
        try {
            return cell.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(ErrorInfo.from(e));
        } catch (ExecutionException e) {
            return Result.failure(ErrorInfo.from(e.getCause()));
        }
    }

    /**
     * 최대 timeoutMs 동안 대기.
     *
     * <p>타임아웃은 호출자의 대기만 포기합니다. 실행 중인 계산은 중단되지 않습니다.</p>
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 0 이상)
     * @param fallback 타임아웃 시 반환할 Result
     * @return 채워진 Result 또는 fallback
     * @throws IllegalArgumentException timeoutMs가 음수이거나 fallback이 null인 경우
     */
    public Result<V> await(long timeoutMs, Result<V> fallback) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        try {
            return cell.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(ErrorInfo.from(e));
        } catch (ExecutionException e) {
            return Result.failure(ErrorInfo.from(e.getCause()));
        }
    }

    @Override
    public String toString() {
        Result<V> current = peek();
        return current == null ? "AsyncHandle{pending}" : "AsyncHandle{" + current + "}";
    }
}
