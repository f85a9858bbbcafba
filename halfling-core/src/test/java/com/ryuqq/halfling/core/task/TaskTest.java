package com.ryuqq.halfling.core.task;

import com.ryuqq.halfling.core.function.CheckedFunction;
import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.result.Result;
import com.ryuqq.halfling.core.result.TaskFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Task 유닛 테스트.
 *
 * <p>조합, 상태 조회, 실행 진입점의 동작을 검증합니다:</p>
 * <ul>
 *   <li>지연성 (then은 아무것도 실행하지 않음)</li>
 *   <li>copy-on-write (원본 Task 불변)</li>
 *   <li>상태 조회는 블로킹하지 않음</li>
 *   <li>소진된 Task에 붙인 suffix만 재실행</li>
 * </ul>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TaskTest {

    @Mock
    private CheckedFunction<Integer, Integer> action;

    // ============================================================
    // 1. 생성
    // ============================================================

    @Test
    void of_미실행_SERIAL_Task_생성() {
        // when
        Task<Integer> task = Task.of(() -> 1 + 1);

        // then
        assertThat(task.mode()).isEqualTo(ExecutionMode.SERIAL);
        assertThat(task.isDone()).isTrue();
        assertThat(task.isExecuted()).isFalse();
        assertThat(task.pendingActions()).isEqualTo(1);
        assertThat(task.peer()).isEqualTo(Result.success(null));
    }

    @Test
    void of_thunk는_run_전에_실행되지_않음() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        Task<Integer> task = Task.of(calls::incrementAndGet).then(x -> x + 1);

        // then
        assertThat(calls.get()).isZero();
        assertThat(task.run().get()).isEqualTo(2);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void success_와_failure_이미_해소된_Task() {
        // when
        Task<String> success = Task.success("done");
        Task<String> failure = Task.failure("broken");

        // then
        assertThat(success.isExecuted()).isTrue();
        assertThat(success.isFulfilled()).isTrue();
        assertThat(success.get()).isEqualTo("done");
        assertThat(failure.isExecuted()).isTrue();
        assertThat(failure.isBroken()).isTrue();
        assertThat(failure.getOrElse("fallback")).isEqualTo("fallback");
    }

    @Test
    void of_null_thunk는_예외() {
        assertThatThrownBy(() -> Task.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("thunk cannot be null");
    }

    // ============================================================
    // 2. 조합
    // ============================================================

    @Test
    void then_원본_Task는_변하지_않음() {
        // given
        Task<Integer> original = Task.of(() -> 1);

        // when
        Task<Integer> derived = original.then(x -> x + 1).then(x -> x + 1);

        // then
        assertThat(original.pendingActions()).isEqualTo(1);
        assertThat(derived.pendingActions()).isEqualTo(3);
        assertThat(original.run().get()).isEqualTo(1);
        assertThat(derived.run().get()).isEqualTo(3);
    }

    @Test
    void then_실패로_해소된_Task는_action을_추가하지_않음() throws Exception {
        // given
        Task<Integer> broken = Task.failure("already failed");

        // when
        Task<Integer> derived = broken.then(action);

        // then
        assertThat(derived.pendingActions()).isZero();
        assertThat(derived.isBroken()).isTrue();
        assertThat(derived.run().isBroken()).isTrue();
        verify(action, never()).apply(any());
    }

    @Test
    void then_null_함수는_예외() {
        assertThatThrownBy(() -> Task.of(() -> 1).then(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("f cannot be null");
    }

    @Test
    void then_함수가_Task를_반환하면_실행_시_해석() {
        // given
        Task<Integer> task = Task.of(() -> 1).thenCompose(x -> Task.of(() -> x + 10));

        // when & then
        assertThat(task.run().get()).isEqualTo(11);
    }

    @Test
    void thenDo_부수효과_후_값_전달() {
        // given
        AtomicInteger sideEffect = new AtomicInteger();

        // when
        Task<Integer> task = Task.of(() -> 5).thenDo(sideEffect::incrementAndGet).then(x -> x * 2);

        // then
        assertThat(task.run().get()).isEqualTo(10);
        assertThat(sideEffect.get()).isEqualTo(1);
    }

    @Test
    void recover_action_큐는_건드리지_않음() {
        // given
        Task<Integer> task = Task.of(() -> 1).then(x -> x + 1);

        // when
        Task<Integer> recoverable = task.recover(e -> -1);

        // then
        assertThat(recoverable.pendingActions()).isEqualTo(2);
        assertThat(recoverable.hasRecovery()).isTrue();
        assertThat(task.hasRecovery()).isFalse();
    }

    // ============================================================
    // 3. 실행 시나리오
    // ============================================================

    @Test
    void run_then_체인_순서대로_적용() {
        // given
        Task<Integer> task = Task.of(() -> 1 + 1)
            .then(x -> x + 1)
            .then(x -> x - 1);

        // when
        Task<Integer> spent = task.run();

        // then
        assertThat(spent.peer()).isEqualTo(Result.success(2));
        assertThat(spent.isExecuted()).isTrue();
        assertThat(spent.mode()).isEqualTo(ExecutionMode.SERIAL);
    }

    @Test
    void run_예외는_Failure로_캡처되고_이후_action은_단락() throws Exception {
        // given
        Task<Integer> task = Task.of(() -> 1)
            .<Integer>then(x -> {
                throw new IllegalStateException("HA");
            })
            .then(action);

        // when
        Task<Integer> spent = task.run();

        // then
        assertThat(spent.isBroken()).isTrue();
        assertThat(spent.result().fold(v -> "", ErrorInfo::message)).isEqualTo("java.lang.IllegalStateException: HA");
        verify(action, never()).apply(any());
    }

    @Test
    void run_recover로_실패를_값으로_대체() {
        // given
        Task<String> task = Task.of(() -> 1)
            .<String>then(x -> {
                throw new IllegalStateException("HA");
            })
            .recover(e -> "HA");

        // when & then
        assertThat(task.run().peer()).isEqualTo(Result.success("HA"));
    }

    @Test
    void run_recover는_오류_payload를_받음() {
        // given
        IllegalStateException thrown = new IllegalStateException("E");
        Task<Throwable> task = Task.<Throwable>of(() -> {
            throw thrown;
        }).recover(ErrorInfo::cause);

        // when & then
        assertThat(task.run().get()).isSameAs(thrown);
    }

    @Test
    void run_recoverWith_Task로_복구() {
        // given
        Task<Integer> task = Task.<Integer>failure("x").recoverWith(e -> Task.of(() -> 99));

        // when & then
        assertThat(task.run().get()).isEqualTo(99);
    }

    @Test
    void run_소진된_Task에_then을_붙이면_suffix만_실행() throws Exception {
        // given
        when(action.apply(2)).thenReturn(3);
        AtomicInteger bodyCalls = new AtomicInteger();
        Task<Integer> spent = Task.of(() -> {
            bodyCalls.incrementAndGet();
            return 2;
        }).run();

        // when
        Task<Integer> extended = spent.then(action);

        // then
        assertThat(extended.isExecuted()).isFalse();
        assertThat(extended.run().get()).isEqualTo(3);
        assertThat(bodyCalls.get()).isEqualTo(1);
        verify(action, times(1)).apply(2);
    }

    @Test
    void run_idempotent_spentness() {
        // given
        Task<Integer> spent = Task.of(() -> 4).run();

        // when
        Task<Integer> again = spent.run();

        // then
        assertThat(spent.isExecuted()).isTrue();
        assertThat(again.isExecuted()).isTrue();
        assertThat(again.get()).isEqualTo(4);
    }

    @Test
    void get_실패는_TaskFailedException() {
        // given
        Task<Integer> spent = Task.<Integer>of(() -> {
            throw new IllegalArgumentException("bad input");
        }).run();

        // when & then
        assertThatThrownBy(spent::get)
            .isInstanceOf(TaskFailedException.class)
            .hasMessageContaining("bad input");
    }

    // ============================================================
    // 4. 비동기 실행 및 대기
    // ============================================================

    @Test
    void runAsync_즉시_반환하고_나중에_완료() throws Exception {
        // given
        CountDownLatch release = new CountDownLatch(1);
        Task<String> work = Task.of(() -> {
            release.await(5, TimeUnit.SECONDS);
            return "finished";
        });

        // when
        Task<String> pending = work.runAsync();

        // then
        assertThat(pending.isDone()).isFalse();
        assertThat(pending.peer()).isNull();
        assertThat(pending.isFulfilled()).isFalse();
        assertThat(pending.isBroken()).isFalse();
        assertThat(pending.isExecuted()).isFalse();

        release.countDown();
        assertThat(pending.await().peer()).isEqualTo(Result.success("finished"));
    }

    @Test
    void runAsync_진행_중에_then을_붙여도_실행_중인_작업에는_영향_없음() throws Exception {
        // given
        CountDownLatch release = new CountDownLatch(1);
        Task<Integer> pending = Task.of(() -> {
            release.await(5, TimeUnit.SECONDS);
            return 1;
        }).runAsync();

        // when
        Task<Integer> extended = pending.then(x -> x + 100);
        release.countDown();

        // then
        assertThat(pending.await().get()).isEqualTo(1);
        assertThat(extended.run().get()).isEqualTo(101);
    }

    @Test
    void await_타임아웃_시_Failure() throws Exception {
        // given
        CountDownLatch release = new CountDownLatch(1);
        Task<Integer> pending = Task.of(() -> {
            release.await(5, TimeUnit.SECONDS);
            return 1;
        }).runAsync();

        try {
            // when
            Task<Integer> timedOut = pending.await(10);

            // then
            assertThat(timedOut.isBroken()).isTrue();
            assertThat(timedOut.result().fold(v -> "", ErrorInfo::message)).contains("Timed out after 10 ms");
        } finally {
            release.countDown();
        }
    }

    @Test
    void await_타임아웃_시_기본값() throws Exception {
        // given
        CountDownLatch release = new CountDownLatch(1);
        Task<String> pending = Task.of(() -> {
            release.await(5, TimeUnit.SECONDS);
            return "late";
        }).runAsync();

        try {
            // when
            Task<String> fallback = pending.await(10, "default");

            // then
            assertThat(fallback.get()).isEqualTo("default");
        } finally {
            release.countDown();
        }
        assertThat(pending.await().get()).isEqualTo("late");
    }

    @Test
    void toString_상태_요약() {
        // given
        Task<Integer> task = Task.of(() -> 1).then(x -> x).recover(e -> 0);

        // when & then
        assertThat(task.toString())
            .isEqualTo("Task{mode=SERIAL, state=Success{null}, pendingActions=2, recovery=true}");
    }
}
