package com.ryuqq.halfling.testkit.contract;

import com.ryuqq.halfling.core.combinator.Tasks;
import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.task.ExecutionMode;
import com.ryuqq.halfling.core.task.Task;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract: recovery, spentness and laziness of executed tasks.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>recover(then(t, throw E), h) produces h(E)</li>
 *   <li>recovery on a parallel group receives the aggregated error</li>
 *   <li>run produces a spent task, running it again changes nothing</li>
 *   <li>composing after runAsync leaves the in-flight execution untouched</li>
 *   <li>a later run executes only the unexecuted suffix</li>
 * </ul>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public abstract class RecoveryContract extends AbstractTaskContractTest {

    @Test
    void recover_receivesThrownError() {
        IllegalStateException thrown = new IllegalStateException("E");
        Task<Object> task = Task.<Object>of(() -> 1)
                .then(x -> {
                    throw thrown;
                })
                .recover(ErrorInfo::cause);

        assertThat(valueOf(task)).isSameAs(thrown);
    }

    @Test
    void recover_replacesFailure_withHandlerValue() {
        Task<String> task = Task.of(() -> 1)
                .<String>then(x -> {
                    throw new IllegalStateException("HA");
                })
                .recover(error -> "HA");

        assertSucceedsWith("HA", task);
    }

    @Test
    void recoverWith_runsReturnedTask() {
        Task<Integer> task = RecoveryContract.<Integer>failingTask("boom")
                .recoverWith(error -> sleepingTask(5, error.message().length()));

        assertSucceedsWith(thrownMessage("boom").length(), task);
    }

    @Test
    void recover_onParallelGroup_receivesAggregatedError() {
        AtomicReference<ErrorInfo> received = new AtomicReference<>();
        Task<List<Integer>> task = Tasks.<Integer>zip(failingTask("a"), Task.of(() -> 1), failingTask("b"))
                .recover(error -> {
                    received.set(error);
                    return List.of();
                });

        Task<List<Integer>> done = execute(task);

        assertThat(done.get()).isEmpty();
        assertThat(done.mode()).isEqualTo(ExecutionMode.SERIAL);
        assertThat(received.get().message()).isEqualTo(thrownMessage("a"));
        assertThat(received.get().suppressed()).extracting(ErrorInfo::message).containsExactly(thrownMessage("b"));
    }

    @Test
    void recover_handlerFailure_isReported() {
        Task<Integer> task = RecoveryContract.<Integer>failingTask("first")
                .recover(error -> {
                    throw new IllegalStateException("handler");
                });

        assertFailsWith(thrownMessage("handler"), task);
    }

    @Test
    void run_producesSpentTask() {
        Task<Integer> done = execute(sleepingTask(2, 1).then(x -> x + 1));

        assertThat(done.isExecuted()).isTrue();
        assertThat(done.pendingActions()).isZero();
        assertThat(execute(done).result()).isEqualTo(done.result());
    }

    @Test
    void run_spentFailure_staysBroken() {
        Task<Integer> done = execute(RecoveryContract.<Integer>failingTask("spent"));

        assertThat(done.isExecuted()).isTrue();
        assertThat(done.isBroken()).isTrue();
        assertThat(done.then(x -> x + 1).isBroken()).isTrue();
    }

    @Test
    void runAsync_composingAfterStart_doesNotAffectInFlight() {
        assumeConcurrent();
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger suffixCalls = new AtomicInteger();
        Task<Integer> inFlight = executeAsync(Task.of(() -> {
            release.await(5, TimeUnit.SECONDS);
            return 1;
        }));

        Task<Integer> extended = inFlight.then(x -> {
            suffixCalls.incrementAndGet();
            return x + 1;
        });
        release.countDown();

        assertThat(inFlight.await().get()).isEqualTo(1);
        assertThat(suffixCalls).hasValue(0);
        assertThat(valueOf(extended)).isEqualTo(2);
        assertThat(suffixCalls).hasValue(1);
    }

    @Test
    void run_executesOnlyUnexecutedSuffix() {
        AtomicInteger bodyCalls = new AtomicInteger();
        Task<Integer> done = execute(Task.of(bodyCalls::incrementAndGet));

        Task<Integer> suffix = done.then(x -> x * 10);

        assertThat(valueOf(suffix)).isEqualTo(10);
        assertThat(bodyCalls).hasValue(1);
    }
}
