package com.ryuqq.halfling.testkit.contract;

import com.ryuqq.halfling.core.combinator.Tasks;
import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.task.Task;
import com.ryuqq.halfling.lib.ParallelMap;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract: parallel composition aggregates branch results in declaration order.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>zip / mapply deliver values in declaration order regardless of completion order</li>
 *   <li>a failing branch fails the group with the first failing branch's error</li>
 *   <li>branches of a parallel group run concurrently (concurrent launchers only)</li>
 *   <li>sequenced runs one element at a time, sequencedPar keeps the input shape</li>
 *   <li>nested parallel groups and parallel map</li>
 * </ul>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public abstract class ParallelContract extends AbstractTaskContractTest {

    private static Task<Integer> tracked(AtomicInteger active, AtomicInteger maxActive, int value) {
        return Task.of(() -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(5);
            active.decrementAndGet();
            return value;
        });
    }

    @Test
    void zip_returnsValues_inDeclarationOrder() {
        assertSucceedsWith(List.of(1, 2, 3), Tasks.zip(Task.of(() -> 1), Task.of(() -> 2), Task.of(() -> 3)));
    }

    @Test
    void zip_ignoresCompletionOrder() {
        Task<List<String>> zipped = Tasks.zip(sleepingTask(40, "slow"), sleepingTask(20, "medium"), sleepingTask(1, "fast"));

        assertSucceedsWith(List.of("slow", "medium", "fast"), zipped);
    }

    @Test
    void mapply_appliesGather_toAllValues() {
        Task<String> joined = Tasks.mapply((String a, Integer b, String c) -> a + b + c,
                Task.of(() -> "x"), sleepingTask(5, 1), Task.of(() -> "z"));

        assertSucceedsWith("x1z", joined);
    }

    @Test
    void zip_failingBranch_reportsFirstFailingBranch() {
        Task<List<Integer>> zipped = Tasks.zip(
                sleepingTask(1, 1),
                sleepingTask(30, 2).<Integer>then(x -> {
                    throw new IllegalStateException("second");
                }),
                failingTask("third"));

        ErrorInfo error = errorOf(zipped);

        assertThat(error.message()).isEqualTo(thrownMessage("second"));
        assertThat(error.suppressed()).extracting(ErrorInfo::message).containsExactly(thrownMessage("third"));
    }

    @Test
    void zip_singleFailingBranch_hasNoSuppressed() {
        ErrorInfo error = errorOf(Tasks.zip(Task.of(() -> 1), failingTask("only")));

        assertThat(error.message()).isEqualTo(thrownMessage("only"));
        assertThat(error.suppressed()).isEmpty();
    }

    @Test
    void zip_branchesRunConcurrently() {
        assumeConcurrent();
        CountDownLatch latch = new CountDownLatch(3);

        Task<List<Boolean>> zipped = Tasks.zip(rendezvousTask(latch), rendezvousTask(latch), rendezvousTask(latch));

        assertSucceedsWith(List.of(true, true, true), zipped);
    }

    @Test
    void zip_nestedGroups_flattenInOrder() {
        Task<List<Object>> nested = Tasks.zip(
                Tasks.zip(sleepingTask(10, 1), Task.of(() -> 2)),
                Tasks.zip(Task.of(() -> 3), sleepingTask(5, 4)));

        assertSucceedsWith(List.of(List.of(1, 2), List.of(3, 4)), nested);
    }

    @Test
    void zip_thenContinuesSerially_afterGather() {
        Task<Integer> sum = Tasks.zip(Task.of(() -> 20), sleepingTask(5, 22))
                .then(values -> values.get(0) + values.get(1));

        assertSucceedsWith(42, sum);
    }

    @Test
    void sequenced_runsOneElementAtATime() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        List<Task<Integer>> tasks = List.of(
                tracked(active, maxActive, 1), tracked(active, maxActive, 2), tracked(active, maxActive, 3));

        assertSucceedsWith(List.of(1, 2, 3), Tasks.sequenced(tasks));
        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void sequencedPar_keepsSetShape() {
        Set<Task<String>> tasks = new LinkedHashSet<>(List.of(Task.of(() -> "a"), sleepingTask(5, "b"), Task.of(() -> "a")));

        Set<String> values = valueOf(Tasks.sequencedPar(tasks));

        assertThat(values).containsExactly("a", "b");
    }

    @Test
    void sequenced_andSequencedPar_agreeOnValues() {
        List<Task<Integer>> tasks = List.of(sleepingTask(10, 1), Task.of(() -> 2), sleepingTask(3, 3));

        assertEquivalent(Tasks.sequenced(tasks), Tasks.sequencedPar(tasks));
    }

    @Test
    void pmap_mapsEveryElement_inOrder() {
        List<Integer> input = IntStream.rangeClosed(1, 25).boxed().collect(Collectors.toList());

        List<Integer> doubled = valueOf(ParallelMap.pmap((Integer x) -> x * 2, input, 4));

        assertThat(doubled).containsExactlyElementsOf(
                input.stream().map(x -> x * 2).collect(Collectors.toList()));
    }
}
