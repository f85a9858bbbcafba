package com.ryuqq.halfling.lib;

import com.ryuqq.halfling.core.combinator.Gather;
import com.ryuqq.halfling.core.combinator.Tasks;
import com.ryuqq.halfling.core.function.CheckedFunction;
import com.ryuqq.halfling.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Task 기반 병렬 map.
 *
 * <p>컬렉션을 parallelism개 이하의 연속 구간으로 나누고, 구간마다 하나의 Task로 f를 적용한 뒤
 * {@link Tasks#mapply}로 동시에 실행하여 구간 결과를 이어 붙입니다.</p>
 *
 * <p><strong>분할 규칙:</strong></p>
 * <ul>
 *   <li>구간 크기 = ceil(n / parallelism), 최소 1</li>
 *   <li>마지막 구간은 더 짧을 수 있으며 원소는 버려지지 않음</li>
 *   <li>결과 순서 = 입력 반복 순서</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Task<List<Integer>> lengths = ParallelMap.pmap(String::length, List.of("a", "bb", "ccc"));
 * lengths.run().get();   // [1, 2, 3]
 * }</pre>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class ParallelMap {

    private static final Logger log = LoggerFactory.getLogger(ParallelMap.class);

    private ParallelMap() {
    }

    /**
     * 사용 가능한 프로세서 수만큼 나누어 병렬로 map합니다.
     *
     * @param f 원소에 적용할 함수
     * @param coll 입력 컬렉션
     * @param <T> 입력 원소 타입
     * @param <R> 결과 원소 타입
     * @return 미실행 Task (결과는 수정 불가 List)
     * @throws IllegalArgumentException f 또는 coll이 null인 경우
     */
    public static <T, R> Task<List<R>> pmap(CheckedFunction<? super T, ? extends R> f, Collection<? extends T> coll) {
        return pmap(f, coll, Runtime.getRuntime().availableProcessors());
    }

    /**
     * 지정한 구간 수 이하로 나누어 병렬로 map합니다.
     *
     * @param f 원소에 적용할 함수
     * @param coll 입력 컬렉션
     * @param parallelism 최대 구간 수 (1 이상)
     * @param <T> 입력 원소 타입
     * @param <R> 결과 원소 타입
     * @return 미실행 Task (결과는 수정 불가 List)
     * @throws IllegalArgumentException f 또는 coll이 null이거나 parallelism이 1 미만인 경우
     */
    public static <T, R> Task<List<R>> pmap(CheckedFunction<? super T, ? extends R> f,
                                            Collection<? extends T> coll,
                                            int parallelism) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        if (coll == null) {
            throw new IllegalArgumentException("coll cannot be null");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive (current: " + parallelism + ")");
        }

        List<List<T>> partitions = partition(new ArrayList<>(coll), parallelism);
        log.debug("pmap over {} elements in {} partitions", coll.size(), partitions.size());

        List<Task<List<R>>> tasks = new ArrayList<>(partitions.size());
        for (List<T> chunk : partitions) {
            Task<List<R>> mapped = Task.of(() -> ParallelMap.<T, R>mapChunk(f, chunk));
            tasks.add(mapped);
        }
        Gather<List<R>> concat = ParallelMap::concat;
        return Tasks.mapply(concat, tasks);
    }

    static <T> List<List<T>> partition(List<T> items, int parallelism) {
        int size = Math.max(1, (items.size() + parallelism - 1) / parallelism);
        List<List<T>> partitions = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            partitions.add(items.subList(from, Math.min(from + size, items.size())));
        }
        return partitions;
    }

    private static <T, R> List<R> mapChunk(CheckedFunction<? super T, ? extends R> f, List<T> chunk) throws Exception {
        List<R> mapped = new ArrayList<>(chunk.size());
        for (T item : chunk) {
            mapped.add(f.apply(item));
        }
        return mapped;
    }

    @SuppressWarnings("unchecked")
    private static <R> List<R> concat(List<Object> chunks) {
        List<R> joined = new ArrayList<>();
        for (Object chunk : chunks) {
            joined.addAll((List<R>) chunk);
        }
        return Collections.unmodifiableList(joined);
    }
}
