package com.ryuqq.halfling.core.combinator;

import com.ryuqq.halfling.core.function.CheckedFunction;

import java.util.List;

/**
 * 병렬 하위 Task들의 값을 하나로 결합하는 n-ary 함수.
 *
 * <p>값 목록은 완료 순서와 관계없이 항상 선언 순서입니다.</p>
 *
 * <p><strong>arity:</strong> {@link #VARIADIC}이면 개수 제한이 없고,
 * 그 외에는 {@code Tasks.mapply} 시점에 하위 Task 개수와 일치해야 합니다.</p>
 *
 * @param <R> 결합 결과 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Gather<R> {

    /**
     * 개수 제한 없음.
     */
    int VARIADIC = -1;

    /**
     * 값 목록 결합.
     *
     * @param values 선언 순서의 하위 Task 값 (수정 불가)
     * @return 결합 결과
     * @throws Exception 사용자 코드에서 발생한 모든 예외 (Failure로 변환됨)
     */
    R gather(List<Object> values) throws Exception;

    /**
     * 기대하는 값 개수.
     *
     * @return 값 개수 또는 {@link #VARIADIC}
     */
    default int arity() {
        return VARIADIC;
    }

    /**
     * 고정 arity Gather 생성.
     *
     * @param arity 기대하는 값 개수 (0 이상)
     * @param f 결합 함수
     * @param <R> 결합 결과 타입
     * @return Gather 인스턴스
     * @throws IllegalArgumentException arity가 음수이거나 f가 null인 경우
     */
    static <R> Gather<R> ofArity(int arity, CheckedFunction<List<Object>, ? extends R> f) {
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be non-negative (current: " + arity + ")");
        }
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return new Gather<>() {
            @Override
            public R gather(List<Object> values) throws Exception {
                return f.apply(values);
            }

            @Override
            public int arity() {
                return arity;
            }
        };
    }
}
