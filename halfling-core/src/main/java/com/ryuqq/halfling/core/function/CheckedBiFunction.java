package com.ryuqq.halfling.core.function;

/**
 * 예외를 던질 수 있는 이항 함수 (2-arity gather).
 *
 * @param <A> 첫 번째 입력 타입
 * @param <B> 두 번째 입력 타입
 * @param <R> 결과 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckedBiFunction<A, B, R> {

    R apply(A first, B second) throws Exception;
}
