package com.ryuqq.halfling.core.function;

/**
 * 예외를 던질 수 있는 삼항 함수 (3-arity gather).
 *
 * @param <A> 첫 번째 입력 타입
 * @param <B> 두 번째 입력 타입
 * @param <C> 세 번째 입력 타입
 * @param <R> 결과 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckedTriFunction<A, B, C, R> {

    R apply(A first, B second, C third) throws Exception;
}
