package com.ryuqq.halfling.core.function;

/**
 * 예외를 던질 수 있는 단항 함수.
 *
 * <p>Task의 action 큐와 recovery 함수가 이 타입을 사용합니다.
 * 던져진 예외는 {@link com.ryuqq.halfling.core.result.Result#attempt}에서 Failure로 변환됩니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 결과 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {

    /**
     * 함수 적용.
     *
     * @param input 입력값
     * @return 결과값
     * @throws Exception 사용자 코드에서 발생한 모든 예외
     */
    R apply(T input) throws Exception;
}
