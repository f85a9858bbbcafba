package com.ryuqq.halfling.core.result;

import com.ryuqq.halfling.core.function.CheckedFunction;

import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 실행 결과를 명시적인 데이터로 표현하는 불변 값.
 *
 * <p>Result는 두 가지 경우 중 정확히 하나입니다:</p>
 * <ul>
 *   <li>{@link Success}: 값을 담은 성공</li>
 *   <li>{@link Failure}: {@link ErrorInfo}를 담은 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 부분적인 상태가 존재할 수 없습니다.</p>
 *
 * <p><strong>예외 경계:</strong> 사용자 콜백에서 발생한 예외는
 * {@link #attempt(Callable)}에서만 Failure로 변환됩니다.
 * {@link #map}, {@link #bind}, {@link #recover}는 모두 내부적으로 attempt를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Result<Integer> parsed = Result.attempt(() -> Integer.parseInt(input));
 * String text = parsed
 *     .map(i -> i * 2)
 *     .fold(v -> "value: " + v, e -> "error: " + e.message());
 * }</pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value 값 (null 허용, unit 표현)
     * @param <T> 값 타입
     * @return Success 인스턴스
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 실패 정보
     * @param <T> 값 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> Result<T> failure(ErrorInfo error) {
        return new Failure<>(error);
    }

    /**
     * 메시지만으로 실패 결과 생성.
     *
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return Failure 인스턴스
     */
    static <T> Result<T> failure(String message) {
        return new Failure<>(ErrorInfo.of(message));
    }

    /**
     * thunk를 실행하고 결과를 Result로 감쌉니다.
     *
     * <p>thunk에서 발생한 모든 {@link Exception}은 Failure로 변환됩니다.
     * {@link InterruptedException}인 경우 현재 스레드의 인터럽트 플래그를 복원합니다.</p>
     *
     * @param thunk 실행할 계산
     * @param <T> 값 타입
     * @return Success(thunk()) 또는 Failure(예외 정보)
     * @throws IllegalArgumentException thunk가 null인 경우
     */
    static <T> Result<T> attempt(Callable<? extends T> thunk) {
        if (thunk == null) {
            throw new IllegalArgumentException("thunk cannot be null");
        }
        return Attempts.capture(thunk);
    }

    /**
     * 중첩된 Result를 평탄화합니다.
     *
     * <p>Success의 값이 다시 Result이면 한 단계씩 벗겨내며, 가장 안쪽 결과를 반환합니다.
     * 중간에 Failure를 만나면 그 Failure가 결과가 됩니다.</p>
     *
     * @param result 평탄화할 Result
     * @param <T> 최종 값 타입
     * @return 평탄화된 Result
     * @throws IllegalArgumentException result가 null인 경우
     */
    @SuppressWarnings("unchecked")
    static <T> Result<T> join(Result<?> result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        Result<?> current = result;
        while (current instanceof Success<?> success && success.value() instanceof Result<?> inner) {
            current = inner;
        }
        return (Result<T>) current;
    }

    /**
     * 성공 여부.
     *
     * @return Success인 경우 true
     */
    boolean isSuccess();

    /**
     * 실패 여부.
     *
     * @return Failure인 경우 true
     */
    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * variant 내부를 노출하지 않고 분기합니다.
     *
     * @param onSuccess 성공 값에 적용할 함수
     * @param onFailure 실패 정보에 적용할 함수
     * @param <R> 결과 타입
     * @return 적용된 함수의 결과
     */
    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super ErrorInfo, ? extends R> onFailure);

    /**
     * 성공 값 또는 실패 정보(payload)를 그대로 반환합니다.
     *
     * @return 성공 값 또는 {@link ErrorInfo}
     */
    default Object getOrError() {
        return fold(value -> value, error -> error);
    }

    /**
     * 성공 값 또는 이 Failure 자신을 반환합니다.
     *
     * <p>결과를 다시 Result 파이프라인에 넣을 때 이중 unwrap을 피하기 위해 사용합니다.</p>
     *
     * @return 성공 값 또는 이 Result
     */
    default Object getOrSelf() {
        return fold(value -> value, error -> this);
    }

    /**
     * 성공 값 또는 기본값.
     *
     * @param other 실패 시 반환할 값
     * @return 성공 값 또는 other
     */
    default T getOrElse(T other) {
        return fold(value -> value, error -> other);
    }

    /**
     * 성공 값을 반환하거나 실패를 예외로 전달합니다.
     *
     * @return 성공 값
     * @throws TaskFailedException Failure인 경우
     */
    T orElseThrow();

    /**
     * 성공 값에 함수를 적용합니다. Failure는 그대로 통과합니다.
     *
     * @param f 적용할 함수 (예외 발생 시 Failure)
     * @param <U> 결과 타입
     * @return 새 Result
     */
    <U> Result<U> map(CheckedFunction<? super T, ? extends U> f);

    /**
     * Result를 반환하는 함수를 적용하고 한 단계 평탄화합니다. Failure는 단락됩니다.
     *
     * @param f 적용할 함수 (예외 발생 시 Failure)
     * @param <U> 결과 타입
     * @return 새 Result
     */
    <U> Result<U> bind(CheckedFunction<? super T, ? extends Result<U>> f);

    /**
     * 실패 정보에 복구 함수를 적용합니다. Success는 그대로 유지됩니다.
     *
     * <p>복구 함수가 Result를 반환하면 평탄화됩니다.</p>
     *
     * @param f 복구 함수 (예외 발생 시 Failure)
     * @return 새 Result
     */
    Result<T> recover(CheckedFunction<? super ErrorInfo, ?> f);
}
