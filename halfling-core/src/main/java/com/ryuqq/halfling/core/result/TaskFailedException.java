package com.ryuqq.halfling.core.result;

/**
 * 실패한 결과의 값을 꺼내려 할 때 발생하는 예외.
 *
 * <p>엔진 내부에서는 절대 던지지 않습니다. {@code Result.orElseThrow()}와
 * {@code Task.get()}이 Java 호출자에게 실패를 전달하는 경계에서만 사용됩니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public class TaskFailedException extends RuntimeException {

    private final transient ErrorInfo error;

    /**
     * 생성자.
     *
     * @param error 실패 정보
     * @throws IllegalArgumentException error가 null인 경우
     */
    public TaskFailedException(ErrorInfo error) {
        super(requireError(error).message(), error.cause());
        this.error = error;
    }

    private static ErrorInfo requireError(ErrorInfo error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }

    /**
     * 실패 정보 조회.
     *
     * @return ErrorInfo (non-null)
     */
    public ErrorInfo getError() {
        return error;
    }
}
