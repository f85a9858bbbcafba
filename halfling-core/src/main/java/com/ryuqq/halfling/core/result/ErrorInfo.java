package com.ryuqq.halfling.core.result;

import java.util.ArrayList;
import java.util.List;

/**
 * Failure가 담는 오류 정보.
 *
 * <p>호출자는 "실패를 설명한다" 이상의 구조를 가정하면 안 됩니다.
 * 사용자 예외에서 변환된 경우 cause와 stack trace를 함께 보존합니다.</p>
 *
 * <p><strong>병렬 실패 집계:</strong> 여러 분기가 동시에 실패하면 선언 순서상 첫 번째
 * 분기의 오류가 대표가 되고, 나머지 분기의 오류는 {@link #suppressed()}에 담깁니다.
 * ({@link Throwable#addSuppressed}와 같은 방식)</p>
 *
 * @param message 오류 메시지 (non-null)
 * @param cause 원인 예외 (선택, null 가능)
 * @param trace 예외 발생 시점의 stack trace (빈 리스트 가능)
 * @param suppressed 함께 실패한 다른 분기의 오류 (빈 리스트 가능)
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public record ErrorInfo(
    String message,
    Throwable cause,
    List<StackTraceElement> trace,
    List<ErrorInfo> suppressed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null인 경우
     */
    public ErrorInfo {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        trace = trace == null ? List.of() : List.copyOf(trace);
        suppressed = suppressed == null ? List.of() : List.copyOf(suppressed);
    }

    /**
     * 메시지만 가진 오류 생성.
     *
     * @param message 오류 메시지
     * @return ErrorInfo 인스턴스
     * @throws IllegalArgumentException message가 null인 경우
     */
    public static ErrorInfo of(String message) {
        return new ErrorInfo(message, null, List.of(), List.of());
    }

    /**
     * 예외로부터 오류 생성.
     *
     * <p>메시지는 {@link Throwable#toString()} (클래스명 + 메시지) 형태입니다.</p>
     *
     * @param throwable 원인 예외
     * @return ErrorInfo 인스턴스
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static ErrorInfo from(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        return new ErrorInfo(throwable.toString(), throwable, List.of(throwable.getStackTrace()), List.of());
    }

    /**
     * 다른 오류들을 suppressed로 추가한 새 인스턴스 생성.
     *
     * @param others 추가할 오류
     * @return 새 ErrorInfo 인스턴스
     */
    public ErrorInfo withSuppressed(List<ErrorInfo> others) {
        if (others == null || others.isEmpty()) {
            return this;
        }
        List<ErrorInfo> merged = new ArrayList<>(suppressed);
        merged.addAll(others);
        return new ErrorInfo(message, cause, trace, merged);
    }

    /**
     * 원인 예외 보유 여부.
     *
     * @return cause가 있으면 true
     */
    public boolean hasCause() {
        return cause != null;
    }

    @Override
    public String toString() {
        if (suppressed.isEmpty()) {
            return "ErrorInfo{" + message + '}';
        }
        return "ErrorInfo{" + message + ", suppressed=" + suppressed.size() + '}';
    }
}
