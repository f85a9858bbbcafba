package com.ryuqq.halfling.core.result;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * 사용자 코드 예외를 데이터로 변환하는 유일한 지점.
 */
final class Attempts {

    private static final Logger log = LoggerFactory.getLogger(Attempts.class);

    private Attempts() {
    }

    static <T> Result<T> capture(Callable<? extends T> thunk) {
        try {
            return new Success<>(thunk.call());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Captured interruption as failure", e);
            return new Failure<>(ErrorInfo.from(e));
        } catch (Exception e) {
            log.debug("Captured exception as failure: {}", e.toString());
            return new Failure<>(ErrorInfo.from(e));
        }
    }
}
