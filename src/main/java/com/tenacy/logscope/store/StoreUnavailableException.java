package com.tenacy.logscope.store;

/**
 * 저장소 호출 실패. 재시도하지 않고 호출자에게 그대로 전달된다.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
