package com.orderhub.store;

/**
 * 저장소 값 직렬화/역직렬화 예외.
 *
 * @author orderhub
 * @version 1.0
 */
public class StoreSerializationException extends RuntimeException {

    public StoreSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
