package com.paddleframe.api.exception;

/**
 * PaddleFrame 基础异常
 *
 * @author PaddleFrame
 */
public class PaddleFrameException extends RuntimeException {

    public PaddleFrameException(String message) {
        super(message);
    }

    public PaddleFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
