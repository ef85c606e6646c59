package com.heterodain.smarthome.gpiocontroller.exception;

import lombok.Getter;

/**
 * GPIOコントローラーの例外の基底クラス
 */
@Getter
public abstract class GpioControllerException extends RuntimeException {
    /** エラーコード */
    private final ErrorCode errorCode;

    protected GpioControllerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected GpioControllerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
