package com.heterodain.smarthome.gpiocontroller.exception;

/**
 * ツール実行中の想定外のエラー
 */
public class ToolExecutionException extends GpioControllerException {

    public ToolExecutionException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, message, cause);
    }
}
