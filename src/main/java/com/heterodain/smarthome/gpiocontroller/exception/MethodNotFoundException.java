package com.heterodain.smarthome.gpiocontroller.exception;

/**
 * 未知のツール名、メソッド名が指定された
 */
public class MethodNotFoundException extends GpioControllerException {

    public MethodNotFoundException(String message) {
        super(ErrorCode.METHOD_NOT_FOUND, message);
    }
}
