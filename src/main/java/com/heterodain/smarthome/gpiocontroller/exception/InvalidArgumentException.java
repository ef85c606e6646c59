package com.heterodain.smarthome.gpiocontroller.exception;

import lombok.Getter;

/**
 * 引数不正
 */
@Getter
public class InvalidArgumentException extends GpioControllerException {
    /** 不正な引数の名前 (不明な場合はnull) */
    private final String field;

    public InvalidArgumentException(String field, String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
        this.field = field;
    }
}
