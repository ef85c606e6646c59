package com.heterodain.smarthome.gpiocontroller.exception;

import lombok.Getter;

/**
 * セットアップされていないピンにアクセスした
 */
@Getter
public class PinNotInitializedException extends GpioControllerException {
    /** ピン番号 */
    private final int pin;

    public PinNotInitializedException(int pin) {
        super(ErrorCode.NOT_INITIALIZED, "Pin " + pin + " is not initialized.");
        this.pin = pin;
    }
}
