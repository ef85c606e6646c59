package com.heterodain.smarthome.gpiocontroller.device;

import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;

/**
 * ピン番号、ピンの値のチェック
 */
public final class Pins {
    /** ピン番号の最小値 */
    public static final int MIN_PIN = 0;
    /** ピン番号の最大値 */
    public static final int MAX_PIN = 40;

    private Pins() {
    }

    /**
     * ピン番号の範囲チェック
     * 
     * @param pin ピン番号
     */
    public static void checkPin(int pin) {
        if (pin < MIN_PIN || pin > MAX_PIN) {
            throw new InvalidArgumentException("pin",
                    "Invalid pin " + pin + ": must be between " + MIN_PIN + " and " + MAX_PIN);
        }
    }

    /**
     * 書き込み値のチェック
     * 
     * @param value 値
     */
    public static void checkValue(int value) {
        if (value != 0 && value != 1) {
            throw new InvalidArgumentException("value", "Invalid value " + value + ": must be 0 or 1");
        }
    }
}
