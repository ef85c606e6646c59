package com.heterodain.smarthome.gpiocontroller.device;

import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 照明デバイス(リレー経由のON/OFF)
 */
@Component
@AllArgsConstructor
@Slf4j
public class LightDevice {
    /** 調光時にONとみなす明るさの下限(この値より大きければON) */
    public static final int DIM_ON_THRESHOLD = 50;

    /** GPIO */
    private final GpioHal gpioHal;

    /**
     * 点灯
     * 
     * @param pin ピン番号
     */
    public void on(int pin) {
        log.debug("照明を点灯します。pin={}", pin);

        prepare(pin);
        gpioHal.write(pin, 1);
    }

    /**
     * 消灯
     * 
     * @param pin ピン番号
     */
    public void off(int pin) {
        log.debug("照明を消灯します。pin={}", pin);

        prepare(pin);
        gpioHal.write(pin, 0);
    }

    /**
     * 点灯/消灯を切り替え
     * 
     * @param pin ピン番号
     * @return 切り替え後の値
     */
    public int toggle(int pin) {
        prepare(pin);

        var newValue = gpioHal.read(pin) == 1 ? 0 : 1;
        log.debug("照明を切り替えます。pin={}, value={}", pin, newValue);

        gpioHal.write(pin, newValue);
        return newValue;
    }

    /**
     * 調光 (PWMは使わず、明るさが50%を超えていれば点灯、それ以外は消灯)
     * 
     * @param pin        ピン番号
     * @param brightness 明るさ(%)
     * @return 書き込んだ値
     */
    public int dim(int pin, double brightness) {
        var value = brightness > DIM_ON_THRESHOLD ? 1 : 0;
        log.debug("照明を調光します。pin={}, brightness={}, value={}", pin, brightness, value);

        prepare(pin);
        gpioHal.write(pin, value);
        return value;
    }

    private void prepare(int pin) {
        if (!gpioHal.isInitialized(pin)) {
            gpioHal.setup(pin, PinDirection.OUT);
        }
    }
}
