package com.heterodain.smarthome.gpiocontroller.device;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;
import com.heterodain.smarthome.gpiocontroller.exception.PinNotInitializedException;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * シミュレーションのGPIO (実機が無い環境での開発、テスト用)
 */
@Slf4j
public class SimulatedGpioHal implements GpioHal {
    /** セットアップ済みのピン */
    private final Map<Integer, SimulatedPin> pins = new HashMap<>();

    @Override
    public synchronized void setup(int pin, PinDirection direction) {
        Pins.checkPin(pin);

        var current = pins.get(pin);
        if (current == null) {
            log.info("GPIO(擬似)を初期化します。pin={}, direction={}", pin, direction.getValue());
            pins.put(pin, new SimulatedPin(direction, 0));
        } else if (current.direction != direction) {
            log.info("GPIO(擬似)の方向を変更します。pin={}, {} -> {}", pin, current.direction.getValue(),
                    direction.getValue());
            current.direction = direction;
            current.value = 0;
        }
    }

    @Override
    public synchronized boolean isInitialized(int pin) {
        return pins.containsKey(pin);
    }

    @Override
    public synchronized int read(int pin) {
        var simulatedPin = get(pin);
        log.trace("GPIO(擬似)を読み込みます。pin={}, value={}", pin, simulatedPin.value);
        return simulatedPin.value;
    }

    @Override
    public synchronized void write(int pin, int value) {
        Pins.checkValue(value);
        var simulatedPin = get(pin);
        if (simulatedPin.direction == PinDirection.IN) {
            throw new InvalidArgumentException("pin", "Pin " + pin + " is configured as input.");
        }

        log.trace("GPIO(擬似)に書き込みます。pin={}, value={}", pin, value);
        simulatedPin.value = value;
    }

    @Override
    public synchronized SortedMap<Integer, PinStatus> list() {
        var result = new TreeMap<Integer, PinStatus>();
        pins.forEach((pin, p) -> result.put(pin, new PinStatus(p.direction, p.value)));
        return Collections.unmodifiableSortedMap(result);
    }

    @Override
    public synchronized void teardown() {
        log.info("GPIO(擬似)を開放します。");
        pins.clear();
    }

    @Override
    public boolean isSimulated() {
        return true;
    }

    private SimulatedPin get(int pin) {
        Pins.checkPin(pin);
        var simulatedPin = pins.get(pin);
        if (simulatedPin == null) {
            throw new PinNotInitializedException(pin);
        }
        return simulatedPin;
    }

    /**
     * 擬似ピン
     */
    @AllArgsConstructor
    private static class SimulatedPin {
        private PinDirection direction;
        private int value;
    }
}
