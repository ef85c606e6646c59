package com.heterodain.smarthome.gpiocontroller.device;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;
import com.heterodain.smarthome.gpiocontroller.exception.PinNotInitializedException;
import com.pi4j.io.gpio.GpioController;
import com.pi4j.io.gpio.GpioPinDigitalMultipurpose;
import com.pi4j.io.gpio.Pin;
import com.pi4j.io.gpio.PinMode;
import com.pi4j.io.gpio.PinPullResistance;
import com.pi4j.io.gpio.PinState;
import com.pi4j.io.gpio.RaspiGpioProvider;
import com.pi4j.io.gpio.impl.PinImpl;

import lombok.extern.slf4j.Slf4j;

/**
 * 実機(ラズベリーパイ)のGPIO
 * <p>
 * Pi4Jの入出力兼用ピンとしてプロビジョニングし、セットアップ時にモードを切り替える。
 */
@Slf4j
public class RealGpioHal implements GpioHal {
    /** Broadcom(BCM)番号でピンを解決する */
    public static final PinResolver BROADCOM_PIN_RESOLVER = address -> new PinImpl(RaspiGpioProvider.NAME, address,
            "GPIO " + address, EnumSet.of(PinMode.DIGITAL_INPUT, PinMode.DIGITAL_OUTPUT),
            EnumSet.allOf(PinPullResistance.class));

    /** Pi4Jのコントローラー */
    private final GpioController gpioController;
    /** ピン番号の解決 */
    private final PinResolver pinResolver;
    /** プロビジョニング済みのピン */
    private final Map<Integer, GpioPinDigitalMultipurpose> pins = new HashMap<>();

    public RealGpioHal(GpioController gpioController, PinResolver pinResolver) {
        this.gpioController = gpioController;
        this.pinResolver = pinResolver;
    }

    @Override
    public synchronized void setup(int pin, PinDirection direction) {
        Pins.checkPin(pin);

        var mode = toMode(direction);
        var current = pins.get(pin);
        if (current == null) {
            log.info("GPIOを初期化します。pin={}, direction={}", pin, direction.getValue());

            var provisioned = gpioController.provisionDigitalMultipurposePin(pinResolver.resolve(pin), "GPIO_" + pin,
                    mode, PinPullResistance.PULL_DOWN);
            provisioned.setShutdownOptions(true, PinState.LOW);
            if (direction == PinDirection.OUT) {
                provisioned.setState(PinState.LOW);
            }
            pins.put(pin, provisioned);

        } else if (current.getMode() != mode) {
            log.info("GPIOの方向を変更します。pin={}, {} -> {}", pin, toDirection(current.getMode()).getValue(),
                    direction.getValue());

            current.setMode(mode);
            if (direction == PinDirection.OUT) {
                current.setState(PinState.LOW);
            }
        }
    }

    @Override
    public synchronized boolean isInitialized(int pin) {
        return pins.containsKey(pin);
    }

    @Override
    public synchronized int read(int pin) {
        var gpio = get(pin);
        var value = gpio.isHigh() ? 1 : 0;
        log.trace("GPIOを読み込みます。pin={}, value={}", pin, value);
        return value;
    }

    @Override
    public synchronized void write(int pin, int value) {
        Pins.checkValue(value);
        var gpio = get(pin);
        if (gpio.getMode() != PinMode.DIGITAL_OUTPUT) {
            throw new InvalidArgumentException("pin", "Pin " + pin + " is configured as input.");
        }

        log.trace("GPIOに書き込みます。pin={}, value={}", pin, value);
        gpio.setState(value == 1 ? PinState.HIGH : PinState.LOW);
    }

    @Override
    public synchronized SortedMap<Integer, PinStatus> list() {
        var result = new TreeMap<Integer, PinStatus>();
        pins.forEach((pin, gpio) -> result.put(pin, new PinStatus(toDirection(gpio.getMode()), gpio.isHigh() ? 1 : 0)));
        return Collections.unmodifiableSortedMap(result);
    }

    @Override
    public synchronized void teardown() {
        log.info("GPIOをシャットダウンします。");

        pins.values().forEach(gpio -> gpioController.unprovisionPin(gpio));
        pins.clear();
        gpioController.shutdown();
    }

    @Override
    public boolean isSimulated() {
        return false;
    }

    private GpioPinDigitalMultipurpose get(int pin) {
        Pins.checkPin(pin);
        var gpio = pins.get(pin);
        if (gpio == null) {
            throw new PinNotInitializedException(pin);
        }
        return gpio;
    }

    private static PinMode toMode(PinDirection direction) {
        return direction == PinDirection.OUT ? PinMode.DIGITAL_OUTPUT : PinMode.DIGITAL_INPUT;
    }

    private static PinDirection toDirection(PinMode mode) {
        return mode == PinMode.DIGITAL_OUTPUT ? PinDirection.OUT : PinDirection.IN;
    }

    /**
     * ピン番号からPi4Jのピンを解決する
     */
    @FunctionalInterface
    public interface PinResolver {
        Pin resolve(int address);
    }
}
