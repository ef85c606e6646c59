package com.heterodain.smarthome.gpiocontroller.device;

import static org.junit.jupiter.api.Assertions.*;

import com.heterodain.smarthome.gpiocontroller.exception.ErrorCode;
import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;
import com.heterodain.smarthome.gpiocontroller.exception.PinNotInitializedException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * GpioHalの実装が共通で満たすべき振る舞い
 */
abstract class GpioHalContract {

    protected GpioHal hal;

    protected abstract GpioHal createHal();

    @BeforeEach
    void setUpHal() {
        hal = createHal();
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 17, 40 })
    void freshOutputPinReadsLow(int pin) {
        hal.setup(pin, PinDirection.OUT);
        assertEquals(0, hal.read(pin));
    }

    @ParameterizedTest
    @EnumSource(PinDirection.class)
    void freshPinReadsLowInEitherDirection(PinDirection direction) {
        hal.setup(40, direction);
        assertEquals(0, hal.read(40));
        assertTrue(hal.isInitialized(40));
    }

    @ParameterizedTest
    @ValueSource(ints = { -1, 41 })
    void pinOutOfRangeIsRejected(int pin) {
        var e = assertThrows(InvalidArgumentException.class, () -> hal.setup(pin, PinDirection.OUT));
        assertEquals("pin", e.getField());
        assertFalse(hal.isInitialized(pin));
    }

    @Test
    void writeThenReadRoundTrips() {
        hal.setup(5, PinDirection.OUT);

        hal.write(5, 1);
        assertEquals(1, hal.read(5));

        hal.write(5, 0);
        assertEquals(0, hal.read(5));
    }

    @Test
    void readAndWriteRequireSetup() {
        var readError = assertThrows(PinNotInitializedException.class, () -> hal.read(3));
        assertEquals("Pin 3 is not initialized.", readError.getMessage());
        assertEquals(ErrorCode.NOT_INITIALIZED, readError.getErrorCode());

        assertThrows(PinNotInitializedException.class, () -> hal.write(3, 1));
    }

    @Test
    void writeRejectsValuesOtherThanZeroOrOne() {
        hal.setup(6, PinDirection.OUT);

        var e = assertThrows(InvalidArgumentException.class, () -> hal.write(6, 2));
        assertEquals("value", e.getField());
        assertEquals(0, hal.read(6));
    }

    @Test
    void writeToInputPinIsRejected() {
        hal.setup(7, PinDirection.IN);

        var e = assertThrows(InvalidArgumentException.class, () -> hal.write(7, 1));
        assertEquals("Pin 7 is configured as input.", e.getMessage());
    }

    @Test
    void setupWithSameDirectionKeepsValue() {
        hal.setup(8, PinDirection.OUT);
        hal.write(8, 1);

        hal.setup(8, PinDirection.OUT);

        assertEquals(1, hal.read(8));
    }

    // 方向を変えた再セットアップは「方向を上書きして値を0に戻す」という前提で実装している
    @Test
    void setupWithOtherDirectionResetsValue() {
        hal.setup(9, PinDirection.OUT);
        hal.write(9, 1);

        hal.setup(9, PinDirection.IN);
        assertEquals(new PinStatus(PinDirection.IN, 0), hal.list().get(9));

        hal.setup(9, PinDirection.OUT);
        assertEquals(new PinStatus(PinDirection.OUT, 0), hal.list().get(9));
    }

    @Test
    void listReturnsSnapshotSortedByPin() {
        hal.setup(22, PinDirection.OUT);
        hal.setup(4, PinDirection.IN);
        hal.write(22, 1);

        var snapshot = hal.list();
        assertArrayEquals(new Integer[] { 4, 22 }, snapshot.keySet().toArray(new Integer[0]));
        assertEquals(new PinStatus(PinDirection.IN, 0), snapshot.get(4));
        assertEquals(new PinStatus(PinDirection.OUT, 1), snapshot.get(22));

        hal.write(22, 0);
        assertEquals(1, snapshot.get(22).getValue());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(4));
    }

    @Test
    void teardownReleasesAllPins() {
        hal.setup(1, PinDirection.OUT);
        hal.setup(2, PinDirection.IN);

        hal.teardown();

        assertTrue(hal.list().isEmpty());
        assertThrows(PinNotInitializedException.class, () -> hal.read(1));
    }
}
