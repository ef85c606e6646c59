package com.heterodain.smarthome.gpiocontroller.device;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;
import com.heterodain.smarthome.gpiocontroller.service.TimedOperationScheduler;
import com.heterodain.smarthome.gpiocontroller.support.ManualTaskScheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PumpDeviceTest {
    private static final int PIN = 19;

    private ManualTaskScheduler taskScheduler;
    private SimulatedGpioHal gpioHal;
    private TimedOperationScheduler scheduler;
    private PumpDevice pumpDevice;

    @BeforeEach
    void setUp() {
        taskScheduler = new ManualTaskScheduler();
        gpioHal = new SimulatedGpioHal();
        scheduler = new TimedOperationScheduler(taskScheduler);
        pumpDevice = new PumpDevice(gpioHal, scheduler);
    }

    @Test
    void timedStartStopsAutomatically() {
        pumpDevice.start(PIN, Duration.ofSeconds(3));
        assertTrue(pumpDevice.isRunning(PIN));
        assertTrue(scheduler.pending(PIN).isPresent());

        taskScheduler.advance(Duration.ofMillis(2900));
        assertTrue(pumpDevice.isRunning(PIN));

        taskScheduler.advance(Duration.ofMillis(100));
        assertFalse(pumpDevice.isRunning(PIN));
        assertTrue(scheduler.pending(PIN).isEmpty());
    }

    @Test
    void manualStopPreemptsAutoStop() {
        pumpDevice.start(PIN, Duration.ofSeconds(5));
        taskScheduler.advance(Duration.ofSeconds(1));

        pumpDevice.stop(PIN);
        assertFalse(pumpDevice.isRunning(PIN));
        assertTrue(scheduler.pending(PIN).isEmpty());

        // 手動で再始動しても、元の5秒の自動停止は発生しない
        gpioHal.write(PIN, 1);
        taskScheduler.advance(Duration.ofSeconds(5));
        assertEquals(1, gpioHal.read(PIN));
    }

    @Test
    void restartReArmsCountdown() {
        pumpDevice.start(PIN, Duration.ofSeconds(5));
        taskScheduler.advance(Duration.ofSeconds(1));
        pumpDevice.start(PIN, Duration.ofSeconds(2));

        taskScheduler.advance(Duration.ofMillis(1999));
        assertTrue(pumpDevice.isRunning(PIN));

        // 2回目の始動から2秒後(最初の始動から3秒後)に停止
        taskScheduler.advance(Duration.ofMillis(1));
        assertFalse(pumpDevice.isRunning(PIN));
        assertEquals(0, taskScheduler.pendingCount());
    }

    @Test
    void startWithoutDurationCancelsPendingAutoStop() {
        pumpDevice.start(PIN, Duration.ofSeconds(5));
        pumpDevice.start(PIN, null);

        taskScheduler.advance(Duration.ofSeconds(10));

        assertTrue(pumpDevice.isRunning(PIN));
        assertTrue(scheduler.pending(PIN).isEmpty());
    }

    @Test
    void stopIsIdempotent() {
        pumpDevice.stop(PIN);
        pumpDevice.stop(PIN);

        assertFalse(pumpDevice.isRunning(PIN));
        assertEquals(new PinStatus(PinDirection.OUT, 0), gpioHal.list().get(PIN));
    }

    @Test
    void statusCannotDistinguishTimedFromIndefiniteRun() {
        pumpDevice.start(20, Duration.ofSeconds(30));
        pumpDevice.start(21, null);

        assertEquals(pumpDevice.isRunning(20), pumpDevice.isRunning(21));
    }

    @Test
    void statusOnFreshPinLeavesItUnregistered() {
        assertFalse(pumpDevice.isRunning(22));
        assertFalse(gpioHal.isInitialized(22));
    }

    @Test
    void startAfterStatusOnFreshPin() {
        assertFalse(pumpDevice.isRunning(22));

        pumpDevice.start(22, Duration.ofSeconds(3));

        assertTrue(pumpDevice.isRunning(22));
        assertEquals(new PinStatus(PinDirection.OUT, 1), gpioHal.list().get(22));
    }

    @Test
    void durationBeyondLimitIsCapped() {
        pumpDevice.start(PIN, Duration.ofSeconds(Long.MAX_VALUE / 2));

        var pending = scheduler.pending(PIN).orElseThrow();
        assertEquals(taskScheduler.getClock().instant().plus(PumpDevice.MAX_AUTO_STOP), pending.getFireAt());

        taskScheduler.advance(Duration.ofDays(1));
        assertTrue(pumpDevice.isRunning(PIN));
    }

    @Test
    void failedStartLeavesPendingAutoStopUntouched() {
        pumpDevice.start(PIN, Duration.ofSeconds(5));
        gpioHal.setup(PIN, PinDirection.IN);

        assertThrows(InvalidArgumentException.class, () -> pumpDevice.start(PIN, Duration.ofSeconds(1)));

        var pending = scheduler.pending(PIN).orElseThrow();
        assertEquals(taskScheduler.getClock().instant().plusSeconds(5), pending.getFireAt());
    }
}
