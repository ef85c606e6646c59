package com.heterodain.smarthome.gpiocontroller.device;

import java.time.Duration;

import com.heterodain.smarthome.gpiocontroller.service.TimedOperationScheduler;

import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * ポンプ(散水)デバイス
 * <p>
 * 時間指定で始動した場合は、指定時間後に自動停止する。手動停止、再始動で自動停止はキャンセルされる。
 */
@Component
@AllArgsConstructor
@Slf4j
public class PumpDevice {
    /** 自動停止までの最大時間 (これより長い指定はこの時間に丸める) */
    public static final Duration MAX_AUTO_STOP = Duration.ofDays(365L * 100);

    /** GPIO */
    private final GpioHal gpioHal;
    /** 自動停止のスケジューラー */
    private final TimedOperationScheduler scheduler;

    /**
     * 始動
     * 
     * @param pin      ピン番号
     * @param duration 稼働時間 (nullの場合は停止するまで稼働)
     */
    public void start(int pin, Duration duration) {
        var delay = duration == null || duration.compareTo(MAX_AUTO_STOP) <= 0 ? duration : MAX_AUTO_STOP;
        scheduler.runExclusive(pin, () -> {
            log.debug("ポンプを始動します。pin={}, duration={}", pin, duration);

            prepare(pin, PinDirection.OUT);
            gpioHal.write(pin, 1);

            if (duration == null) {
                scheduler.cancel(pin);
            } else {
                scheduler.schedule(pin, delay, () -> {
                    gpioHal.write(pin, 0);
                    log.info("ポンプを自動停止しました。pin={}, duration={}", pin, duration);
                });
            }
            return null;
        });
    }

    /**
     * 停止 (自動停止の予定があればキャンセル)
     * 
     * @param pin ピン番号
     */
    public void stop(int pin) {
        scheduler.runExclusive(pin, () -> {
            log.debug("ポンプを停止します。pin={}", pin);

            prepare(pin, PinDirection.OUT);
            gpioHal.write(pin, 0);

            if (scheduler.cancel(pin)) {
                log.info("ポンプの自動停止をキャンセルしました。pin={}", pin);
            }
            return null;
        });
    }

    /**
     * 稼働状態取得
     * <p>
     * 未使用のピンは停止中とみなし、ピンの設定は行わない。
     * 
     * @param pin ピン番号
     * @return true:稼働中, false:停止中
     */
    public boolean isRunning(int pin) {
        return scheduler.runExclusive(pin, () -> {
            return gpioHal.isInitialized(pin) && gpioHal.read(pin) == 1;
        });
    }

    private void prepare(int pin, PinDirection direction) {
        if (!gpioHal.isInitialized(pin)) {
            gpioHal.setup(pin, direction);
        }
    }
}
