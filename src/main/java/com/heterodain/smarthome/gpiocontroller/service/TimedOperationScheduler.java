package com.heterodain.smarthome.gpiocontroller.service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * ピンごとの遅延実行スケジューラー
 * <p>
 * ピンごとに実行待ちの操作は最大1つ。新たにスケジュールすると前の操作はキャンセルされる。
 * 実行時は世代番号が最新であることを確認してから操作を行うため、キャンセル後や再スケジュール後に古い操作が実行されることはない。
 */
@Service
@Slf4j
public class TimedOperationScheduler {
    /** タスクスケジューラー */
    private final TaskScheduler taskScheduler;

    /** ピンごとの状態 */
    private final Map<Integer, PinSlot> slots = new ConcurrentHashMap<>();

    public TimedOperationScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /**
     * ピンの排他制御下で処理を実行する
     * <p>
     * 遅延実行の操作も同じロックを取るので、処理中に操作が割り込むことはない。
     * 
     * @param pin    ピン番号
     * @param action 処理
     * @return 処理結果
     */
    public <T> T runExclusive(int pin, Supplier<T> action) {
        var slot = slot(pin);
        synchronized (slot) {
            return action.get();
        }
    }

    /**
     * 遅延実行をスケジュールする (実行待ちの操作があればキャンセルする)
     * 
     * @param pin    ピン番号
     * @param delay  遅延時間
     * @param action 操作
     * @return スケジュールした操作
     */
    public TimedOperation schedule(int pin, Duration delay, Runnable action) {
        var slot = slot(pin);
        synchronized (slot) {
            cancelLive(slot);

            var fireAt = taskScheduler.getClock().instant().plus(delay);
            var operation = new TimedOperation(pin, ++slot.generation, fireAt);
            slot.live = operation;
            operation.setFuture(taskScheduler.schedule(() -> fire(slot, operation, action), fireAt));

            log.debug("遅延実行をスケジュールしました。{}", operation);
            return operation;
        }
    }

    /**
     * 実行待ちの操作をキャンセルする
     * 
     * @param pin ピン番号
     * @return true:キャンセルした, false:実行待ちの操作なし
     */
    public boolean cancel(int pin) {
        var slot = slot(pin);
        synchronized (slot) {
            return cancelLive(slot);
        }
    }

    /**
     * 実行待ちの操作を取得
     * 
     * @param pin ピン番号
     * @return 実行待ちの操作
     */
    public Optional<TimedOperation> pending(int pin) {
        var slot = slot(pin);
        synchronized (slot) {
            return Optional.ofNullable(slot.live);
        }
    }

    /**
     * 全ての実行待ちの操作をキャンセルする
     */
    public void cancelAll() {
        slots.forEach((pin, slot) -> {
            synchronized (slot) {
                cancelLive(slot);
            }
        });
    }

    private void fire(PinSlot slot, TimedOperation operation, Runnable action) {
        synchronized (slot) {
            if (operation.getGeneration() != slot.generation) {
                log.debug("古い遅延実行のため無視します。{}", operation);
                return;
            }
            slot.live = null;
            operation.markFired();

            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("遅延実行に失敗しました。pin={}", operation.getPin(), e);
            }
        }
    }

    private boolean cancelLive(PinSlot slot) {
        // 実行待ちが無くても世代を進め、実行中の古い操作を無効にする
        slot.generation++;
        var live = slot.live;
        if (live == null) {
            return false;
        }

        live.cancel();
        slot.live = null;
        log.debug("遅延実行をキャンセルしました。{}", live);
        return true;
    }

    private PinSlot slot(int pin) {
        return slots.computeIfAbsent(pin, p -> new PinSlot());
    }

    /**
     * ピンごとのロック兼状態
     */
    private static class PinSlot {
        /** 世代番号 */
        private long generation;
        /** 実行待ちの操作 */
        private TimedOperation live;
    }
}
