package com.heterodain.smarthome.gpiocontroller.service;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * ピンに対する遅延実行の操作(ポンプの自動停止など)
 */
@RequiredArgsConstructor
@Getter
@ToString(exclude = "future")
public class TimedOperation {
    /** ピン番号 */
    private final int pin;
    /** 世代番号(ピンごとに単調増加) */
    private final long generation;
    /** 実行予定時刻 */
    private final Instant fireAt;

    /** キャンセル済み */
    private volatile boolean cancelled;
    /** 実行済み */
    private volatile boolean fired;

    /** スケジュール結果 */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.PACKAGE)
    private volatile ScheduledFuture<?> future;

    /**
     * 実行待ちかどうか
     * 
     * @return true:実行待ち
     */
    public boolean isLive() {
        return !cancelled && !fired;
    }

    void cancel() {
        cancelled = true;
        if (future != null) {
            future.cancel(false);
        }
    }

    void markFired() {
        fired = true;
    }
}
