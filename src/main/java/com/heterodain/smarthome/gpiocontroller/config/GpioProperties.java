package com.heterodain.smarthome.gpiocontroller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * GPIOの設定
 */
@Component
@ConfigurationProperties("gpio")
@Data
public class GpioProperties {
    /** 動作モード */
    private Mode mode = Mode.SIMULATED;
    /** シミュレーション時、ツールの結果にマーカーを付加するかどうか */
    private boolean simulatedMarker = false;
    /** 自動停止スケジューラーの設定 */
    private Scheduler scheduler = new Scheduler();
    /** 標準入出力の設定 */
    private Stdio stdio = new Stdio();

    /**
     * 動作モード
     */
    public enum Mode {
        /** シミュレーション */
        SIMULATED,
        /** 実機(Pi4J) */
        REAL
    }

    /**
     * 自動停止スケジューラーの設定情報
     */
    @Data
    public static class Scheduler {
        /** スレッド数 */
        private int poolSize = 2;
        /** スレッド名のプレフィックス */
        private String threadNamePrefix = "timer";
    }

    /**
     * 標準入出力の設定情報
     */
    @Data
    public static class Stdio {
        /** 標準入出力でMCPのメッセージを処理するかどうか */
        private boolean enabled = false;
    }
}
