package com.heterodain.smarthome.gpiocontroller.service;

import javax.annotation.PreDestroy;

import com.heterodain.smarthome.gpiocontroller.device.GpioHal;

import org.springframework.stereotype.Service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 終了時のGPIO開放
 */
@Service
@AllArgsConstructor
@Slf4j
public class GpioShutdownService {
    /** GPIO */
    private final GpioHal gpioHal;
    /** 自動停止のスケジューラー */
    private final TimedOperationScheduler scheduler;

    /**
     * 終了処理 (自動停止の予定を破棄してからピンを開放する)
     */
    @PreDestroy
    public void destroy() {
        log.debug("遅延実行をすべてキャンセルします。");
        scheduler.cancelAll();

        gpioHal.teardown();
    }
}
