package com.heterodain.smarthome.gpiocontroller.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * コンポーネント設定
 */
@Configuration
public class AppConfig {

    /**
     * JSONパーサーをDIコンテナに登録
     * 
     * @return ObjectMapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    /**
     * タスクスケジューラーの設定 (ポンプの自動停止用)
     * 
     * @param gpioProperties GPIOの設定
     * @return タスクスケジューラー
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(GpioProperties gpioProperties) {
        var config = gpioProperties.getScheduler();
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(config.getPoolSize());
        taskScheduler.setThreadNamePrefix(config.getThreadNamePrefix());
        taskScheduler.setRemoveOnCancelPolicy(true);
        return taskScheduler;
    }
}
