package com.heterodain.smarthome.gpiocontroller.config;

import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.device.RealGpioHal;
import com.heterodain.smarthome.gpiocontroller.device.SimulatedGpioHal;
import com.pi4j.io.gpio.GpioFactory;
import com.pi4j.io.gpio.RaspiGpioProvider;
import com.pi4j.io.gpio.RaspiPinNumberingScheme;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * GPIO設定
 */
@Configuration
@Slf4j
public class GpioConfig {

    /**
     * GPIO (動作モードに応じて実機かシミュレーションを選択)
     * 
     * @param gpioProperties GPIOの設定
     * @return GPIO
     */
    @Bean
    public GpioHal gpioHal(GpioProperties gpioProperties) {
        switch (gpioProperties.getMode()) {
        case REAL:
            log.info("実機のGPIOを使用します。");

            // ピン番号はBCM番号で指定する
            GpioFactory.setDefaultProvider(new RaspiGpioProvider(RaspiPinNumberingScheme.BROADCOM_PIN_NUMBERING));
            return new RealGpioHal(GpioFactory.getInstance(), RealGpioHal.BROADCOM_PIN_RESOLVER);
        case SIMULATED:
        default:
            log.info("シミュレーションのGPIOを使用します。");
            return new SimulatedGpioHal();
        }
    }
}
