package com.heterodain.smarthome.gpiocontroller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * スマートホームGPIOコントローラー
 */
@SpringBootApplication
public class GpioControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GpioControllerApplication.class, args);
    }
}
