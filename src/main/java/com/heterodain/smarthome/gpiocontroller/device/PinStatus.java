package com.heterodain.smarthome.gpiocontroller.device;

import lombok.Value;

/**
 * ピンの状態(スナップショット)
 */
@Value
public class PinStatus {
    /** 入出力方向 */
    PinDirection direction;
    /** 値(0 or 1) */
    int value;
}
