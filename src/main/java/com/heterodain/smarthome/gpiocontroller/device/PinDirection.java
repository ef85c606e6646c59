package com.heterodain.smarthome.gpiocontroller.device;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonValue;
import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * ピンの入出力方向
 */
@AllArgsConstructor
@Getter
public enum PinDirection {
    /** 入力 */
    IN("in"),
    /** 出力 */
    OUT("out");

    /** ツール引数、ステータス出力での表記 */
    @JsonValue
    private final String value;

    /**
     * 表記から入出力方向を取得
     * 
     * @param value 表記(in/out)
     * @return 入出力方向
     */
    public static PinDirection fromValue(String value) {
        return Arrays.stream(values()).filter(d -> d.value.equals(value)).findFirst()
                .orElseThrow(() -> new InvalidArgumentException("direction",
                        "Invalid direction: " + value + " (expected in or out)"));
    }
}
