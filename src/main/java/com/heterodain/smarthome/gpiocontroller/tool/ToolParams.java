package com.heterodain.smarthome.gpiocontroller.tool;

import com.heterodain.smarthome.gpiocontroller.device.Pins;

/**
 * よく使うツール引数の定義
 */
public final class ToolParams {

    private ToolParams() {
    }

    /**
     * ピン番号(必須、0～40)
     * 
     * @param description 説明
     * @return 引数の定義
     */
    public static ToolParam pin(String description) {
        return ToolParam.builder().name("pin").type(ParamType.INTEGER).description(description).required(true)
                .minimum(Pins.MIN_PIN).maximum(Pins.MAX_PIN).build();
    }

    /**
     * 操作(必須)
     * 
     * @param description 説明
     * @param actions     許可する操作
     * @return 引数の定義
     */
    public static ToolParam action(String description, String... actions) {
        var builder = ToolParam.builder().name("action").type(ParamType.STRING).description(description)
                .required(true);
        for (var action : actions) {
            builder.allowed(action);
        }
        return builder.build();
    }

    /**
     * HIGH/LOWの表記
     * 
     * @param value 値
     * @return HIGH or LOW
     */
    public static String level(int value) {
        return value == 1 ? "HIGH" : "LOW";
    }

    /**
     * ON/OFFの表記
     * 
     * @param value 値
     * @return ON or OFF
     */
    public static String onOff(int value) {
        return value == 1 ? "ON" : "OFF";
    }
}
