package com.heterodain.smarthome.gpiocontroller.tool;

import java.util.Map;

import lombok.Value;

/**
 * ツール呼び出し
 */
@Value
public class ToolCall {
    /** ツール名 */
    String name;
    /** 引数 */
    Map<String, Object> arguments;

    public ToolCall(String name, Map<String, Object> arguments) {
        this.name = name;
        this.arguments = arguments == null ? Map.of() : arguments;
    }
}
