package com.heterodain.smarthome.gpiocontroller.tool;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * ツール引数の型
 */
@AllArgsConstructor
@Getter
public enum ParamType {
    /** 整数 */
    INTEGER("integer"),
    /** 数値 */
    NUMBER("number"),
    /** 文字列 */
    STRING("string");

    /** JSON Schemaでの型名 */
    private final String schemaType;
}
