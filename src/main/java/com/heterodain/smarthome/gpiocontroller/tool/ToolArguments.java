package com.heterodain.smarthome.gpiocontroller.tool;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * チェック済みのツール引数
 */
public class ToolArguments {
    /** 引数 (数値はBigDecimal) */
    private final Map<String, Object> values;

    ToolArguments(Map<String, Object> values) {
        this.values = Map.copyOf(values);
    }

    public int getInt(String name) {
        return getNumber(name).intValueExact();
    }

    public BigDecimal getNumber(String name) {
        return optionalNumber(name).orElseThrow(() -> new IllegalStateException("No argument " + name));
    }

    public Optional<BigDecimal> optionalNumber(String name) {
        return Optional.ofNullable((BigDecimal) values.get(name));
    }

    public String getString(String name) {
        return Optional.ofNullable((String) values.get(name))
                .orElseThrow(() -> new IllegalStateException("No argument " + name));
    }

    /**
     * 数値をテキスト表記に変換 (3.0→"3", 2.50→"2.5")
     * 
     * @param number 数値
     * @return テキスト
     */
    public static String format(BigDecimal number) {
        var stripped = number.stripTrailingZeros();
        return (stripped.scale() < 0 ? stripped.setScale(0) : stripped).toPlainString();
    }
}
