package com.heterodain.smarthome.gpiocontroller.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;

import lombok.Getter;

/**
 * ツール引数のスキーマ
 */
@Getter
public class ToolSchema {
    /** 引数の定義 */
    private final List<ToolParam> params;

    private ToolSchema(List<ToolParam> params) {
        this.params = List.copyOf(params);
    }

    public static ToolSchema of(ToolParam... params) {
        return new ToolSchema(List.of(params));
    }

    /**
     * JSON Schema形式に変換
     * 
     * @return JSON Schema
     */
    public Map<String, Object> toJsonSchema() {
        var properties = new LinkedHashMap<String, Object>();
        params.forEach(p -> properties.put(p.getName(), p.toSchema()));

        var schema = new LinkedHashMap<String, Object>();
        schema.put("type", "object");
        schema.put("properties", properties);
        var required = params.stream().filter(ToolParam::isRequired).map(ToolParam::getName)
                .collect(Collectors.toList());
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    /**
     * 引数をチェック (定義に無い引数は無視)
     * 
     * @param arguments 引数
     * @return チェック済みの引数
     * @throws InvalidArgumentException 必須引数なし、範囲外、許可されていない値
     */
    public ToolArguments validate(Map<String, Object> arguments) {
        var values = new LinkedHashMap<String, Object>();
        for (var param : params) {
            var value = arguments.get(param.getName());
            if (value == null) {
                if (param.isRequired()) {
                    throw new InvalidArgumentException(param.getName(),
                            "Missing required argument '" + param.getName() + "'");
                }
                continue;
            }
            values.put(param.getName(), param.validate(value));
        }
        return new ToolArguments(values);
    }
}
