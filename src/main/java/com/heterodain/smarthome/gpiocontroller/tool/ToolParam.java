package com.heterodain.smarthome.gpiocontroller.tool;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * ツール引数の定義
 */
@Value
@Builder
public class ToolParam {
    /** 引数名 */
    String name;
    /** 型 */
    ParamType type;
    /** 説明 */
    String description;
    /** 必須かどうか */
    boolean required;
    /** 最小値 */
    Number minimum;
    /** 最大値 */
    Number maximum;
    /** 許可する値 */
    @Singular("allowed")
    List<Object> allowedValues;

    /**
     * JSON Schemaのプロパティ定義
     * 
     * @return プロパティ定義
     */
    public Map<String, Object> toSchema() {
        var schema = new LinkedHashMap<String, Object>();
        schema.put("type", type.getSchemaType());
        schema.put("description", description);
        if (minimum != null) {
            schema.put("minimum", minimum);
        }
        if (maximum != null) {
            schema.put("maximum", maximum);
        }
        if (!allowedValues.isEmpty()) {
            schema.put("enum", allowedValues);
        }
        return schema;
    }

    /**
     * 値のチェック
     * 
     * @param value 値(null不可)
     * @return 正規化した値 (数値はBigDecimal、文字列はString)
     */
    Object validate(Object value) {
        Object normalized;
        switch (type) {
        case STRING:
            if (!(value instanceof String)) {
                throw invalid("must be a string");
            }
            normalized = value;
            break;
        case INTEGER:
        case NUMBER:
            var number = toDecimal(value);
            if (type == ParamType.INTEGER && number.stripTrailingZeros().scale() > 0) {
                throw invalid("must be an integer");
            }
            if (minimum != null && number.compareTo(toDecimal(minimum)) < 0) {
                throw invalid("must be >= " + minimum);
            }
            if (maximum != null && number.compareTo(toDecimal(maximum)) > 0) {
                throw invalid("must be <= " + maximum);
            }
            normalized = number;
            break;
        default:
            throw new IllegalStateException("Unsupported type " + type);
        }

        var checked = normalized;
        if (!allowedValues.isEmpty() && allowedValues.stream().noneMatch(a -> matches(a, checked))) {
            throw invalid("must be one of " + allowedValues);
        }
        return checked;
    }

    private BigDecimal toDecimal(Object value) {
        if (!(value instanceof Number)) {
            throw invalid("must be a number");
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            throw invalid("must be a finite number");
        }
    }

    private static boolean matches(Object allowed, Object value) {
        if (allowed instanceof Number && value instanceof BigDecimal) {
            return new BigDecimal(allowed.toString()).compareTo((BigDecimal) value) == 0;
        }
        return allowed.equals(value);
    }

    private InvalidArgumentException invalid(String reason) {
        return new InvalidArgumentException(name, "Invalid argument '" + name + "': " + reason);
    }
}
