package com.heterodain.smarthome.gpiocontroller.tool.handler;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.tool.ToolArguments;
import com.heterodain.smarthome.gpiocontroller.tool.ToolHandler;
import com.heterodain.smarthome.gpiocontroller.tool.ToolResult;
import com.heterodain.smarthome.gpiocontroller.tool.ToolSchema;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;

/**
 * セットアップ済みのGPIOピンの一覧
 */
@Component
@Order(4)
@AllArgsConstructor
public class GpioListPinsTool implements ToolHandler {
    private static final ToolSchema SCHEMA = ToolSchema.of();

    private final GpioHal gpioHal;
    /** JSONパーサー */
    private final ObjectMapper om;

    @Override
    public String getName() {
        return "gpio_list_pins";
    }

    @Override
    public String getDescription() {
        return "List all configured GPIO pins and their current states";
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ToolArguments arguments) {
        // JSONのキーは文字列のピン番号
        var status = new LinkedHashMap<String, Object>();
        gpioHal.list().forEach((pin, pinStatus) -> status.put(String.valueOf(pin), pinStatus));

        try {
            return ToolResult.text("GPIO Pin Status:\n" + om.writerWithDefaultPrettyPrinter().writeValueAsString(status));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
