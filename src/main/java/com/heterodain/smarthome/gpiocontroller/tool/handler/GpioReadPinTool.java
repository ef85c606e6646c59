package com.heterodain.smarthome.gpiocontroller.tool.handler;

import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.tool.ToolArguments;
import com.heterodain.smarthome.gpiocontroller.tool.ToolHandler;
import com.heterodain.smarthome.gpiocontroller.tool.ToolParams;
import com.heterodain.smarthome.gpiocontroller.tool.ToolResult;
import com.heterodain.smarthome.gpiocontroller.tool.ToolSchema;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;

/**
 * GPIOピンの読み込み
 */
@Component
@Order(1)
@AllArgsConstructor
public class GpioReadPinTool implements ToolHandler {
    private static final ToolSchema SCHEMA = ToolSchema.of(ToolParams.pin("GPIO pin number to read"));

    private final GpioHal gpioHal;

    @Override
    public String getName() {
        return "gpio_read_pin";
    }

    @Override
    public String getDescription() {
        return "Read the current state of a GPIO pin";
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ToolArguments arguments) {
        var pin = arguments.getInt("pin");
        var value = gpioHal.read(pin);
        return ToolResult.text("GPIO pin " + pin + " current state: " + ToolParams.level(value) + " (" + value + ")");
    }
}
