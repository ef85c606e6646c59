package com.heterodain.smarthome.gpiocontroller.tool.handler;

import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.tool.ParamType;
import com.heterodain.smarthome.gpiocontroller.tool.ToolArguments;
import com.heterodain.smarthome.gpiocontroller.tool.ToolHandler;
import com.heterodain.smarthome.gpiocontroller.tool.ToolParam;
import com.heterodain.smarthome.gpiocontroller.tool.ToolParams;
import com.heterodain.smarthome.gpiocontroller.tool.ToolResult;
import com.heterodain.smarthome.gpiocontroller.tool.ToolSchema;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;

/**
 * GPIOピンへの書き込み
 */
@Component
@Order(2)
@AllArgsConstructor
public class GpioWritePinTool implements ToolHandler {
    private static final ToolSchema SCHEMA = ToolSchema.of(ToolParams.pin("GPIO pin number to control"),
            ToolParam.builder().name("value").type(ParamType.INTEGER).description("Pin value: 0 for LOW, 1 for HIGH")
                    .required(true).allowed(0).allowed(1).build());

    private final GpioHal gpioHal;

    @Override
    public String getName() {
        return "gpio_write_pin";
    }

    @Override
    public String getDescription() {
        return "Set the state of a GPIO pin (HIGH/LOW)";
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ToolArguments arguments) {
        var pin = arguments.getInt("pin");
        var value = arguments.getInt("value");
        gpioHal.write(pin, value);
        return ToolResult.text("GPIO pin " + pin + " set to " + ToolParams.level(value) + " (" + value + ")");
    }
}
