package com.heterodain.smarthome.gpiocontroller.tool.handler;

import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.device.PinDirection;
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
 * GPIOピンのセットアップ
 */
@Component
@Order(3)
@AllArgsConstructor
public class GpioSetupPinTool implements ToolHandler {
    private static final ToolSchema SCHEMA = ToolSchema.of(ToolParams.pin("GPIO pin number to setup"),
            ToolParam.builder().name("direction").type(ParamType.STRING)
                    .description("Pin direction: in for input, out for output").required(true)
                    .allowed(PinDirection.IN.getValue()).allowed(PinDirection.OUT.getValue()).build());

    private final GpioHal gpioHal;

    @Override
    public String getName() {
        return "gpio_setup_pin";
    }

    @Override
    public String getDescription() {
        return "Setup a GPIO pin as input or output";
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ToolArguments arguments) {
        var pin = arguments.getInt("pin");
        var direction = PinDirection.fromValue(arguments.getString("direction"));
        gpioHal.setup(pin, direction);
        return ToolResult.text("GPIO pin " + pin + " configured as " + direction.name());
    }
}
