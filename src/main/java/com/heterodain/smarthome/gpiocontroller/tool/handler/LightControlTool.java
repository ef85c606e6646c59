package com.heterodain.smarthome.gpiocontroller.tool.handler;

import com.heterodain.smarthome.gpiocontroller.device.LightDevice;
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
 * 照明の制御
 */
@Component
@Order(5)
@AllArgsConstructor
public class LightControlTool implements ToolHandler {
    private static final ToolSchema SCHEMA = ToolSchema.of(
            ToolParams.action("Light control action", "on", "off", "toggle", "dim"),
            ToolParams.pin("GPIO pin connected to the light relay"),
            ToolParam.builder().name("brightness").type(ParamType.NUMBER)
                    .description("Brightness level (0-100) for dimming").minimum(0).maximum(100).build());

    private final LightDevice lightDevice;

    @Override
    public String getName() {
        return "control_light";
    }

    @Override
    public String getDescription() {
        return "Control smart home lighting";
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ToolArguments arguments) {
        var action = arguments.getString("action");
        var pin = arguments.getInt("pin");
        var prefix = "Light on pin " + pin;

        switch (action) {
        case "on":
            lightDevice.on(pin);
            return ToolResult.text(prefix + " turned ON");
        case "off":
            lightDevice.off(pin);
            return ToolResult.text(prefix + " turned OFF");
        case "toggle":
            var newValue = lightDevice.toggle(pin);
            return ToolResult.text(prefix + " toggled to " + ToolParams.onOff(newValue));
        case "dim":
            var brightness = arguments.optionalNumber("brightness");
            if (brightness.isEmpty()) {
                return ToolResult.failure("Brightness value required for dimming");
            }
            var value = lightDevice.dim(pin, brightness.get().doubleValue());
            return ToolResult.text(prefix + " dimmed to " + ToolArguments.format(brightness.get()) + "% ("
                    + ToolParams.onOff(value) + ")");
        default:
            throw new IllegalStateException("Unsupported action " + action);
        }
    }
}
