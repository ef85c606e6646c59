package com.heterodain.smarthome.gpiocontroller.tool.handler;

import java.math.BigDecimal;
import java.time.Duration;

import com.heterodain.smarthome.gpiocontroller.device.PumpDevice;
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
 * ポンプ(散水)の制御
 */
@Component
@Order(6)
@AllArgsConstructor
public class PumpControlTool implements ToolHandler {
    private static final ToolSchema SCHEMA = ToolSchema.of(
            ToolParams.action("Pump control action", "start", "stop", "status"),
            ToolParams.pin("GPIO pin connected to the pump relay"),
            ToolParam.builder().name("duration").type(ParamType.NUMBER)
                    .description("Duration in seconds for timed operation").minimum(1).build());

    private static final BigDecimal MAX_SECONDS = BigDecimal.valueOf(PumpDevice.MAX_AUTO_STOP.getSeconds());

    private final PumpDevice pumpDevice;

    @Override
    public String getName() {
        return "control_pump";
    }

    @Override
    public String getDescription() {
        return "Control water pump or irrigation system";
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ToolArguments arguments) {
        var action = arguments.getString("action");
        var pin = arguments.getInt("pin");
        var prefix = "Pump on pin " + pin;

        switch (action) {
        case "start":
            var duration = arguments.optionalNumber("duration");
            pumpDevice.start(pin, duration.map(PumpControlTool::toDuration).orElse(null));
            return ToolResult.text(prefix + " started"
                    + duration.map(d -> " for " + ToolArguments.format(d) + " seconds").orElse(""));
        case "stop":
            pumpDevice.stop(pin);
            return ToolResult.text(prefix + " stopped");
        case "status":
            return ToolResult.text(prefix + " is " + (pumpDevice.isRunning(pin) ? "RUNNING" : "STOPPED"));
        default:
            throw new IllegalStateException("Unsupported action " + action);
        }
    }

    private static Duration toDuration(BigDecimal seconds) {
        if (seconds.compareTo(MAX_SECONDS) > 0) {
            return PumpDevice.MAX_AUTO_STOP;
        }
        return Duration.ofMillis(seconds.movePointRight(3).longValue());
    }
}
