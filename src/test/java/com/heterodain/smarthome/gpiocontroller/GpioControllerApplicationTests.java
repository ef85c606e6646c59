package com.heterodain.smarthome.gpiocontroller;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.mcp.McpProtocolHandler;
import com.heterodain.smarthome.gpiocontroller.mcp.McpStdioRunner;
import com.heterodain.smarthome.gpiocontroller.tool.ToolCall;
import com.heterodain.smarthome.gpiocontroller.tool.ToolDispatcher;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = "gpio.simulated-marker=true")
class GpioControllerApplicationTests {

    @Autowired
    private GpioHal gpioHal;
    @Autowired
    private ToolDispatcher toolDispatcher;
    @Autowired
    private McpProtocolHandler mcpProtocolHandler;
    @Autowired
    private ApplicationContext context;

    @Test
    void wiresSimulatedHalAndAllTools() {
        assertTrue(gpioHal.isSimulated());
        assertEquals(6, toolDispatcher.listTools().size());
    }

    @Test
    void stdioRunnerIsDisabledByDefault() {
        assertTrue(context.getBeansOfType(McpStdioRunner.class).isEmpty());
    }

    @Test
    void dispatchesThroughContext() {
        var result = toolDispatcher.dispatch(new ToolCall("control_light", Map.of("action", "on", "pin", 26)));
        assertEquals("Light on pin 26 turned ON" + ToolDispatcher.SIMULATED_MARKER, result.joinedText());

        var response = mcpProtocolHandler.handle("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");
        assertTrue(response.isPresent());
    }
}
