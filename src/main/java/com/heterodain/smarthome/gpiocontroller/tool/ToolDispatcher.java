package com.heterodain.smarthome.gpiocontroller.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.heterodain.smarthome.gpiocontroller.config.GpioProperties;
import com.heterodain.smarthome.gpiocontroller.device.GpioHal;
import com.heterodain.smarthome.gpiocontroller.exception.MethodNotFoundException;
import com.heterodain.smarthome.gpiocontroller.exception.ToolExecutionException;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * ツールの呼び出しを各ハンドラーに振り分ける
 */
@Component
@Slf4j
public class ToolDispatcher {
    /** シミュレーション時に結果に付加するマーカー */
    public static final String SIMULATED_MARKER = " [simulated]";

    /** ツール名ごとのハンドラー */
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();
    /** GPIO */
    private final GpioHal gpioHal;
    /** GPIOの設定 */
    private final GpioProperties gpioProperties;

    public ToolDispatcher(List<ToolHandler> handlers, GpioHal gpioHal, GpioProperties gpioProperties) {
        handlers.forEach(h -> {
            if (this.handlers.putIfAbsent(h.getName(), h) != null) {
                throw new IllegalStateException("Duplicate tool name: " + h.getName());
            }
        });
        this.gpioHal = gpioHal;
        this.gpioProperties = gpioProperties;
    }

    /**
     * ツールを実行
     * 
     * @param call ツール呼び出し
     * @return 実行結果
     * @throws MethodNotFoundException                                                      未知のツール
     * @throws com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException 引数不正
     * @throws ToolExecutionException                                                       ツール実行中のエラー
     */
    public ToolResult dispatch(ToolCall call) {
        var handler = handlers.get(call.getName());
        if (handler == null) {
            throw new MethodNotFoundException("Unknown tool: " + call.getName());
        }

        // ハードウェアに触る前に引数をチェック
        var arguments = handler.getSchema().validate(call.getArguments());

        log.debug("ツールを実行します。name={}, arguments={}", call.getName(), call.getArguments());
        ToolResult result;
        try {
            result = handler.execute(arguments);
        } catch (RuntimeException e) {
            log.warn("ツールの実行に失敗しました。name={}", call.getName(), e);
            throw new ToolExecutionException("Tool execution failed: " + e.getMessage(), e);
        }

        if (result.isError()) {
            log.info("ツールがエラーを返しました。name={}, result={}", call.getName(), result.joinedText());
        }
        if (gpioHal.isSimulated() && gpioProperties.isSimulatedMarker()) {
            result = result.withSuffix(SIMULATED_MARKER);
        }
        return result;
    }

    /**
     * ツールの一覧 (名前、説明、引数のJSON Schema)
     * 
     * @return ツールの一覧
     */
    public List<Map<String, Object>> listTools() {
        return handlers.values().stream().map(h -> {
            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put("name", h.getName());
            tool.put("description", h.getDescription());
            tool.put("inputSchema", h.getSchema().toJsonSchema());
            return tool;
        }).collect(Collectors.toList());
    }
}
