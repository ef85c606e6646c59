package com.heterodain.smarthome.gpiocontroller.mcp;

import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.heterodain.smarthome.gpiocontroller.exception.ErrorCode;
import com.heterodain.smarthome.gpiocontroller.exception.GpioControllerException;
import com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException;
import com.heterodain.smarthome.gpiocontroller.exception.MethodNotFoundException;
import com.heterodain.smarthome.gpiocontroller.tool.ToolCall;
import com.heterodain.smarthome.gpiocontroller.tool.ToolDispatcher;

import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * MCP(JSON-RPC 2.0)のメッセージ処理
 * <p>
 * メッセージの送受信は呼び出し側({@link McpStdioRunner}等)で行う。ツールのドメインエラーは通常の結果(isError=true)、
 * 未知のツールや引数不正、実行時エラーはJSON-RPCのエラーとして返す。
 */
@Component
@AllArgsConstructor
@Slf4j
public class McpProtocolHandler {
    /** サーバー名 */
    public static final String SERVER_NAME = "smart-home-mcp-server";
    /** サーバーのバージョン */
    public static final String SERVER_VERSION = "1.0.0";
    /** MCPのプロトコルバージョン */
    public static final String PROTOCOL_VERSION = "2024-11-05";

    /** JSON-RPC: パースエラー */
    static final int PARSE_ERROR = -32700;
    /** JSON-RPC: リクエスト不正 */
    static final int INVALID_REQUEST = -32600;

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    /** ツールの振り分け */
    private final ToolDispatcher toolDispatcher;
    /** JSONパーサー */
    private final ObjectMapper om;

    /**
     * JSON文字列のメッセージを処理
     * 
     * @param message リクエスト、または通知
     * @return レスポンス (通知の場合は空)
     */
    public Optional<String> handle(String message) {
        JsonNode request;
        try {
            request = om.readTree(message);
        } catch (JsonProcessingException e) {
            log.warn("メッセージを解析できません。{}", e.getOriginalMessage());
            return Optional.of(write(error(NullNode.getInstance(), PARSE_ERROR, "Parse error", null)));
        }
        return handle(request).map(this::write);
    }

    /**
     * メッセージを処理
     * 
     * @param request リクエスト、または通知
     * @return レスポンス (通知の場合は空)
     */
    public Optional<ObjectNode> handle(JsonNode request) {
        if (request == null || !request.isObject() || !request.path("method").isTextual()) {
            var id = request != null && request.has("id") ? request.get("id") : NullNode.getInstance();
            return Optional.of(error(id, INVALID_REQUEST, "Invalid Request", null));
        }

        var method = request.get("method").asText();
        var id = request.get("id");
        if (id == null) {
            log.debug("通知を受信しました。method={}", method);
            return Optional.empty();
        }

        try {
            JsonNode result;
            switch (method) {
            case "initialize":
                result = initialize();
                break;
            case "ping":
                result = om.createObjectNode();
                break;
            case "tools/list":
                result = listTools();
                break;
            case "tools/call":
                result = callTool(request.path("params"));
                break;
            default:
                throw new MethodNotFoundException("Method not found: " + method);
            }
            return Optional.of(success(id, result));

        } catch (GpioControllerException e) {
            String field = e instanceof InvalidArgumentException ? ((InvalidArgumentException) e).getField() : null;
            return Optional.of(error(id, e.getErrorCode().getCode(), e.getMessage(), field));
        } catch (RuntimeException e) {
            log.error("リクエストの処理に失敗しました。method={}", method, e);
            return Optional.of(error(id, ErrorCode.INTERNAL_ERROR.getCode(), "Internal error: " + e.getMessage(), null));
        }
    }

    private JsonNode initialize() {
        var result = om.createObjectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools");
        var serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", SERVER_VERSION);
        return result;
    }

    private JsonNode listTools() {
        var result = om.createObjectNode();
        result.set("tools", om.valueToTree(toolDispatcher.listTools()));
        return result;
    }

    private JsonNode callTool(JsonNode params) {
        var name = params.path("name");
        if (!name.isTextual()) {
            throw new InvalidArgumentException("name", "Missing tool name");
        }
        var arguments = params.path("arguments");
        if (!arguments.isMissingNode() && !arguments.isNull() && !arguments.isObject()) {
            throw new InvalidArgumentException("arguments", "Tool arguments must be an object");
        }

        Map<String, Object> argumentMap = arguments.isObject() ? om.convertValue(arguments, ARGUMENTS_TYPE) : Map.of();
        var result = toolDispatcher.dispatch(new ToolCall(name.asText(), argumentMap));
        return om.valueToTree(result);
    }

    private ObjectNode success(JsonNode id, JsonNode result) {
        var response = om.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message, String field) {
        var response = om.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        var error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        if (field != null) {
            error.putObject("data").put("field", field);
        }
        return response;
    }

    private String write(ObjectNode response) {
        try {
            return om.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
