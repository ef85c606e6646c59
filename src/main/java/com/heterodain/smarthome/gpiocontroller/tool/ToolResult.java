package com.heterodain.smarthome.gpiocontroller.tool;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * ツールの実行結果
 * <p>
 * ドメインエラー(明るさ未指定など)は isError=true の結果として返す。
 */
@EqualsAndHashCode
@ToString
public class ToolResult {
    /** 内容 */
    private final List<TextContent> content;
    /** ドメインエラーかどうか */
    private final boolean error;

    private ToolResult(List<TextContent> content, boolean error) {
        this.content = List.copyOf(content);
        this.error = error;
    }

    /**
     * テキストの結果
     * 
     * @param text テキスト
     * @return 結果
     */
    public static ToolResult text(String text) {
        return new ToolResult(List.of(new TextContent(text)), false);
    }

    /**
     * ドメインエラーの結果
     * 
     * @param message エラーメッセージ
     * @return 結果
     */
    public static ToolResult failure(String message) {
        return new ToolResult(List.of(new TextContent(message)), true);
    }

    @JsonProperty("content")
    public List<TextContent> getContent() {
        return content;
    }

    @JsonProperty("isError")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isError() {
        return error;
    }

    /**
     * 全テキストを連結して取得
     * 
     * @return テキスト
     */
    public String joinedText() {
        return content.stream().map(TextContent::getText).collect(Collectors.joining("\n"));
    }

    /**
     * 各テキストの末尾に文字列を付加した結果を取得
     * 
     * @param suffix 付加する文字列
     * @return 結果
     */
    public ToolResult withSuffix(String suffix) {
        var appended = content.stream().map(c -> new TextContent(c.getText() + suffix)).collect(Collectors.toList());
        return new ToolResult(appended, error);
    }

    /**
     * テキストの内容
     */
    @Value
    public static class TextContent {
        /** 種別 */
        String type = "text";
        /** テキスト */
        String text;
    }
}
