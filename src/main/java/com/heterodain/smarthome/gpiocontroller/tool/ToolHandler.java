package com.heterodain.smarthome.gpiocontroller.tool;

/**
 * ツールのハンドラー
 * <p>
 * Springのコンポーネントとして登録すると {@link ToolDispatcher} から呼び出せるようになる。
 */
public interface ToolHandler {

    /**
     * ツール名
     * 
     * @return ツール名
     */
    String getName();

    /**
     * ツールの説明
     * 
     * @return 説明
     */
    String getDescription();

    /**
     * 引数のスキーマ
     * 
     * @return スキーマ
     */
    ToolSchema getSchema();

    /**
     * ツールを実行
     * 
     * @param arguments チェック済みの引数
     * @return 実行結果
     */
    ToolResult execute(ToolArguments arguments);
}
