package com.heterodain.smarthome.gpiocontroller.mcp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 標準入出力でMCPのメッセージを送受信する
 * <p>
 * 1行に1メッセージ(JSON)。標準入力が閉じられたらアプリケーションを終了する。
 */
@Component
@ConditionalOnProperty(prefix = "gpio.stdio", name = "enabled", havingValue = "true")
@AllArgsConstructor
@Slf4j
public class McpStdioRunner implements CommandLineRunner {
    /** メッセージ処理 */
    private final McpProtocolHandler mcpProtocolHandler;
    /** アプリケーションコンテキスト */
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        log.info("標準入出力でリクエストを待ち受けます。");

        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        serve(in, out);

        log.info("標準入力が閉じられたため終了します。");
        context.close();
    }

    /**
     * 入力が終わるまでメッセージを処理
     * 
     * @param in  入力
     * @param out 出力
     * @throws IOException 入出力エラー
     */
    void serve(BufferedReader in, Writer out) throws IOException {
        var writer = new PrintWriter(out);
        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            var response = mcpProtocolHandler.handle(line);
            if (response.isPresent()) {
                writer.print(response.get());
                writer.print('\n');
                writer.flush();
            }
        }
    }
}
