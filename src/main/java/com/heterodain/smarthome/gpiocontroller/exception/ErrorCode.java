package com.heterodain.smarthome.gpiocontroller.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * エラーコード
 */
@AllArgsConstructor
@Getter
public enum ErrorCode {
    /** 未初期化のピンへのアクセス */
    NOT_INITIALIZED(-32002),
    /** 引数不正 */
    INVALID_ARGUMENT(-32602),
    /** 未知のツール */
    METHOD_NOT_FOUND(-32601),
    /** 内部エラー */
    INTERNAL_ERROR(-32603);

    /** JSON-RPCのエラーコード */
    private final int code;
}
