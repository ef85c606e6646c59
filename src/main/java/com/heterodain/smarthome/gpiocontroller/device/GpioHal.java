package com.heterodain.smarthome.gpiocontroller.device;

import java.util.SortedMap;

/**
 * GPIOのハードウェア抽象化レイヤー
 * <p>
 * 実機(Pi4J)とシミュレーションの2つの実装があり、起動時の設定でどちらか一方を使う。
 * どちらの実装も成功時の振る舞いは同一であること。
 */
public interface GpioHal {

    /**
     * ピンのセットアップ
     * <p>
     * 同じ方向で再セットアップした場合は何もしない。異なる方向の場合は方向を上書きし、値を0に戻す。
     * 
     * @param pin       ピン番号(0～40)
     * @param direction 入出力方向
     */
    void setup(int pin, PinDirection direction);

    /**
     * セットアップ済みかどうか
     * 
     * @param pin ピン番号
     * @return true:セットアップ済み
     */
    boolean isInitialized(int pin);

    /**
     * ピンの値を読み込む
     * 
     * @param pin ピン番号
     * @return 0:LOW, 1:HIGH
     * @throws com.heterodain.smarthome.gpiocontroller.exception.PinNotInitializedException 未セットアップ
     */
    int read(int pin);

    /**
     * ピンに値を書き込む
     * 
     * @param pin   ピン番号
     * @param value 0:LOW, 1:HIGH
     * @throws com.heterodain.smarthome.gpiocontroller.exception.PinNotInitializedException 未セットアップ
     * @throws com.heterodain.smarthome.gpiocontroller.exception.InvalidArgumentException   値が0/1以外、入力ピン
     */
    void write(int pin, int value);

    /**
     * セットアップ済みのピンの一覧
     * 
     * @return ピン番号順のスナップショット
     */
    SortedMap<Integer, PinStatus> list();

    /**
     * 全ピンを開放する(シャットダウン時のみ)
     */
    void teardown();

    /**
     * シミュレーションかどうか
     * 
     * @return true:シミュレーション, false:実機
     */
    boolean isSimulated();
}
