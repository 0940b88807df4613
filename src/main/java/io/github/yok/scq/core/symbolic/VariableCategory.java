package io.github.yok.scq.core.symbolic;

/**
 * 量子化した座標変数の分類です。
 */
public enum VariableCategory {

    /**
     * 周期変数です（電荷基底で扱います）。
     */
    PERIODIC,

    /**
     * 拡張変数です（離散化磁束基底または調和振動子基底で扱います）。
     */
    EXTENDED,

    /**
     * 自由変数です。
     */
    FREE,

    /**
     * 凍結変数です。
     */
    FROZEN
}
