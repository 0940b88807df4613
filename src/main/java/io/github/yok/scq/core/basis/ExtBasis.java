package io.github.yok.scq.core.basis;

/**
 * 拡張変数の局所基底の種類です。
 */
public enum ExtBasis {

    /**
     * 格子点上に離散化した磁束基底です。
     */
    DISCRETIZED,

    /**
     * 調和振動子の固有状態による基底です。
     */
    HARMONIC
}
