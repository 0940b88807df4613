package io.github.yok.scq.out;

import io.github.yok.scq.core.circuit.Circuit;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * パラメータを掃引して計算することを前提とし、出力の命名規約に必要な掃引パラメータ名とその値を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 固有値と回路の構成情報を出力します。
     *
     * @param circuit 回路です
     * @param sweepParameter 掃引パラメータ名です（掃引しない場合は null）
     * @param sweepValue 掃引パラメータの値です（掃引しない場合は無視）
     * @param eigenvalues 固有値（昇順）です
     */
    void write(Circuit circuit, String sweepParameter, double sweepValue, double[] eigenvalues);
}
