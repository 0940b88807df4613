package io.github.yok.scq.core.basis;

import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.scq.core.symbolic.VariableCategory;
import lombok.RequiredArgsConstructor;

/**
 * 変数の分類と基底設定から局所基底を生成するクラスです。
 *
 * <p>
 * 周期変数は電荷基底、拡張変数は ext_basis に応じて離散化磁束基底または調和振動子基底です。
 * 自由変数・凍結変数は演算子を持たないため生成できません。
 * </p>
 */
@RequiredArgsConstructor
public final class BasisOperatorFactory {

    /**
     * 調和振動子基底の変位演算子に使う固有分解バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 局所基底を生成します。
     *
     * @param index 変数番号です
     * @param category 変数分類です
     * @param extBasis 拡張変数の基底の種類です
     * @param cutoff 打ち切り（周期変数は電荷数、拡張変数は格子点数または振動子の次元）です
     * @param phiRange 離散化範囲 {min, max} です（離散化磁束基底のときのみ使用）
     * @param oscillatorLength 振動子長です（調和振動子基底のときのみ使用）
     * @return 局所基底です
     * @throws ConfigurationException 自由変数・凍結変数を指定した場合に発生します
     */
    public VariableBasis create(int index, VariableCategory category, ExtBasis extBasis,
            int cutoff, double[] phiRange, double oscillatorLength) {
        switch (category) {
            case PERIODIC:
                return new ChargeBasis(cutoff);
            case EXTENDED:
                if (extBasis == ExtBasis.HARMONIC) {
                    return new HarmonicOscillatorBasis(cutoff, oscillatorLength, eigenBackend);
                }
                return new DiscretizedFluxBasis(new Grid1d(phiRange[0], phiRange[1], cutoff));
            default:
                throw new ConfigurationException(
                        "変数 " + index + " は " + category + " のため演算子を生成できません");
        }
    }

    /**
     * 変数分類に対応する打ち切りパラメータ名を返します。
     *
     * @param index 変数番号です
     * @param category 変数分類です
     * @return 打ち切りパラメータ名（cutoff_n_i または cutoff_ext_i）です
     */
    public static String cutoffName(int index, VariableCategory category) {
        return ((category == VariableCategory.PERIODIC) ? "cutoff_n_" : "cutoff_ext_") + index;
    }

    /**
     * 打ち切り値から局所基底の次元を返します。
     *
     * @param category 変数分類です
     * @param cutoff 打ち切り値です
     * @return 次元です
     */
    public static int dimensionFor(VariableCategory category, int cutoff) {
        return (category == VariableCategory.PERIODIC) ? 2 * cutoff + 1 : cutoff;
    }
}
