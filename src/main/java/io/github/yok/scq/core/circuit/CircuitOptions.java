package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.basis.ExtBasis;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 回路の構成オプションです。
 *
 * <p>
 * Spring を使わずにライブラリとして利用する場合の既定値を保持します。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class CircuitOptions {

    /**
     * 拡張変数の基底です。
     */
    @Builder.Default
    ExtBasis extBasis = ExtBasis.DISCRETIZED;

    /**
     * 周期変数の打ち切り（電荷数）の既定値です。
     */
    @Builder.Default
    int defaultCutoffN = 5;

    /**
     * 拡張変数の打ち切り（格子点数または振動子の次元）の既定値です。
     */
    @Builder.Default
    int defaultCutoffExt = 30;

    /**
     * 打ち切り次元（固有状態の既定の個数）です。
     */
    @Builder.Default
    int truncatedDim = 10;

    /**
     * 離散化範囲 {min, max} の既定値です。
     */
    @Builder.Default
    double[] discretizedPhiRange = {-6 * Math.PI, 6 * Math.PI};

    /**
     * 純調和な系に基準モード分解を適用するかどうかです。
     */
    @Builder.Default
    boolean harmonicFastPath = true;

    /**
     * 純調和判定の許容誤差（絶対値）です。
     */
    @Builder.Default
    double harmonicTolerance = 1e-9;

    /**
     * 打ち切りの個別指定（cutoff_n_1 など → 値）です。
     */
    @Builder.Default
    Map<String, Integer> cutoffs = Map.of();

    /**
     * 既定値のオプションを返します。
     *
     * @return オプションです
     */
    public static CircuitOptions defaults() {
        return CircuitOptions.builder().build();
    }
}
