package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.basis.VariableBasis;
import java.util.Map;
import lombok.Value;

/**
 * 末端の系の局所演算子（変数ごとの基底、または基準モード）です。
 */
@Value
class LocalOperators {

    static final LocalOperators EMPTY = new LocalOperators(Map.of(), null);

    /**
     * 変数番号 → 局所基底です（基準モード分解時は空）。
     */
    Map<Integer, VariableBasis> bases;

    /**
     * 基準モードです（適用しない場合は null）。
     */
    HarmonicNormalModes normalModes;
}
