package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.VariableCategories;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * 記号回路ビルダーの出力（量子化済みの記号ハミルトニアンと付随情報）です。
 */
@Value
public class SymbolicCircuit {

    /**
     * 記号ハミルトニアンです。
     */
    Expression hamiltonian;

    /**
     * 変数分類です。
     */
    VariableCategories categories;

    /**
     * 外部磁束の名前です。
     */
    List<String> externalFluxes;

    /**
     * オフセット電荷の名前です。
     */
    List<String> offsetCharges;

    /**
     * パラメータの既定値です。
     */
    Map<String, Double> parameterDefaults;

    /**
     * 変数変換行列です。
     */
    double[][] transformationMatrix;

    /**
     * 閉路枝です。
     */
    List<Branch> closureBranches;
}
