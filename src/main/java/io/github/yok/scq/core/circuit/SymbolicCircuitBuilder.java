package io.github.yok.scq.core.circuit;

import java.util.List;
import java.util.Optional;

/**
 * 回路グラフから記号ハミルトニアンを導出する外部コンポーネントのインタフェースです。
 */
public interface SymbolicCircuitBuilder {

    /**
     * 変数変換行列と閉路枝を指定して記号ハミルトニアンを導出します。
     *
     * @param transformationMatrix 変数変換行列です（null の場合は既定）
     * @param closureBranches 閉路枝です（空の場合は既定）
     * @return 記号回路です
     * @throws io.github.yok.scq.core.exception.ConfigurationException 指定を受け付けられない場合に発生します
     */
    SymbolicCircuit derive(double[][] transformationMatrix, List<Branch> closureBranches);

    /**
     * 回路の枝を返します。
     *
     * @return 枝の一覧です
     */
    List<Branch> branches();

    /**
     * 外部磁束を時間依存（動的）に扱うかどうかを返します。
     *
     * @return 動的なら true です
     */
    boolean isFluxDynamic();

    /**
     * 識別子に一致する枝を探します（直列化からの復元用）。
     *
     * @param node1 ノード 1 です
     * @param node2 ノード 2 です
     * @param type 素子種別です
     * @param params パラメータ名です
     * @return 一致した枝です
     */
    Optional<Branch> findBranch(int node1, int node2, String type, List<String> params);

    /**
     * 入力文字列（直列化時に保存する元の記述）を返します。
     *
     * @return 入力文字列です
     */
    String inputString();
}
