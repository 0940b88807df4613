package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import java.util.Map;

/**
 * ハミルトニアンと演算子を数値行列として提供する能力です。
 */
public interface OperatorProvider {

    /**
     * 数値ハミルトニアン（エルミート部分）を返します。
     *
     * @return ハミルトニアンです
     * @throws io.github.yok.scq.core.exception.StructuralSyncException 再構築待ちの場合に発生します
     */
    ComplexMatrix hamiltonian();

    /**
     * 記号式で指定した演算子をこの系の空間の行列として返します。
     *
     * @param expressionText 演算子の記号式（例: n1, cos(θ1), θ1*Q2）です
     * @return 演算子です
     */
    ComplexMatrix operator(String expressionText);

    /**
     * 変数ごとの基本演算子の生成器を返します。
     *
     * @return 名前 → 生成器です
     */
    Map<String, OperatorHandle> operatorHandles();

    int dimension();

    MatrixType matrixType();
}
