package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import java.util.SortedMap;

/**
 * 局所演算子の積を自分の空間の行列として組み立てる系です。
 */
interface OperatorSpace {

    /**
     * 空間の次元を返します。
     *
     * @return 次元です
     */
    int dimension();

    /**
     * 行列の保持形式を返します。
     *
     * @return 保持形式です
     */
    MatrixType matrixType();

    /**
     * 変数番号 → 局所演算子の積を、指定のない変数には単位演算子を合成して返します。
     *
     * @param factors 変数番号 → 局所演算子です
     * @return この系の空間の演算子です
     */
    ComplexMatrix product(SortedMap<Integer, LocalFactor> factors);
}
