package io.github.yok.scq.core.basis;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;

/**
 * 1 つの変数の局所基底で要素演算子を生成するインタフェースです。
 *
 * <p>
 * 実装は変数番号と基底サイズだけで決まる純粋な関数として振る舞います。
 * </p>
 */
public interface VariableBasis {

    /**
     * 基底の次元を返します。
     *
     * @return 次元です
     */
    int dimension();

    /**
     * 生成する行列の保持形式を返します。
     *
     * @return 保持形式です
     */
    MatrixType matrixType();

    /**
     * 単位演算子を返します。
     *
     * @return 単位演算子です
     */
    default ComplexMatrix identity() {
        return ComplexMatrix.identity(dimension(), matrixType());
    }

    /**
     * θ^power を返します。
     *
     * @param power 指数です（0 以上）
     * @return 演算子です
     */
    ComplexMatrix theta(int power);

    /**
     * 変位演算子 e^{i a θ} を返します。
     *
     * @param a θ の係数です
     * @return 演算子です
     */
    ComplexMatrix displacement(double a);

    /**
     * 共役運動量（n または Q）の power 乗を返します。
     *
     * @param power 指数です（0 以上）
     * @return 演算子です
     */
    ComplexMatrix momentum(int power);

    /**
     * θ^p · e^{i a θ} · (運動量)^q の順に掛けた局所演算子を返します。
     *
     * @param thetaPower θ の指数です
     * @param displacement 変位の係数 a です（0 なら変位なし）
     * @param momentumPower 運動量の指数です
     * @return 局所演算子です
     */
    default ComplexMatrix localOperator(int thetaPower, double displacement, int momentumPower) {
        ComplexMatrix op = null;
        if (thetaPower > 0) {
            op = theta(thetaPower);
        }
        if (displacement != 0.0) {
            ComplexMatrix d = displacement(displacement);
            op = (op == null) ? d : op.times(d);
        }
        if (momentumPower > 0) {
            ComplexMatrix m = momentum(momentumPower);
            op = (op == null) ? m : op.times(m);
        }
        return (op == null) ? identity() : op;
    }
}
