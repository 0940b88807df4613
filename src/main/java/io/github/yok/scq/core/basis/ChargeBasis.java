package io.github.yok.scq.core.basis;

import com.google.common.base.Preconditions;
import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import lombok.Getter;

/**
 * 周期変数の電荷基底 |n⟩ (n = -cutoff..cutoff) です。
 *
 * <p>
 * e^{iθ} は対角の 1 つ上の成分だけを持つ行列で、 e^{ikθ} はその k 乗（整数 k のみ）です。
 * </p>
 */
@Getter
public final class ChargeBasis implements VariableBasis {

    /**
     * 電荷数の打ち切りです。
     */
    private final int cutoff;

    /**
     * 電荷基底を生成します。
     *
     * @param cutoff 電荷数の打ち切りです（1 以上）
     */
    public ChargeBasis(int cutoff) {
        Preconditions.checkArgument(cutoff > 0, "cutoff は 1 以上が必要です: %s", cutoff);
        this.cutoff = cutoff;
    }

    @Override
    public int dimension() {
        return 2 * cutoff + 1;
    }

    @Override
    public MatrixType matrixType() {
        return MatrixType.SPARSE;
    }

    @Override
    public ComplexMatrix theta(int power) {
        if (power == 0) {
            return identity();
        }
        throw new ConfigurationException("周期変数の θ は三角関数の引数としてのみ使用できます");
    }

    /**
     * e^{iθ} を返します。
     *
     * @return 演算子です
     */
    public ComplexMatrix expITheta() {
        int dim = dimension();
        ComplexMatrix.Builder b = ComplexMatrix.builder(dim, dim);
        for (int i = 0; i + 1 < dim; i++) {
            b.add(i, i + 1, 1.0, 0.0);
        }
        return b.build(MatrixType.SPARSE);
    }

    /**
     * cos θ = (e^{iθ} + e^{-iθ}) / 2 を返します。
     *
     * @return 演算子です
     */
    public ComplexMatrix cosTheta() {
        ComplexMatrix e = expITheta();
        return e.plus(e.dagger()).scale(0.5);
    }

    /**
     * sin θ = -i/2 (e^{iθ} - e^{-iθ}) を返します。
     *
     * @return 演算子です
     */
    public ComplexMatrix sinTheta() {
        ComplexMatrix e = expITheta();
        return e.minus(e.dagger()).scale(0.0, -0.5);
    }

    @Override
    public ComplexMatrix displacement(double a) {
        long k = Math.round(a);
        if (Math.abs(a - k) > 1e-12) {
            throw new ConfigurationException("周期変数の三角関数の係数は整数が必要です: " + a);
        }
        if (k == 0) {
            return identity();
        }
        ComplexMatrix e = expITheta();
        return ((k > 0) ? e : e.dagger()).power((int) Math.abs(k));
    }

    @Override
    public ComplexMatrix momentum(int power) {
        double[] diag = new double[dimension()];
        for (int i = 0; i < diag.length; i++) {
            diag[i] = Math.pow(i - cutoff, power);
        }
        return ComplexMatrix.diagonal(diag, null, MatrixType.SPARSE);
    }
}
