package io.github.yok.scq.core.basis;

import com.google.common.base.Preconditions;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 拡張変数の調和振動子基底です。
 *
 * <p>
 * θ = l/√2 (a + a†)、 Q = i/(l√2) (a† - a) で、 l は振動子長です。 e^{i a θ} は θ のスペクトル分解から作ります。
 * </p>
 */
@Getter
public final class HarmonicOscillatorBasis implements VariableBasis {

    /**
     * 基底の次元です。
     */
    private final int dimension;

    /**
     * 振動子長 l = (8 E_C / E_L)^{1/4} です。
     */
    private final double oscillatorLength;

    /**
     * 変位演算子の計算に使う固有分解バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 調和振動子基底を生成します。
     *
     * @param dimension 次元です（1 以上）
     * @param oscillatorLength 振動子長です（正）
     * @param eigenBackend 固有分解バックエンドです
     */
    public HarmonicOscillatorBasis(int dimension, double oscillatorLength,
            EigenDecompositionBackend eigenBackend) {
        Preconditions.checkArgument(dimension > 0, "dimension は 1 以上が必要です: %s", dimension);
        Preconditions.checkArgument(oscillatorLength > 0.0 && Double.isFinite(oscillatorLength),
                "oscillatorLength は正の有限値が必要です: %s", oscillatorLength);
        Preconditions.checkArgument(eigenBackend != null, "eigenBackend は null 不可です");
        this.dimension = dimension;
        this.oscillatorLength = oscillatorLength;
        this.eigenBackend = eigenBackend;
    }

    /**
     * 振動子長を E_C, E_L から計算します。
     *
     * @param ec 充電エネルギーです
     * @param el 誘導エネルギーです
     * @return 振動子長です
     */
    public static double oscillatorLength(double ec, double el) {
        return Math.pow(8.0 * ec / el, 0.25);
    }

    /**
     * 消滅演算子 a を返します（対角の 1 つ上に √n）。
     *
     * @param dimension 次元です
     * @param type 保持形式です
     * @return 消滅演算子です
     */
    public static ComplexMatrix annihilation(int dimension, MatrixType type) {
        ComplexMatrix.Builder b = ComplexMatrix.builder(dimension, dimension);
        for (int n = 1; n < dimension; n++) {
            b.add(n - 1, n, Math.sqrt(n), 0.0);
        }
        return b.build(type);
    }

    /**
     * 生成演算子 a† を返します。
     *
     * @param dimension 次元です
     * @param type 保持形式です
     * @return 生成演算子です
     */
    public static ComplexMatrix creation(int dimension, MatrixType type) {
        return annihilation(dimension, type).dagger();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public MatrixType matrixType() {
        return MatrixType.DENSE;
    }

    private ComplexMatrix thetaOperator() {
        ComplexMatrix a = annihilation(dimension, MatrixType.DENSE);
        return a.plus(a.dagger()).scale(oscillatorLength / Math.sqrt(2.0));
    }

    @Override
    public ComplexMatrix theta(int power) {
        return thetaOperator().power(power);
    }

    @Override
    public ComplexMatrix displacement(double a) {
        // θ = V diag(x) V^T より e^{i a θ} = V diag(e^{i a x}) V^T です。
        EigenDecompositionResult eig =
                eigenBackend.decomposeSymmetricAndSort(thetaOperator().realPart());
        DMatrixRMaj v = eig.getEigenvectors();
        double[] x = eig.getEigenvalues();
        double[] re = new double[x.length];
        double[] im = new double[x.length];
        for (int k = 0; k < x.length; k++) {
            re[k] = Math.cos(a * x[k]);
            im[k] = Math.sin(a * x[k]);
        }
        ComplexMatrix vm = ComplexMatrix.dense(v, null);
        return vm.times(ComplexMatrix.diagonal(re, im, MatrixType.DENSE)).times(vm.dagger());
    }

    @Override
    public ComplexMatrix momentum(int power) {
        ComplexMatrix a = annihilation(dimension, MatrixType.DENSE);
        ComplexMatrix q = a.dagger().minus(a).scale(0.0, 1.0 / (oscillatorLength * Math.sqrt(2.0)));
        return q.power(power);
    }
}
