package io.github.yok.scq.core.basis;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import lombok.Getter;

/**
 * 拡張変数を格子上で離散化した磁束基底です。
 *
 * <p>
 * θ と三角関数は格子座標の対角行列、 Q = -i d/dθ、 Q^2 = -d^2/dθ^2 です。
 * </p>
 */
@Getter
public final class DiscretizedFluxBasis implements VariableBasis {

    /**
     * 離散化格子です。
     */
    private final Grid1d grid;

    public DiscretizedFluxBasis(Grid1d grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        this.grid = grid;
    }

    @Override
    public int dimension() {
        return grid.getPointCount();
    }

    @Override
    public MatrixType matrixType() {
        return MatrixType.SPARSE;
    }

    @Override
    public ComplexMatrix theta(int power) {
        double[] x = grid.linspace();
        for (int i = 0; i < x.length; i++) {
            x[i] = Math.pow(x[i], power);
        }
        return ComplexMatrix.diagonal(x, null, MatrixType.SPARSE);
    }

    @Override
    public ComplexMatrix displacement(double a) {
        double[] x = grid.linspace();
        double[] re = new double[x.length];
        double[] im = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            re[i] = Math.cos(a * x[i]);
            im[i] = Math.sin(a * x[i]);
        }
        return ComplexMatrix.diagonal(re, im, MatrixType.SPARSE);
    }

    @Override
    public ComplexMatrix momentum(int power) {
        if (power == 0) {
            return identity();
        }
        // 偶数次は -d^2/dθ^2 の冪、奇数次はさらに -i d/dθ を 1 つ掛けます。
        ComplexMatrix q2 = grid.secondDerivative(-1.0);
        ComplexMatrix result = q2.power(power / 2);
        if (power % 2 == 1) {
            result = result.times(grid.firstDerivative(0.0, -1.0));
        }
        return result;
    }
}
