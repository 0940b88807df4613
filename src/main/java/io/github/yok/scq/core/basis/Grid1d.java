package io.github.yok.scq.core.basis;

import com.google.common.base.Preconditions;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import lombok.Value;

/**
 * 1 次元の等間隔格子を表すクラスです。
 *
 * <p>
 * 端点を含む pointCount 点の格子で、 3 点中心差分による 1 階・2 階微分行列を生成します（境界の外側は 0 とみなします）。
 * </p>
 */
@Value
public class Grid1d {

    /**
     * 下端です。
     */
    double min;

    /**
     * 上端です。
     */
    double max;

    /**
     * 格子点数です（2 以上）。
     */
    int pointCount;

    /**
     * 格子を生成します。
     *
     * @param min 下端です
     * @param max 上端です（min より大きい必要があります）
     * @param pointCount 格子点数です（2 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public Grid1d(double min, double max, int pointCount) {
        Preconditions.checkArgument(Double.isFinite(min) && Double.isFinite(max) && min < max,
                "格子の範囲が不正です: [%s, %s]", min, max);
        Preconditions.checkArgument(pointCount >= 2, "pointCount は 2 以上が必要です: %s", pointCount);
        this.min = min;
        this.max = max;
        this.pointCount = pointCount;
    }

    /**
     * 格子間隔を返します。
     *
     * @return 格子間隔です
     */
    public double spacing() {
        return (max - min) / (pointCount - 1);
    }

    /**
     * 格子点の座標を返します。
     *
     * @return 格子点の座標です
     */
    public double[] linspace() {
        double[] x = new double[pointCount];
        double h = spacing();
        for (int i = 0; i < pointCount; i++) {
            x[i] = min + i * h;
        }
        x[pointCount - 1] = max;
        return x;
    }

    /**
     * 1 階微分行列に係数を掛けた行列を返します。
     *
     * @param prefactorRe 係数の実部です
     * @param prefactorIm 係数の虚部です
     * @return 疎行列です
     */
    public ComplexMatrix firstDerivative(double prefactorRe, double prefactorIm) {
        double c = 1.0 / (2.0 * spacing());
        ComplexMatrix.Builder b = ComplexMatrix.builder(pointCount, pointCount);
        for (int i = 0; i < pointCount; i++) {
            if (i + 1 < pointCount) {
                b.add(i, i + 1, prefactorRe * c, prefactorIm * c);
            }
            if (i - 1 >= 0) {
                b.add(i, i - 1, -prefactorRe * c, -prefactorIm * c);
            }
        }
        return b.build(MatrixType.SPARSE);
    }

    /**
     * 2 階微分行列に係数を掛けた行列を返します。
     *
     * @param prefactor 係数です
     * @return 疎行列です
     */
    public ComplexMatrix secondDerivative(double prefactor) {
        double h = spacing();
        double c = prefactor / (h * h);
        ComplexMatrix.Builder b = ComplexMatrix.builder(pointCount, pointCount);
        for (int i = 0; i < pointCount; i++) {
            b.add(i, i, -2.0 * c, 0.0);
            if (i + 1 < pointCount) {
                b.add(i, i + 1, c, 0.0);
            }
            if (i - 1 >= 0) {
                b.add(i, i - 1, c, 0.0);
            }
        }
        return b.build(MatrixType.SPARSE);
    }
}
