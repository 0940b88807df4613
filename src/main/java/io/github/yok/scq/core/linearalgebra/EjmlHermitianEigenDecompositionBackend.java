package io.github.yok.scq.core.linearalgebra;

import io.github.yok.scq.core.exception.NumericalFailureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、実対称行列およびエルミート行列の固有分解を行うクラスです。
 *
 * <p>
 * まず対称 QR 法で分解し、失敗した場合は一般行列向けの Hessenberg QR 法で 1 回だけ再試行します。 虚部を持つエルミート行列 A + iB は、 実対称行列 [[A, -B], [B,
 * A]] に埋め込んで分解し、重複した固有対から複素固有ベクトルを取り出します。
 * </p>
 */
@Slf4j
public final class EjmlHermitianEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実行列として扱う虚部の上限です。
     */
    private static final double REAL_TOLERANCE = 1e-15;

    /**
     * 縮退クラスタを判定する相対許容誤差です。
     */
    private static final double CLUSTER_TOLERANCE = 1e-9;

    /**
     * 複素ベクトルとして採用する残差ノルム二乗の下限です。
     */
    private static final double MIN_RESIDUAL = 1e-6;

    private static final String SYMMETRIC_SOLVER = "ejml-symmetric-qr";

    private static final String GENERAL_SOLVER = "ejml-general-hessenberg-qr";

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException symmetricMatrix が null または非正方の場合に発生します
     * @throws NumericalFailureException 代替手段を含めて固有分解に失敗した場合に発生します
     */
    @Override
    public EigenDecompositionResult decomposeSymmetricAndSort(DMatrixRMaj symmetricMatrix) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new IllegalArgumentException("symmetricMatrix は正方行列が必要です: "
                    + symmetricMatrix.numRows + "x" + symmetricMatrix.numCols);
        }
        return decomposeSymmetric(symmetricMatrix, symmetricMatrix.numRows);
    }

    /**
     * 実対称行列を固有分解します。 失敗時の例外には呼び出し元が要求した固有対の個数を記録します。
     */
    private static EigenDecompositionResult decomposeSymmetric(DMatrixRMaj symmetricMatrix,
            int requestedCount) {
        int dim = symmetricMatrix.numRows;
        List<String> attempted = new ArrayList<>();

        // 対称 QR 法で分解します。
        attempted.add(SYMMETRIC_SOLVER);
        EigenDecompositionResult result = decomposeWith(symmetricMatrix, true);
        if (result != null) {
            return result;
        }

        // 失敗した場合は一般行列向けの解法で 1 回だけ再試行します。
        log.warn("固有分解に失敗したため代替ソルバで再試行します: size={}, solver={}", dim, GENERAL_SOLVER);
        attempted.add(GENERAL_SOLVER);
        result = decomposeWith(symmetricMatrix, false);
        if (result == null) {
            throw new NumericalFailureException(dim, requestedCount, attempted);
        }

        // 一般行列向け解法では縮退空間の固有ベクトルが直交しないことがあるため直交化します。
        orthonormalizeColumns(result.getEigenvectors());
        return result;
    }

    /**
     * エルミート行列を固有分解し、固有値の小さい順に count 個の固有対を返します。
     *
     * @param hermitianMatrix エルミート行列です
     * @param count 要求する固有対の個数です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws NumericalFailureException 固有分解に失敗した場合に発生します
     */
    @Override
    public HermitianEigenResult decomposeHermitianAndSort(ComplexMatrix hermitianMatrix, int count) {
        if (hermitianMatrix == null) {
            throw new IllegalArgumentException("hermitianMatrix は null 不可です");
        }
        int dim = hermitianMatrix.numRows();
        if (dim != hermitianMatrix.numCols()) {
            throw new IllegalArgumentException(
                    "hermitianMatrix は正方行列が必要です: " + hermitianMatrix.shape());
        }
        if (count <= 0 || count > dim) {
            throw new IllegalArgumentException("count は 1 以上 " + dim + " 以下が必要です: " + count);
        }

        // 虚部がなければ実対称行列として分解します。
        if (hermitianMatrix.maxAbsImag() <= REAL_TOLERANCE) {
            EigenDecompositionResult real = decomposeSymmetric(hermitianMatrix.realPart(), count);
            DMatrixRMaj vectors = new DMatrixRMaj(dim, count);
            for (int col = 0; col < count; col++) {
                for (int row = 0; row < dim; row++) {
                    vectors.set(row, col, real.getEigenvectors().get(row, col));
                }
            }
            return new HermitianEigenResult(Arrays.copyOf(real.getEigenvalues(), count),
                    ComplexMatrix.dense(vectors, null));
        }

        // A + iB を [[A, -B], [B, A]] に埋め込みます。
        DMatrixRMaj a = hermitianMatrix.realPart();
        DMatrixRMaj b = hermitianMatrix.imagPart();
        DMatrixRMaj embedded = new DMatrixRMaj(2 * dim, 2 * dim);
        for (int row = 0; row < dim; row++) {
            for (int col = 0; col < dim; col++) {
                embedded.set(row, col, a.get(row, col));
                embedded.set(row + dim, col + dim, a.get(row, col));
                embedded.set(row, col + dim, -b.get(row, col));
                embedded.set(row + dim, col, b.get(row, col));
            }
        }
        EigenDecompositionResult doubled = decomposeSymmetric(embedded, count);
        return selectComplexEigenpairs(doubled, dim, count);
    }

    /**
     * 埋め込み行列の固有対（各固有値が 2 重）から、複素固有ベクトルを count 本取り出します。
     */
    private static HermitianEigenResult selectComplexEigenpairs(EigenDecompositionResult doubled,
            int dim, int count) {
        double[] values = doubled.getEigenvalues();
        DMatrixRMaj vectors = doubled.getEigenvectors();
        double scale = 1.0;
        for (double v : values) {
            scale = Math.max(scale, Math.abs(v));
        }
        double tol = CLUSTER_TOLERANCE * scale;

        List<double[]> acceptedRe = new ArrayList<>();
        List<double[]> acceptedIm = new ArrayList<>();
        double[] acceptedValues = new double[count];

        int start = 0;
        while (start < values.length && acceptedRe.size() < count) {
            // 同じ固有値を持つ列の範囲 [start, end) を求めます。
            int end = start + 1;
            while (end < values.length && values[end] - values[start] <= tol) {
                end++;
            }
            int want = Math.max(1, (end - start) / 2);

            // 残差が最大の候補を順に採用します（複素 Gram-Schmidt）。
            for (int k = 0; k < want && acceptedRe.size() < count; k++) {
                double best = MIN_RESIDUAL;
                double[] bestRe = null;
                double[] bestIm = null;
                int bestCol = -1;
                for (int col = start; col < end; col++) {
                    double[] re = new double[dim];
                    double[] im = new double[dim];
                    for (int row = 0; row < dim; row++) {
                        re[row] = vectors.get(row, col);
                        im[row] = vectors.get(row + dim, col);
                    }
                    double residual = projectOut(re, im, acceptedRe, acceptedIm);
                    if (residual > best) {
                        best = residual;
                        bestRe = re;
                        bestIm = im;
                        bestCol = col;
                    }
                }
                if (bestRe == null) {
                    break;
                }
                double norm = Math.sqrt(best);
                for (int row = 0; row < dim; row++) {
                    bestRe[row] /= norm;
                    bestIm[row] /= norm;
                }
                acceptedValues[acceptedRe.size()] = values[bestCol];
                acceptedRe.add(bestRe);
                acceptedIm.add(bestIm);
            }
            start = end;
        }

        if (acceptedRe.size() < count) {
            throw new NumericalFailureException(dim, count, List.of(SYMMETRIC_SOLVER + "(embedded)"));
        }

        ComplexMatrix.Builder builder = ComplexMatrix.builder(dim, count);
        for (int col = 0; col < count; col++) {
            double[] re = acceptedRe.get(col);
            double[] im = acceptedIm.get(col);
            for (int row = 0; row < dim; row++) {
                builder.add(row, col, re[row], im[row]);
            }
        }
        return new HermitianEigenResult(acceptedValues, builder.build(MatrixType.DENSE));
    }

    /**
     * 採用済みベクトルの成分を除き、残差ノルムの二乗を返します。
     */
    private static double projectOut(double[] re, double[] im, List<double[]> basisRe,
            List<double[]> basisIm) {
        for (int k = 0; k < basisRe.size(); k++) {
            double[] ur = basisRe.get(k);
            double[] ui = basisIm.get(k);
            // <u, z> = Σ conj(u) z
            double pr = 0.0;
            double pi = 0.0;
            for (int row = 0; row < re.length; row++) {
                pr += ur[row] * re[row] + ui[row] * im[row];
                pi += ur[row] * im[row] - ui[row] * re[row];
            }
            for (int row = 0; row < re.length; row++) {
                re[row] -= ur[row] * pr - ui[row] * pi;
                im[row] -= ur[row] * pi + ui[row] * pr;
            }
        }
        double norm2 = 0.0;
        for (int row = 0; row < re.length; row++) {
            norm2 += re[row] * re[row] + im[row] * im[row];
        }
        return norm2;
    }

    /**
     * 指定した解法で分解し、失敗した場合は null を返します。
     */
    private static EigenDecompositionResult decomposeWith(DMatrixRMaj matrix, boolean symmetric) {
        int dim = matrix.numRows;
        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, symmetric);
        // EJML は収束しない場合に false を返すほか、非有限値を含む入力では実行時例外を送出します。
        try {
            if (!decomposition.decompose(matrix.copy())) {
                return null;
            }
        } catch (RuntimeException e) {
            log.debug("固有分解で例外が発生しました: size={}, symmetric={}", dim, symmetric, e);
            return null;
        }

        double[] eigenvalues = new double[dim];
        DMatrixRMaj eigenvectors = new DMatrixRMaj(dim, dim);
        for (int col = 0; col < dim; col++) {
            double value = decomposition.getEigenvalue(col).getReal();
            DMatrixRMaj vec = decomposition.getEigenVector(col);
            if (vec == null || !Double.isFinite(value)) {
                return null;
            }
            eigenvalues[col] = value;
            for (int row = 0; row < dim; row++) {
                double x = vec.get(row, 0);
                if (!Double.isFinite(x)) {
                    return null;
                }
                eigenvectors.set(row, col, x);
            }
        }

        int[] order = argsortAscending(eigenvalues);
        double[] sortedValues = new double[dim];
        DMatrixRMaj sortedVectors = new DMatrixRMaj(dim, dim);
        for (int newCol = 0; newCol < dim; newCol++) {
            int oldCol = order[newCol];
            sortedValues[newCol] = eigenvalues[oldCol];
            for (int row = 0; row < dim; row++) {
                sortedVectors.set(row, newCol, eigenvectors.get(row, oldCol));
            }
        }
        return new EigenDecompositionResult(sortedValues, sortedVectors);
    }

    /**
     * 列ベクトルを左から順に修正 Gram-Schmidt 法で正規直交化します。
     */
    private static void orthonormalizeColumns(DMatrixRMaj m) {
        for (int col = 0; col < m.numCols; col++) {
            for (int prev = 0; prev < col; prev++) {
                double dot = 0.0;
                for (int row = 0; row < m.numRows; row++) {
                    dot += m.get(row, prev) * m.get(row, col);
                }
                for (int row = 0; row < m.numRows; row++) {
                    m.add(row, col, -dot * m.get(row, prev));
                }
            }
            double norm = 0.0;
            for (int row = 0; row < m.numRows; row++) {
                norm += m.get(row, col) * m.get(row, col);
            }
            norm = Math.sqrt(norm);
            if (norm > 0.0) {
                for (int row = 0; row < m.numRows; row++) {
                    m.set(row, col, m.get(row, col) / norm);
                }
            }
        }
    }

    /**
     * 配列を昇順ソートしたときのインデックス順（argsort）を返します。
     *
     * @param values 対象配列です
     * @return 昇順のインデックス配列です
     */
    public static int[] argsortAscending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }
        Arrays.sort(indices, (i, j) -> Double.compare(values[i], values[j]));
        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }
}
