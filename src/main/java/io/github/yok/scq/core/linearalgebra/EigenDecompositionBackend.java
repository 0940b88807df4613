package io.github.yok.scq.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや解法を差し替えやすくするためのインタフェースです。 どの実装も固有値を昇順に並べ、固有ベクトルも同じ順序に揃えて返します。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 固有値昇順の固有分解結果です
     * @throws io.github.yok.scq.core.exception.NumericalFailureException 代替手段を含めて固有分解に失敗した場合に発生します
     */
    EigenDecompositionResult decomposeSymmetricAndSort(DMatrixRMaj symmetricMatrix);

    /**
     * エルミート行列を固有分解し、固有値の小さい順に count 個の固有対を返します。
     *
     * @param hermitianMatrix エルミート行列です
     * @param count 要求する固有対の個数です（1 以上、次元以下）
     * @return 固有値昇順の固有分解結果です
     * @throws io.github.yok.scq.core.exception.NumericalFailureException 代替手段を含めて固有分解に失敗した場合に発生します
     */
    HermitianEigenResult decomposeHermitianAndSort(ComplexMatrix hermitianMatrix, int count);

    /**
     * 実対称行列の固有分解結果（固有値・固有ベクトル）を保持するクラスです。
     *
     * <p>
     * 固有ベクトル行列は「列が固有ベクトル」である前提です。
     * </p>
     */
    @Value
    class EigenDecompositionResult {

        /**
         * 固有値配列です。
         */
        double[] eigenvalues;

        /**
         * 固有ベクトル行列です（列が固有ベクトルです）。
         */
        DMatrixRMaj eigenvectors;
    }

    /**
     * エルミート行列の固有分解結果を保持するクラスです。
     */
    @Value
    class HermitianEigenResult {

        /**
         * 固有値配列です（昇順）。
         */
        double[] eigenvalues;

        /**
         * 固有ベクトル行列です（次元×個数の密行列、列が固有ベクトルです）。
         */
        ComplexMatrix eigenvectors;
    }
}
