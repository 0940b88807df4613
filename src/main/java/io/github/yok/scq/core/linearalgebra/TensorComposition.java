package io.github.yok.scq.core.linearalgebra;

import java.util.List;

/**
 * 部分空間の演算子をクロネッカー積で全空間へ合成するユーティリティです。
 *
 * <p>
 * 因子の並びは左から順に全空間の上位の添字に対応します。
 * </p>
 */
public final class TensorComposition {

    private TensorComposition() {}

    /**
     * 因子の並びのクロネッカー積を返します。
     *
     * @param factors 因子の並びです（1 つ以上）
     * @return クロネッカー積です
     */
    public static ComplexMatrix kron(List<ComplexMatrix> factors) {
        if (factors == null || factors.isEmpty()) {
            throw new IllegalArgumentException("factors は 1 つ以上が必要です");
        }
        ComplexMatrix out = factors.get(0);
        for (int k = 1; k < factors.size(); k++) {
            out = out.kron(factors.get(k));
        }
        return out;
    }

    /**
     * position 番目の部分空間に作用する演算子を、他の部分空間の単位行列と合成します。
     *
     * @param operator 部分空間の演算子です
     * @param position 部分空間の位置です（0 始まり）
     * @param dims 部分空間の次元の並びです
     * @param type 単位行列の保持形式です
     * @return 全空間の演算子です
     */
    public static ComplexMatrix identityWrap(ComplexMatrix operator, int position, List<Integer> dims,
            MatrixType type) {
        if (position < 0 || position >= dims.size()) {
            throw new IllegalArgumentException("position が範囲外です: " + position + " / " + dims.size());
        }
        if (operator.numRows() != dims.get(position)) {
            throw new IllegalArgumentException("演算子の次元が一致しません: " + operator.shape() + " vs "
                    + dims.get(position));
        }
        int before = 1;
        for (int k = 0; k < position; k++) {
            before *= dims.get(k);
        }
        int after = 1;
        for (int k = position + 1; k < dims.size(); k++) {
            after *= dims.get(k);
        }
        ComplexMatrix out = operator;
        if (before > 1) {
            out = ComplexMatrix.identity(before, type).kron(out);
        }
        if (after > 1) {
            out = out.kron(ComplexMatrix.identity(after, type));
        }
        return out.as(type);
    }

    /**
     * 演算子を固有基底で表し、先頭 V の列数へ切り詰めた V† O V を返します。
     *
     * @param operator 演算子です
     * @param eigenvectors 固有ベクトル行列です（列が固有ベクトル）
     * @return 切り詰めた演算子（密行列）です
     */
    public static ComplexMatrix toEigenbasis(ComplexMatrix operator, ComplexMatrix eigenvectors) {
        ComplexMatrix v = eigenvectors.toDense();
        return v.dagger().times(operator.toDense()).times(v);
    }
}
