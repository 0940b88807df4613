package io.github.yok.scq.core.linearalgebra;

/**
 * 演算子行列の保持形式です。
 *
 * <p>
 * 1 自由度かつ調和振動子基底の系は密行列、それ以外は疎行列で扱います。
 * </p>
 */
public enum MatrixType {
    DENSE, SPARSE
}
