package io.github.yok.scq.core.linearalgebra;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TensorCompositionTest {

    @Test
    @DisplayName("identityWrap は指定位置に演算子を置きます")
    void identityWrapPlacesOperator() {
        ComplexMatrix n = ComplexMatrix.diagonal(new double[] {0.0, 1.0, 2.0}, null,
                MatrixType.SPARSE);
        ComplexMatrix full =
                TensorComposition.identityWrap(n, 1, List.of(2, 3, 2), MatrixType.SPARSE);
        assertThat(full.shape()).isEqualTo("12x12");
        // 基底 |a, b, c> の添字は a*6 + b*2 + c です。
        assertThat(full.getReal(1 * 6 + 2 * 2 + 1, 1 * 6 + 2 * 2 + 1)).isEqualTo(2.0);
        assertThat(full.getReal(0 * 6 + 1 * 2 + 0, 0 * 6 + 1 * 2 + 0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("kron は因子を順に積みます")
    void kronList() {
        ComplexMatrix a = ComplexMatrix.identity(2, MatrixType.DENSE);
        ComplexMatrix b = ComplexMatrix.identity(3, MatrixType.DENSE);
        assertThat(TensorComposition.kron(List.of(a, b)).shape()).isEqualTo("6x6");
    }

    @Test
    @DisplayName("次元の合わない演算子は拒否します")
    void identityWrapRejectsMismatch() {
        ComplexMatrix id = ComplexMatrix.identity(2, MatrixType.DENSE);
        assertThatThrownBy(
                () -> TensorComposition.identityWrap(id, 0, List.of(3, 2), MatrixType.DENSE))
                        .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
                () -> TensorComposition.identityWrap(id, 2, List.of(2, 2), MatrixType.DENSE))
                        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toEigenbasis は V† O V を返します")
    void toEigenbasis() {
        ComplexMatrix o = ComplexMatrix.diagonal(new double[] {1.0, 2.0, 3.0}, null,
                MatrixType.SPARSE);
        ComplexMatrix v = ComplexMatrix.builder(3, 2).add(2, 0, 1.0, 0.0).add(0, 1, 1.0, 0.0)
                .build(MatrixType.DENSE);
        ComplexMatrix t = TensorComposition.toEigenbasis(o, v);
        assertThat(t.shape()).isEqualTo("2x2");
        assertThat(t.getReal(0, 0)).isEqualTo(3.0);
        assertThat(t.getReal(1, 1)).isEqualTo(1.0);
        assertThat(t.getReal(0, 1)).isEqualTo(0.0);
    }
}
