package io.github.yok.scq.core.linearalgebra;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ComplexMatrixTest {

    private static ComplexMatrix pauliY(MatrixType type) {
        return ComplexMatrix.builder(2, 2).add(0, 1, 0.0, -1.0).add(1, 0, 0.0, 1.0).build(type);
    }

    private static ComplexMatrix pauliX(MatrixType type) {
        return ComplexMatrix.builder(2, 2).add(0, 1, 1.0, 0.0).add(1, 0, 1.0, 0.0).build(type);
    }

    @Nested
    @DisplayName("生成")
    class Creation {

        @Test
        @DisplayName("単位行列は対角成分が 1 です")
        void identityHasUnitDiagonal() {
            ComplexMatrix id = ComplexMatrix.identity(3, MatrixType.SPARSE);
            assertThat(id.type()).isEqualTo(MatrixType.SPARSE);
            assertThat(id.getReal(1, 1)).isEqualTo(1.0);
            assertThat(id.getReal(0, 1)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("ビルダーは同じ位置への追加を加算します")
        void builderAccumulatesDuplicates() {
            ComplexMatrix m = ComplexMatrix.builder(2, 2).add(0, 0, 1.0, 0.5).add(0, 0, 2.0, 0.5)
                    .build(MatrixType.DENSE);
            assertThat(m.getReal(0, 0)).isEqualTo(3.0);
            assertThat(m.getImag(0, 0)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("サイズ 0 の単位行列は作れません")
        void identityRejectsNonPositiveSize() {
            assertThatThrownBy(() -> ComplexMatrix.identity(0, MatrixType.DENSE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("演算")
    class Arithmetic {

        @Test
        @DisplayName("σx σy = i σz が疎・密の組み合わせで一致します")
        void productMatchesAcrossStorage() {
            ComplexMatrix expected = ComplexMatrix.diagonal(new double[] {0.0, 0.0},
                    new double[] {1.0, -1.0}, MatrixType.DENSE);
            for (MatrixType a : MatrixType.values()) {
                for (MatrixType b : MatrixType.values()) {
                    ComplexMatrix p = pauliX(a).times(pauliY(b));
                    assertThat(p.maxAbsDifference(expected)).isLessThan(1e-15);
                }
            }
        }

        @Test
        @DisplayName("疎行列どうしの演算は疎行列のままです")
        void sparseStaysSparse() {
            ComplexMatrix p = pauliX(MatrixType.SPARSE).times(pauliY(MatrixType.SPARSE));
            assertThat(p.type()).isEqualTo(MatrixType.SPARSE);
            assertThat(pauliX(MatrixType.SPARSE).plus(pauliY(MatrixType.SPARSE)).type())
                    .isEqualTo(MatrixType.SPARSE);
        }

        @Test
        @DisplayName("複素スカラー倍は (a+ib)(A+iB) を計算します")
        void complexScale() {
            ComplexMatrix m = pauliY(MatrixType.SPARSE).scale(0.0, 1.0);
            // i σy = [[0, 1], [-1, 0]]
            assertThat(m.getReal(0, 1)).isEqualTo(1.0);
            assertThat(m.getReal(1, 0)).isEqualTo(-1.0);
            assertThat(m.maxAbsImag()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("σy の二乗は単位行列です")
        void powerOfPauli() {
            ComplexMatrix sq = pauliY(MatrixType.DENSE).power(2);
            assertThat(sq.maxAbsDifference(ComplexMatrix.identity(2, MatrixType.DENSE)))
                    .isLessThan(1e-15);
            assertThat(pauliY(MatrixType.DENSE).power(0)
                    .maxAbsDifference(ComplexMatrix.identity(2, MatrixType.DENSE))).isZero();
        }

        @Test
        @DisplayName("負の指数は拒否します")
        void negativePowerRejected() {
            assertThatThrownBy(() -> pauliY(MatrixType.DENSE).power(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("形状が合わない積は拒否します")
        void shapeMismatch() {
            ComplexMatrix a = ComplexMatrix.zeros(2, 3, MatrixType.DENSE);
            assertThatThrownBy(() -> a.times(a)).isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("2x3");
        }
    }

    @Nested
    @DisplayName("クロネッカー積と共役")
    class KronAndDagger {

        @Test
        @DisplayName("クロネッカー積の次元と成分が正しいです")
        void kronProduct() {
            ComplexMatrix a = ComplexMatrix.diagonal(new double[] {1.0, 2.0}, null,
                    MatrixType.SPARSE);
            ComplexMatrix k = a.kron(pauliY(MatrixType.SPARSE));
            assertThat(k.shape()).isEqualTo("4x4");
            assertThat(k.getImag(2, 3)).isEqualTo(-2.0);
            assertThat(k.getImag(3, 2)).isEqualTo(2.0);
            assertThat(k.maxAbsDifference(a.toDense().kron(pauliY(MatrixType.DENSE))))
                    .isLessThan(1e-15);
        }

        @Test
        @DisplayName("σy はエルミートです")
        void pauliIsHermitian() {
            assertThat(pauliY(MatrixType.SPARSE).hermiticityDefect()).isZero();
            assertThat(pauliY(MatrixType.DENSE).hermiticityDefect()).isZero();
        }

        @Test
        @DisplayName("エルミート部分は非エルミート成分を取り除きます")
        void hermitianPartRemovesDefect() {
            ComplexMatrix m = ComplexMatrix.builder(2, 2).add(0, 1, 1.0, 0.0).build(MatrixType.DENSE);
            assertThat(m.hermiticityDefect()).isEqualTo(1.0);
            ComplexMatrix h = m.hermitianPart();
            assertThat(h.hermiticityDefect()).isZero();
            assertThat(h.getReal(0, 1)).isEqualTo(0.5);
            assertThat(h.getReal(1, 0)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("疎・密の変換で値が保たれます")
        void storageConversion() {
            ComplexMatrix d = pauliY(MatrixType.DENSE);
            assertThat(d.toSparse().type()).isEqualTo(MatrixType.SPARSE);
            assertThat(d.toSparse().maxAbsDifference(d)).isZero();
            assertThat(d.as(MatrixType.DENSE)).isSameAs(d);
        }

        @Test
        @DisplayName("左上の部分行列を取り出せます")
        void leadingBlock() {
            ComplexMatrix m = ComplexMatrix.diagonal(new double[] {1.0, 2.0, 3.0}, null,
                    MatrixType.SPARSE);
            ComplexMatrix b = m.leadingBlock(3, 2);
            assertThat(b.shape()).isEqualTo("3x2");
            assertThat(b.getReal(1, 1)).isEqualTo(2.0);
            assertThatThrownBy(() -> m.leadingBlock(4, 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
