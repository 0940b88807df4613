package io.github.yok.scq.core.basis;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChargeBasisTest {

    private final ChargeBasis basis = new ChargeBasis(2);

    @Test
    @DisplayName("次元は 2*cutoff+1 です")
    void dimension() {
        assertThat(basis.dimension()).isEqualTo(5);
        assertThat(basis.matrixType()).isEqualTo(MatrixType.SPARSE);
    }

    @Test
    @DisplayName("電荷演算子は -cutoff から cutoff の対角行列です")
    void chargeDiagonal() {
        ComplexMatrix n = basis.momentum(1);
        assertThat(n.getReal(0, 0)).isEqualTo(-2.0);
        assertThat(n.getReal(2, 2)).isEqualTo(0.0);
        assertThat(n.getReal(4, 4)).isEqualTo(2.0);
        assertThat(basis.momentum(2).getReal(0, 0)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("e^{iθ} は電荷を 1 ずらし [e^{iθ}, n] = e^{iθ} を満たします")
    void shiftCommutator() {
        ComplexMatrix e = basis.expITheta();
        ComplexMatrix n = basis.momentum(1);
        ComplexMatrix commutator = e.times(n).minus(n.times(e));
        assertThat(commutator.maxAbsDifference(e)).isLessThan(1e-15);
        assertThat(basis.displacement(1.0).maxAbsDifference(e)).isZero();
        assertThat(basis.displacement(-2.0).maxAbsDifference(e.dagger().power(2))).isZero();
    }

    @Test
    @DisplayName("cos θ と sin θ はエルミートです")
    void trigHermitian() {
        assertThat(basis.cosTheta().hermiticityDefect()).isZero();
        assertThat(basis.sinTheta().hermiticityDefect()).isLessThan(1e-15);
        assertThat(basis.cosTheta().getReal(0, 1)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("θ 単体や非整数の係数は使えません")
    void invalidOperators() {
        assertThatThrownBy(() -> basis.theta(1)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> basis.displacement(0.5))
                .isInstanceOf(ConfigurationException.class);
        assertThat(basis.theta(0).maxAbsDifference(basis.identity())).isZero();
    }

    @Test
    @DisplayName("cutoff は 1 以上が必要です")
    void invalidCutoff() {
        assertThatThrownBy(() -> new ChargeBasis(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
