package io.github.yok.scq.core.basis;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.EjmlHermitianEigenDecompositionBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DiscretizedFluxBasisTest {

    @Test
    @DisplayName("格子点は両端を含みます")
    void gridEndpoints() {
        Grid1d grid = new Grid1d(-1.0, 1.0, 5);
        assertThat(grid.spacing()).isEqualTo(0.5);
        assertThat(grid.linspace()).containsExactly(-1.0, -0.5, 0.0, 0.5, 1.0);
    }

    @Test
    @DisplayName("不正な格子は拒否します")
    void invalidGrid() {
        assertThatThrownBy(() -> new Grid1d(1.0, -1.0, 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Grid1d(-1.0, 1.0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("θ は格子点の対角行列、e^{iaθ} は位相の対角行列です")
    void diagonalOperators() {
        DiscretizedFluxBasis basis = new DiscretizedFluxBasis(new Grid1d(-1.0, 1.0, 5));
        assertThat(basis.theta(1).getReal(4, 4)).isEqualTo(1.0);
        assertThat(basis.theta(2).getReal(0, 0)).isEqualTo(1.0);
        ComplexMatrix d = basis.displacement(2.0);
        assertThat(d.getReal(3, 3)).isCloseTo(Math.cos(1.0), within(1e-15));
        assertThat(d.getImag(3, 3)).isCloseTo(Math.sin(1.0), within(1e-15));
    }

    @Test
    @DisplayName("電荷演算子とその二乗はエルミートです")
    void momentumHermitian() {
        DiscretizedFluxBasis basis = new DiscretizedFluxBasis(new Grid1d(-2.0, 2.0, 21));
        assertThat(basis.momentum(1).hermiticityDefect()).isLessThan(1e-12);
        assertThat(basis.momentum(2).hermiticityDefect()).isLessThan(1e-12);
        assertThat(basis.momentum(2).maxAbsImag()).isZero();
        assertThat(basis.momentum(0).maxAbsDifference(basis.identity())).isZero();
    }

    @Test
    @DisplayName("調和ポテンシャルの低エネルギー準位を再現します")
    void harmonicSpectrum() {
        DiscretizedFluxBasis basis = new DiscretizedFluxBasis(new Grid1d(-6.0, 6.0, 301));
        double ec = 1.0;
        double el = 10.0;
        ComplexMatrix h = basis.momentum(2).scale(4 * ec).plus(basis.theta(2).scale(0.5 * el));
        double[] e = new EjmlHermitianEigenDecompositionBackend().decomposeHermitianAndSort(h, 3)
                .getEigenvalues();
        double omega = Math.sqrt(8 * ec * el);
        for (int n = 0; n < 3; n++) {
            assertThat(e[n]).isCloseTo(omega * (n + 0.5), withinPercentage(1.0));
        }
    }
}
