package io.github.yok.scq.app;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.circuit.Circuit;
import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.linearalgebra.EjmlHermitianEigenDecompositionBackend;
import io.github.yok.scq.out.ResultWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CircuitSpectrumConfigurationTest {

    private static ScqProperties transmonPair() {
        ScqProperties p = new ScqProperties();
        ScqProperties.Circuit c = p.getCircuit();
        c.setHamiltonian("4*EC*n1^2 - EJ1*cos(θ1) + 4*EC*n2^2 - EJ2*cos(θ2) + g*n1*n2");
        c.setParameters(new LinkedHashMap<>(Map.of("EC", 0.5, "EJ1", 8.0, "EJ2", 9.0, "g", 0.3)));
        c.setCutoffs(new LinkedHashMap<>(Map.of("cutoff_n_1", 6)));
        return p;
    }

    @Test
    @DisplayName("設定値から平坦な回路を構成します")
    void flatCircuit() {
        Circuit c = new CircuitSpectrumConfiguration(transmonPair())
                .circuit(new EjmlHermitianEigenDecompositionBackend());
        assertThat(c.isHierarchical()).isFalse();
        assertThat(c.dimension()).isEqualTo(13 * 11);
        assertThat(c.get("EJ2")).isEqualTo(9.0);
    }

    @Test
    @DisplayName("階層を指定すると階層的対角化で構成します")
    void hierarchicalCircuit() {
        ScqProperties p = transmonPair();
        p.getHierarchy().setSystemHierarchy("[[1], [2]]");
        p.getHierarchy().setSubsystemTruncDims("[6, 5]");
        Circuit c = new CircuitSpectrumConfiguration(p)
                .circuit(new EjmlHermitianEigenDecompositionBackend());
        assertThat(c.isHierarchical()).isTrue();
        assertThat(c.dimension()).isEqualTo(30);
    }

    @Test
    @DisplayName("周期変数に離散化範囲を指定すると構成エラーです")
    void phiRangeOnPeriodicVariable() {
        ScqProperties p = transmonPair();
        p.getCircuit().setDiscretizedPhiRanges(new LinkedHashMap<>(Map.of(1, List.of(-1.0, 1.0))));
        CircuitSpectrumConfiguration cfg = new CircuitSpectrumConfiguration(p);
        assertThatThrownBy(() -> cfg.circuit(new EjmlHermitianEigenDecompositionBackend()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("掃引の各点で値を書き込み固有値を出力します")
    void runnerSweeps() {
        ScqProperties p = transmonPair();
        p.getSpectrum().setEigenvalueCount(3);
        p.getSpectrum().getSweep().setParameter("EJ1");
        p.getSpectrum().getSweep().setValues(List.of(6.0, 7.0));
        Circuit c = new CircuitSpectrumConfiguration(p)
                .circuit(new EjmlHermitianEigenDecompositionBackend());
        List<String> calls = new ArrayList<>();
        ResultWriter writer = (circuit, parameter, value, energies) -> calls
                .add(parameter + "=" + value + ":" + energies.length);

        new ScqCliRunner(p, c, writer).run();

        assertThat(calls).containsExactly("EJ1=6.0:3", "EJ1=7.0:3");
        assertThat(c.get("EJ1")).isEqualTo(7.0);
    }

    @Test
    @DisplayName("掃引値が空の場合は実行を拒否します")
    void runnerRequiresSweepValues() {
        ScqProperties p = transmonPair();
        p.getSpectrum().getSweep().setParameter("EJ1");
        Circuit c = new CircuitSpectrumConfiguration(p)
                .circuit(new EjmlHermitianEigenDecompositionBackend());
        ScqCliRunner runner = new ScqCliRunner(p, c, (circuit, parameter, value, energies) -> {
        });
        assertThatThrownBy(runner::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("設定値を複数行の文字列に整形します")
    void multilineString() {
        String text = transmonPair().toMultilineString();
        assertThat(text).contains("  circuit:", "    truncatedDim: 10", "  spectrum:",
                "    eigenvalueCount: 6", "    dir: ./out");
    }
}
