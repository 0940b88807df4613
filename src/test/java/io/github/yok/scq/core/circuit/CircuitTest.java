package io.github.yok.scq.core.circuit;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.basis.ExtBasis;
import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.exception.ValidationException;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CircuitTest {

    private static final String FLUXONIUM = "4*EC*Q1^2 + 0.5*EL*θ1^2 - EJ*cos(θ1 + Φ1)";

    private static final String TRANSMON = "4*EC*(n1 - ng1)^2 - EJ*cos(θ1)";

    private static final String OSCILLATOR = "4*EC*Q1^2 + 0.5*EL*θ1^2";

    private static Circuit fluxonium() {
        return Circuit.fromHamiltonian(FLUXONIUM, Map.of("EC", 1.0, "EL", 1.0, "EJ", 4.0));
    }

    private static Circuit transmon(int cutoff) {
        return Circuit.fromHamiltonian(TRANSMON, Map.of("EC", 0.2, "EJ", 10.0),
                CircuitOptions.builder().cutoffs(Map.of("cutoff_n_1", cutoff)).build());
    }

    @Nested
    @DisplayName("構成")
    class Configuration {

        @Test
        @DisplayName("fluxonium は離散化磁束基底で次元 30 の疎行列になります")
        void fluxoniumDimension() {
            Circuit c = fluxonium();
            assertThat(c.getState()).isEqualTo(LifecycleState.CONFIGURED);
            assertThat(c.dimension()).isEqualTo(30);
            assertThat(c.matrixType()).isEqualTo(MatrixType.SPARSE);
            assertThat(c.isHarmonicFastPath()).isFalse();
            assertThat(c.get("Φ1")).isEqualTo(0.0);
            assertThat(c.get("ext_basis")).isEqualTo(ExtBasis.DISCRETIZED);
            assertThat(c.propertyNames()).contains("EC", "EL", "EJ", "Φ1", "cutoff_ext_1",
                    "ext_basis");
        }

        @Test
        @DisplayName("fluxonium の基底状態は縮退しません")
        void fluxoniumGroundState() {
            double[] e = fluxonium().eigenvals(2);
            assertThat(e[1] - e[0]).isGreaterThan(1e-3);
        }

        @Test
        @DisplayName("EL=10, EJ=20 の fluxonium も格子点数の次元で基底状態は縮退しません")
        void fluxoniumDeepWell() {
            Circuit c = Circuit.fromHamiltonian(FLUXONIUM,
                    Map.of("EC", 1.0, "EL", 10.0, "EJ", 20.0, "ECJ", 3.0));
            assertThat(c.dimension()).isEqualTo(30);
            assertThat(c.propertyNames()).doesNotContain("ECJ");
            double[] e = c.eigenvals(2);
            assertThat(e[0]).isLessThan(e[1]);
        }

        @Test
        @DisplayName("transmon は cutoff_n_1=30 で次元 61 になり E01 ≈ √(8EJEC) - EC です")
        void transmonSpectrum() {
            Circuit c = transmon(30);
            assertThat(c.dimension()).isEqualTo(61);
            double[] e = c.eigenvals(2);
            assertThat(e[1] - e[0]).isCloseTo(Math.sqrt(8 * 10.0 * 0.2) - 0.2, withinPercentage(2.0));
        }

        @Test
        @DisplayName("ハミルトニアンはエルミートです")
        void hermitian() {
            assertThat(fluxonium().hamiltonian().hermiticityDefect()).isLessThanOrEqualTo(1e-9);
            assertThat(transmon(5).hamiltonian().hermiticityDefect()).isLessThanOrEqualTo(1e-9);
        }

        @Test
        @DisplayName("同じ構成で構成し直しても結果は変わりません")
        void idempotent() {
            Circuit c = fluxonium();
            ComplexMatrix before = c.hamiltonian();
            double[] e = c.eigenvals(3);
            c.configure();
            c.configure();
            assertThat(c.hamiltonian().maxAbsDifference(before)).isLessThanOrEqualTo(1e-12);
            assertThat(c.eigenvals(3)).containsExactly(e, within(1e-12));
            assertThat(c.getHierarchy()).isNull();
        }

        @Test
        @DisplayName("未定義のパラメータは構成エラーです")
        void undefinedParameter() {
            assertThatThrownBy(() -> Circuit.fromHamiltonian(TRANSMON, Map.of("EC", 1.0)))
                    .isInstanceOf(ConfigurationException.class).hasMessageContaining("EJ");
        }

        @Test
        @DisplayName("θ だけが現れる変数の多項式は構成エラーです")
        void frozenVariable() {
            assertThatThrownBy(() -> Circuit.fromHamiltonian("4*EC*n1^2 - EJ*cos(θ1) + EL*θ2^2",
                    Map.of("EC", 1.0, "EJ", 1.0, "EL", 1.0)))
                            .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("周期変数の θ 多項式は構成エラーです")
        void periodicThetaPolynomial() {
            assertThatThrownBy(() -> Circuit.fromHamiltonian("4*EC*n1^2 + EL*θ1^2",
                    Map.of("EC", 1.0, "EL", 1.0))).isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("θ1");
        }

        @Test
        @DisplayName("構成中の再構成は拒否され元の構成に戻ります")
        void reentrantConfigure() {
            AtomicReference<Circuit> self = new AtomicReference<>();
            FixedHamiltonianBuilder delegate =
                    new FixedHamiltonianBuilder(TRANSMON, Map.of("EC", 0.2, "EJ", 10.0));
            SymbolicCircuitBuilder reentrant = new SymbolicCircuitBuilder() {
                @Override
                public SymbolicCircuit derive(double[][] tm, List<Branch> closure) {
                    if (self.get() != null) {
                        self.get().configure();
                    }
                    return delegate.derive(tm, closure);
                }

                @Override
                public List<Branch> branches() {
                    return delegate.branches();
                }

                @Override
                public boolean isFluxDynamic() {
                    return false;
                }

                @Override
                public Optional<Branch> findBranch(int node1, int node2, String type,
                        List<String> params) {
                    return delegate.findBranch(node1, node2, type, params);
                }

                @Override
                public String inputString() {
                    return delegate.inputString();
                }
            };
            Circuit c = new Circuit(reentrant, CircuitOptions.defaults());
            c.configure();
            double[] e = c.eigenvals(2);
            self.set(c);

            assertThatThrownBy(c::configure).isInstanceOf(ConfigurationException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(c.getState()).isEqualTo(LifecycleState.CONFIGURED);
            assertThat(c.eigenvals(2)).containsExactly(e, within(1e-12));
        }

        @Test
        @DisplayName("記号ハミルトニアンの回路では閉路枝を指定できません")
        void closureBranchesRejected() {
            Circuit c = transmon(5);
            List<Branch> closure = List.of(new Branch(0, 1, "JJ", List.of("EJ")));
            assertThatThrownBy(() -> c.configure(null, null, null, closure))
                    .isInstanceOf(ConfigurationException.class);
            assertThat(c.getClosureBranches()).isEmpty();
        }
    }

    @Nested
    @DisplayName("プロパティの更新")
    class PropertyUpdates {

        @Test
        @DisplayName("パラメータを書き込むと固有値が更新されます")
        void parameterInvalidatesCache() {
            Circuit c = transmon(10);
            double[] before = c.eigenvals(2);
            c.set("EJ", 20.0);
            double[] after = c.eigenvals(2);
            assertThat(after[1] - after[0]).isGreaterThan(before[1] - before[0]);
            assertThat(c.get("EJ")).isEqualTo(20.0);
        }

        @Test
        @DisplayName("打ち切りを書き込むと次元が変わります")
        void cutoffChangesDimension() {
            Circuit c = transmon(5);
            c.set("cutoff_n_1", 8);
            assertThat(c.dimension()).isEqualTo(17);
            assertThat(c.hamiltonian().numRows()).isEqualTo(17);
        }

        @Test
        @DisplayName("ルート自身の打ち切り次元は打ち切りの書き込みを制限しません")
        void rootTruncationNotEnforced() {
            Circuit c = transmon(5);
            assertThatCode(() -> c.set("cutoff_n_1", 2)).doesNotThrowAnyException();
            assertThat(c.dimension()).isEqualTo(5);
            assertThat(c.eigenvals()).hasSize(5);
        }

        @Test
        @DisplayName("不正な値は検証エラーで値は変わりません")
        void invalidValue() {
            Circuit c = transmon(5);
            assertThatThrownBy(() -> c.set("cutoff_n_1", -1))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> c.set("EJ", Double.POSITIVE_INFINITY))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> c.set("unknown", 1.0)).isInstanceOf(ValidationException.class);
            assertThat(c.dimension()).isEqualTo(11);
        }

        @Test
        @DisplayName("オフセット電荷を書き込むとスペクトルが変わります")
        void offsetCharge() {
            Circuit c = Circuit.fromHamiltonian(TRANSMON, Map.of("EC", 1.0, "EJ", 1.0));
            double e0 = c.eigenvals(1)[0];
            c.set("ng1", 0.5);
            assertThat(c.eigenvals(1)[0]).isNotCloseTo(e0, within(1e-6));
        }

        @Test
        @DisplayName("離散化範囲を変えると格子が作り直されます")
        void discretizedPhiRange() {
            Circuit c = fluxonium();
            ComplexMatrix before = c.hamiltonian();
            c.setDiscretizedPhiRange(List.of(1), new double[] {-10.0, 10.0});
            assertThat(c.getDiscretizedPhiRanges()).containsOnlyKeys(1);
            assertThat(c.hamiltonian().maxAbsDifference(before)).isGreaterThan(1e-6);
            assertThatThrownBy(
                    () -> c.setDiscretizedPhiRange(List.of(1), new double[] {1.0, -1.0}))
                            .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> transmon(5).setDiscretizedPhiRange(List.of(1),
                    new double[] {-1.0, 1.0})).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("要求数が次元を超える固有値は拒否します")
        void eigenCountOutOfRange() {
            Circuit c = transmon(2);
            assertThatThrownBy(() -> c.eigenvals(6)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("演算子")
    class Operators {

        @Test
        @DisplayName("周期変数の演算子ハンドルは n・cos・sin です")
        void periodicHandles() {
            Circuit c = transmon(3);
            Map<String, OperatorHandle> handles = c.operatorHandles();
            assertThat(handles).containsOnlyKeys("n1", "cos(θ1)", "sin(θ1)");
            ComplexMatrix n = handles.get("n1").generate();
            assertThat(n.shape()).isEqualTo("7x7");
            assertThat(n.getReal(6, 6)).isEqualTo(3.0);
        }

        @Test
        @DisplayName("拡張変数の演算子ハンドルは θ・Q・cos・sin です")
        void extendedHandles() {
            assertThat(fluxonium().operatorHandles()).containsOnlyKeys("θ1", "Q1", "cos(θ1)",
                    "sin(θ1)");
        }

        @Test
        @DisplayName("任意の式を現在のパラメータで行列にします")
        void expressionOperator() {
            Circuit c = transmon(5);
            ComplexMatrix h = c.operator(TRANSMON);
            assertThat(h.maxAbsDifference(c.hamiltonian())).isLessThan(1e-12);
            assertThat(c.operator("EJ*n1").getReal(10, 10)).isEqualTo(50.0);
        }

        @Test
        @DisplayName("系にない変数や周期変数の θ は拒否します")
        void invalidOperators() {
            Circuit c = transmon(5);
            assertThatThrownBy(() -> c.operator("n2")).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> c.operator("θ1")).isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("基準モード分解")
    class HarmonicFastPath {

        @Test
        @DisplayName("純調和な系は基準モードの数基底で対角になります")
        void diagonalInNormalModes() {
            Circuit c = Circuit.fromHamiltonian(OSCILLATOR, Map.of("EC", 1.0, "EL", 10.0));
            assertThat(c.isHarmonicFastPath()).isTrue();
            assertThat(c.matrixType()).isEqualTo(MatrixType.DENSE);
            assertThat(c.dimension()).isEqualTo(30);
            double omega = Math.sqrt(80.0);
            assertThat(c.normalModeFrequencies()).containsExactly(new double[] {omega},
                    within(1e-12));
            double[] e = c.eigenvals(3);
            for (int n = 0; n < 3; n++) {
                assertThat(e[n]).isCloseTo(omega * (n + 0.5), within(1e-9));
            }
        }

        @Test
        @DisplayName("低エネルギー準位は離散化磁束基底の計算と 1% 以内で一致します")
        void matchesBruteForce() {
            Map<String, Double> params = Map.of("EC", 1.0, "EL", 10.0);
            Circuit fast = Circuit.fromHamiltonian(OSCILLATOR, params);
            Circuit brute = Circuit.fromHamiltonian(OSCILLATOR, params,
                    CircuitOptions.builder().harmonicFastPath(false)
                            .cutoffs(Map.of("cutoff_ext_1", 301))
                            .discretizedPhiRange(new double[] {-6.0, 6.0}).build());
            assertThat(brute.isHarmonicFastPath()).isFalse();
            assertThat(brute.dimension()).isEqualTo(301);
            double[] ef = fast.eigenvals(5);
            double[] eb = brute.eigenvals(5);
            for (int n = 0; n < 5; n++) {
                assertThat(eb[n]).isCloseTo(ef[n], withinPercentage(1.0));
            }
        }

        @Test
        @DisplayName("調和振動子基底は振動子長を合わせて密行列で扱います")
        void harmonicBasisWithoutFastPath() {
            Circuit c = Circuit.fromHamiltonian(OSCILLATOR, Map.of("EC", 1.0, "EL", 10.0),
                    CircuitOptions.builder().harmonicFastPath(false).extBasis(ExtBasis.HARMONIC)
                            .build());
            assertThat(c.isHarmonicFastPath()).isFalse();
            assertThat(c.matrixType()).isEqualTo(MatrixType.DENSE);
            double omega = Math.sqrt(80.0);
            double[] e = c.eigenvals(4);
            for (int n = 0; n < 4; n++) {
                assertThat(e[n]).isCloseTo(omega * (n + 0.5), within(1e-9));
            }
        }

        @Test
        @DisplayName("結合した振動子の基準モード周波数を求めます")
        void coupledOscillators() {
            String h = "4*EC*Q1^2 + 4*EC*Q2^2 + 0.5*EL*θ1^2 + 0.5*EL*θ2^2 + g*θ1*θ2";
            Circuit c = Circuit.fromHamiltonian(h, Map.of("EC", 1.0, "EL", 10.0, "g", 2.0),
                    CircuitOptions.builder()
                            .cutoffs(Map.of("cutoff_ext_1", 6, "cutoff_ext_2", 6)).build());
            assertThat(c.isHarmonicFastPath()).isTrue();
            assertThat(c.dimension()).isEqualTo(36);
            double w1 = 2 * Math.sqrt(2.0 * (10.0 - 2.0));
            double w2 = 2 * Math.sqrt(2.0 * (10.0 + 2.0));
            assertThat(c.normalModeFrequencies()).containsExactly(new double[] {w1, w2},
                    within(1e-9));
            double[] e = c.eigenvals(2);
            assertThat(e[0]).isCloseTo(0.5 * (w1 + w2), within(1e-9));
            assertThat(e[1]).isCloseTo(0.5 * (w1 + w2) + w1, within(1e-9));
            // 元の変数で組み立てた H の基底状態成分は基準モードのエネルギーに一致します。
            assertThat(c.operator(h).getReal(0, 0)).isCloseTo(e[0], within(1e-9));
        }

        @Test
        @DisplayName("非調和項が現れると局所基底に戻ります")
        void leavesFastPathWhenAnharmonic() {
            Circuit c = Circuit.fromHamiltonian(FLUXONIUM, Map.of("EC", 1.0, "EL", 10.0, "EJ", 0.0));
            assertThat(c.isHarmonicFastPath()).isTrue();
            c.set("EJ", 2.0);
            assertThat(c.isHarmonicFastPath()).isFalse();
            assertThat(c.matrixType()).isEqualTo(MatrixType.SPARSE);
            c.set("EJ", 0.0);
            assertThat(c.isHarmonicFastPath()).isTrue();
        }

        @Test
        @DisplayName("パラメータを書き込むと基準モードが作り直されます")
        void parameterUpdate() {
            Circuit c = Circuit.fromHamiltonian(OSCILLATOR, Map.of("EC", 1.0, "EL", 10.0));
            c.set("EL", 20.0);
            assertThat(c.normalModeFrequencies()[0]).isCloseTo(Math.sqrt(160.0), within(1e-12));
        }

        @Test
        @DisplayName("外部磁束でずれた振動子は平方完成して基準モードのまま扱います")
        void fluxShiftedOscillator() {
            Circuit c = Circuit.fromHamiltonian("4*EC*Q1^2 + 0.5*EL*(θ1 - Φ1)^2",
                    Map.of("EC", 1.0, "EL", 10.0));
            assertThat(c.isHarmonicFastPath()).isTrue();
            c.set("Φ1", 0.5);
            assertThat(c.isHarmonicFastPath()).isTrue();
            double omega = Math.sqrt(80.0);
            double[] e = c.eigenvals(2);
            assertThat(e[0]).isCloseTo(0.5 * omega, within(1e-9));
            assertThat(e[1]).isCloseTo(1.5 * omega, within(1e-9));
            // 基底状態の θ の期待値はポテンシャルの中心に移ります。
            assertThat(c.operator("θ1").getReal(0, 0)).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("電荷オフセットでずれた振動子も基準モードのまま扱います")
        void chargeShiftedOscillator() {
            Circuit c = Circuit.fromHamiltonian("4*EC*(Q1 - ng1)^2 + 0.5*EL*θ1^2",
                    Map.of("EC", 1.0, "EL", 10.0));
            c.set("ng1", 0.25);
            assertThat(c.isHarmonicFastPath()).isTrue();
            assertThat(c.eigenvals(1)[0]).isCloseTo(0.5 * Math.sqrt(80.0), within(1e-9));
            assertThat(c.operator("Q1").getReal(0, 0)).isCloseTo(0.25, within(1e-9));
        }
    }

    @Nested
    @DisplayName("雑音チャネル")
    class NoiseChannels {

        @Test
        @DisplayName("fluxonium は誘導性・磁束・臨界電流のチャネルを持ちます")
        void fluxoniumChannels() {
            assertThat(fluxonium().supportedNoiseChannels()).containsExactly("t1_capacitive",
                    "t1_charge_impedance", "t1_inductive", "tphi_1_over_f_flux",
                    "t1_flux_bias_line", "tphi_1_over_f_cc");
        }

        @Test
        @DisplayName("transmon はオフセット電荷と臨界電流のチャネルを持ちます")
        void transmonChannels() {
            assertThat(transmon(5).supportedNoiseChannels()).containsExactly("t1_capacitive",
                    "t1_charge_impedance", "tphi_1_over_f_ng", "tphi_1_over_f_cc");
        }

        @Test
        @DisplayName("調和振動子は容量性と誘導性のチャネルだけを持ちます")
        void oscillatorChannels() {
            assertThat(Circuit.fromHamiltonian(OSCILLATOR, Map.of("EC", 1.0, "EL", 10.0))
                    .supportedNoiseChannels()).containsExactly("t1_capacitive",
                            "t1_charge_impedance", "t1_inductive");
        }
    }
}
