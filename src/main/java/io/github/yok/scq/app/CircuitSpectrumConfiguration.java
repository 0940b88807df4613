package io.github.yok.scq.app;

import io.github.yok.scq.core.circuit.Circuit;
import io.github.yok.scq.core.circuit.CircuitOptions;
import io.github.yok.scq.core.circuit.FixedHamiltonianBuilder;
import io.github.yok.scq.core.hierarchy.SystemHierarchy;
import io.github.yok.scq.core.hierarchy.TruncationSpec;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.scq.core.linearalgebra.EjmlHermitianEigenDecompositionBackend;
import io.github.yok.scq.out.CsvResultWriter;
import io.github.yok.scq.out.ResultWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 記号ハミルトニアンから回路を構成し、スペクトルを計算する Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class CircuitSpectrumConfiguration {

    /**
     * scq-solver の設定値（scq.*）です。
     */
    private final ScqProperties p;

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlHermitianEigenDecompositionBackend();
    }

    /**
     * 回路を生成して構成します。
     *
     * <p>
     * 階層を指定した場合は、離散化範囲を設定した後に階層的対角化で構成し直します。
     * </p>
     *
     * @param eigen 固有分解バックエンドです
     * @return 構成済みの回路です
     */
    @Bean
    public Circuit circuit(EigenDecompositionBackend eigen) {
        ScqProperties.Circuit c = p.getCircuit();

        // パラメータ・外部磁束・オフセット電荷の初期値をまとめて渡します。
        Map<String, Double> values = new LinkedHashMap<>(c.getParameters());
        values.putAll(c.getExternalFluxes());
        values.putAll(c.getOffsetCharges());

        CircuitOptions options = CircuitOptions.builder().extBasis(c.getExtBasis())
                .truncatedDim(c.getTruncatedDim()).harmonicFastPath(c.isHarmonicFastPath())
                .harmonicTolerance(c.getHarmonicTolerance()).cutoffs(Map.copyOf(c.getCutoffs()))
                .build();
        Circuit circuit =
                new Circuit(new FixedHamiltonianBuilder(c.getHamiltonian(), values), options, eigen);
        circuit.configure();

        for (Map.Entry<Integer, List<Double>> e : c.getDiscretizedPhiRanges().entrySet()) {
            List<Double> range = e.getValue();
            if (range == null || range.size() != 2) {
                throw new IllegalStateException(
                        "discretizedPhiRanges は [min, max] を指定してください: " + e.getKey());
            }
            circuit.setDiscretizedPhiRange(List.of(e.getKey()),
                    new double[] {range.get(0), range.get(1)});
        }

        ScqProperties.Hierarchy h = p.getHierarchy();
        if (h.getSystemHierarchy() != null && !h.getSystemHierarchy().isBlank()) {
            SystemHierarchy hierarchy = SystemHierarchy.parse(h.getSystemHierarchy());
            List<TruncationSpec> specs =
                    (h.getSubsystemTruncDims() != null && !h.getSubsystemTruncDims().isBlank())
                            ? TruncationSpec.parseList(h.getSubsystemTruncDims())
                            : null;
            circuit.configure(hierarchy, specs);
        }
        return circuit;
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
