package io.github.yok.scq.app;

import io.github.yok.scq.core.basis.ExtBasis;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * scq-solver の設定値（scq.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の回路の構成に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "scq")
public class ScqProperties {

    /**
     * 回路設定です。
     */
    @Valid
    private Circuit circuit = new Circuit();

    /**
     * 階層的対角化の設定です。
     */
    private Hierarchy hierarchy = new Hierarchy();

    /**
     * スペクトル計算の設定です。
     */
    @Valid
    private Spectrum spectrum = new Spectrum();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "scq")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Circuit c = getCircuit();
        Hierarchy h = getHierarchy();
        Spectrum s = getSpectrum();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "circuit",
                // hamiltonian: 記号ハミルトニアン
                "hamiltonian", c.getHamiltonian(),
                // parameters: パラメータ値（EC, EL, EJ など）
                "parameters", c.getParameters(),
                // externalFluxes: 外部磁束（Φ1 など）
                "externalFluxes", c.getExternalFluxes(),
                // offsetCharges: オフセット電荷（ng1 など）
                "offsetCharges", c.getOffsetCharges(),
                // cutoffs: 打ち切り（cutoff_n_1, cutoff_ext_2 など）
                "cutoffs", c.getCutoffs(),
                // extBasis: 拡張変数の基底（DISCRETIZED/HARMONIC）
                "extBasis", c.getExtBasis(),
                // truncatedDim: 打ち切り次元
                "truncatedDim", c.getTruncatedDim(),
                // discretizedPhiRanges: 変数番号 → 離散化範囲 [min, max]
                "discretizedPhiRanges", c.getDiscretizedPhiRanges(),
                // harmonicFastPath: 純調和な系に基準モード分解を適用するかどうか
                "harmonicFastPath", c.isHarmonicFastPath(),
                // harmonicTolerance: 純調和判定の許容誤差
                "harmonicTolerance", c.getHarmonicTolerance());

        appendSection(sb, nl, "hierarchy",
                // systemHierarchy: 階層（例: [[1],[2,3]]）
                "systemHierarchy", h.getSystemHierarchy(),
                // subsystemTruncDims: 打ち切り次元（例: [6, 10]）
                "subsystemTruncDims", h.getSubsystemTruncDims());

        appendSection(sb, nl, "spectrum",
                // eigenvalueCount: 計算する固有値の個数
                "eigenvalueCount", s.getEigenvalueCount(),
                // sweep.parameter: 掃引するパラメータ名
                "sweep.parameter", s.getSweep().getParameter(),
                // sweep.values: 掃引する値の一覧
                "sweep.values", s.getSweep().getValues());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Circuit {

        /**
         * 記号ハミルトニアンです。
         */
        @NotBlank
        private String hamiltonian = "4*EC*Q1^2 + 0.5*EL*θ1^2 - EJ*cos(θ1 + Φ1)";

        /**
         * パラメータ値です。
         */
        private Map<String, Double> parameters = new LinkedHashMap<>();

        /**
         * 外部磁束の初期値です。
         */
        private Map<String, Double> externalFluxes = new LinkedHashMap<>();

        /**
         * オフセット電荷の初期値です。
         */
        private Map<String, Double> offsetCharges = new LinkedHashMap<>();

        /**
         * 打ち切りの個別指定です。
         */
        private Map<String, Integer> cutoffs = new LinkedHashMap<>();

        /**
         * 拡張変数の基底です。
         */
        @NotNull
        private ExtBasis extBasis = ExtBasis.DISCRETIZED;

        /**
         * 打ち切り次元です。
         */
        @Min(1)
        private int truncatedDim = 10;

        /**
         * 変数番号 → 離散化範囲 [min, max] です。
         */
        private Map<Integer, List<Double>> discretizedPhiRanges = new LinkedHashMap<>();

        /**
         * 純調和な系に基準モード分解を適用するかどうかです。
         */
        private boolean harmonicFastPath = true;

        /**
         * 純調和判定の許容誤差（絶対値）です。
         */
        @Positive
        private double harmonicTolerance = 1e-9;
    }

    @Data
    public static class Hierarchy {

        /**
         * 階層（括弧表記）です。空の場合は階層的対角化を行いません。
         */
        private String systemHierarchy = "";

        /**
         * 打ち切り次元（括弧表記）です。空の場合はひな形を使います。
         */
        private String subsystemTruncDims = "";
    }

    @Data
    public static class Spectrum {

        /**
         * 計算する固有値の個数です。
         */
        @Min(1)
        private int eigenvalueCount = 6;

        /**
         * パラメータ掃引の設定です。
         */
        @Valid
        private Sweep sweep = new Sweep();

        @Data
        public static class Sweep {

            /**
             * 掃引するパラメータ名です。空の場合は現在の値で 1 回だけ計算します。
             */
            private String parameter = "";

            /**
             * 掃引する値の一覧です。
             */
            private List<Double> values = List.of();
        }
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
