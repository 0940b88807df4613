package io.github.yok.scq.out;

import io.github.yok.scq.core.circuit.Circuit;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（EJ は掃引パラメータ名、20.00 はその値）。
 * </p>
 *
 * <ul>
 * <li>{@code scq_eigenvalues_EJ=20.00.csv}</li>
 * <li>{@code scq_meta_EJ=20.00.csv}（次元・階層・パラメータ値などの補助情報）</li>
 * </ul>
 *
 * <p>
 * 掃引しない場合は {@code scq_eigenvalues.csv} と {@code scq_meta.csv} です。
 * </p>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "scq";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 固有値と回路の構成情報を出力します。
     *
     * @param circuit 回路です
     * @param sweepParameter 掃引パラメータ名です（掃引しない場合は null）
     * @param sweepValue 掃引パラメータの値です（掃引しない場合は無視）
     * @param eigenvalues 固有値（昇順）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(Circuit circuit, String sweepParameter, double sweepValue,
            double[] eigenvalues) {
        if (circuit == null) {
            throw new IllegalArgumentException("circuit は null 不可です");
        }
        if (eigenvalues == null || eigenvalues.length == 0) {
            throw new IllegalArgumentException("eigenvalues は 1 つ以上が必要です");
        }
        if (sweepParameter != null && !Double.isFinite(sweepValue)) {
            throw new IllegalArgumentException("掃引パラメータの値は有限値を指定してください: " + sweepValue);
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 固有値（励起エネルギー付き）
            writeEigenvaluesCsv(eigenvalues, sweepParameter, sweepValue);

            // 2) メタ（次元、階層、パラメータ値など）
            writeMetaCsv(circuit, eigenvalues, sweepParameter, sweepValue);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 固有値を出力します。
     *
     * @param eigenvalues 固有値です
     * @param sweepParameter 掃引パラメータ名です
     * @param sweepValue 掃引パラメータの値です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeEigenvaluesCsv(double[] eigenvalues, String sweepParameter,
            double sweepValue) throws IOException {

        Path file = outputDir.resolve(buildFileName("eigenvalues", sweepParameter, sweepValue));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("k", "energy", "excitation").build().print(w)) {

            for (int k = 0; k < eigenvalues.length; k++) {
                pr.printRecord(k, eigenvalues[k], eigenvalues[k] - eigenvalues[0]);
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param circuit 回路です
     * @param eigenvalues 固有値です
     * @param sweepParameter 掃引パラメータ名です
     * @param sweepValue 掃引パラメータの値です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(Circuit circuit, double[] eigenvalues, String sweepParameter,
            double sweepValue) throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", sweepParameter, sweepValue));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            if (sweepParameter != null) {
                pr.printRecord("input.parameter", sweepParameter);
                pr.printRecord("input.value", sweepValue);
            }

            pr.printRecord("circuit.hamiltonian", circuit.getHamiltonianSymbolic());
            pr.printRecord("circuit.dimension", circuit.dimension());
            pr.printRecord("circuit.matrixType", circuit.matrixType());
            pr.printRecord("circuit.hierarchy", circuit.getHierarchy());
            pr.printRecord("circuit.harmonicFastPath", circuit.isHarmonicFastPath());

            for (String name : circuit.propertyNames()) {
                pr.printRecord("property." + name, circuit.get(name));
            }
            for (Map.Entry<Integer, double[]> e : circuit.getDiscretizedPhiRanges().entrySet()) {
                pr.printRecord("discretizedPhiRange." + e.getKey(),
                        e.getValue()[0] + ":" + e.getValue()[1]);
            }

            pr.printRecord("eigen.count", eigenvalues.length);
            pr.printRecord("eigen.ground", eigenvalues[0]);
            if (eigenvalues.length > 1) {
                pr.printRecord("eigen.gap01", eigenvalues[1] - eigenvalues[0]);
            }
            pr.printRecord("noiseChannels", String.join(" ", circuit.supportedNoiseChannels()));
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code scq_eigenvalues_EJ=20.00.csv}
     * </p>
     *
     * @param kind 量の識別子（eigenvalues/meta）
     * @param sweepParameter 掃引パラメータ名です
     * @param sweepValue 掃引パラメータの値です
     * @return ファイル名です
     */
    private static String buildFileName(String kind, String sweepParameter, double sweepValue) {
        if (sweepParameter == null) {
            return FILE_HEAD + "_" + kind + ".csv";
        }
        return FILE_HEAD + "_" + kind + "_" + sweepParameter + "=" + formatValue(sweepValue)
                + ".csv";
    }

    /**
     * 値を小数点以下2桁に整形します（ファイル名用）。
     *
     * @param v 値です
     * @return 整形文字列（例: 0.20）
     */
    private static String formatValue(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
