package io.github.yok.scq.out;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.circuit.Circuit;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    private static Circuit transmon() {
        return Circuit.fromHamiltonian("4*EC*(n1 - ng1)^2 - EJ*cos(θ1)",
                Map.of("EC", 0.2, "EJ", 10.0));
    }

    @Test
    @DisplayName("掃引点ごとに固有値とメタ情報のファイルを出力します")
    void writesSweepFiles() throws IOException {
        Circuit c = transmon();
        double[] e = c.eigenvals(3);
        new CsvResultWriter(dir.toString()).write(c, "EJ", 10.0, e);

        Path eigen = dir.resolve("scq_eigenvalues_EJ=10.00.csv");
        Path meta = dir.resolve("scq_meta_EJ=10.00.csv");
        assertThat(eigen).exists();
        assertThat(meta).exists();

        List<String> lines = Files.readAllLines(eigen, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).isEqualTo("k,energy,excitation");
        assertThat(lines.get(1)).startsWith("0,").endsWith(",0.0");

        String metaText = Files.readString(meta, StandardCharsets.UTF_8);
        assertThat(metaText).contains("input.parameter,EJ", "circuit.dimension,11",
                "property.EJ,10.0", "eigen.count,3", "tphi_1_over_f_ng");
    }

    @Test
    @DisplayName("掃引しない場合は固定のファイル名で出力します")
    void writesWithoutSweep() {
        Circuit c = transmon();
        new CsvResultWriter(dir.resolve("nested").toString()).write(c, null, Double.NaN,
                c.eigenvals(1));
        assertThat(dir.resolve("nested").resolve("scq_eigenvalues.csv")).exists();
        assertThat(dir.resolve("nested").resolve("scq_meta.csv")).exists();
    }

    @Test
    @DisplayName("不正な引数は拒否します")
    void rejectsInvalidArguments() {
        Circuit c = transmon();
        CsvResultWriter w = new CsvResultWriter(dir.toString());
        assertThatThrownBy(() -> new CsvResultWriter(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> w.write(null, null, 0.0, new double[] {1.0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> w.write(c, null, 0.0, new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> w.write(c, "EJ", Double.NaN, new double[] {1.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
