package io.github.yok.scq.app;

import io.github.yok.scq.core.circuit.Circuit;
import io.github.yok.scq.out.ResultWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で scq-solver を実行するクラスです。
 *
 * <p>
 * 指定したパラメータを掃引し、各値について回路の固有値を計算して出力します。 掃引を指定しない場合は現在の値で 1 回だけ計算します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class ScqCliRunner implements CommandLineRunner {

    /**
     * scq-solver の設定値（scq.*）です。
     */
    private final ScqProperties properties;

    /**
     * 構成済みの回路です。
     */
    private final Circuit circuit;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== scq-solver start: circuit spectrum ===");
        System.out.print(properties.toMultilineString());

        System.out.println("回路: dimension=" + circuit.dimension() + ", hierarchy="
                + circuit.getHierarchy() + ", subsystems=" + circuit.subsystems().size());
        System.out.println("雑音チャネル: " + circuit.supportedNoiseChannels());

        int count = Math.min(properties.getSpectrum().getEigenvalueCount(), circuit.dimension());
        String parameter = properties.getSpectrum().getSweep().getParameter();

        // 掃引なしの場合は現在の値で 1 回だけ計算
        if (parameter == null || parameter.isBlank()) {
            double[] energies = circuit.eigenvals(count);
            resultWriter.write(circuit, null, Double.NaN, energies);
            System.out.println("結果: eigenvalues=" + format(energies));
            return;
        }

        List<Double> values = properties.getSpectrum().getSweep().getValues();
        if (values == null || values.isEmpty()) {
            throw new IllegalStateException("spectrum.sweep.values は必須です（掃引する値の一覧を指定してください）");
        }

        // 値ごとに書き込み → 固有値計算
        for (int i = 0; i < values.size(); i++) {
            Double vObj = values.get(i);
            if (vObj == null) {
                throw new IllegalStateException("spectrum.sweep.values に null が含まれています");
            }
            double v = vObj.doubleValue();

            System.out.println("=== 掃引点ごとの計算 ===");
            System.out.println("入力: " + parameter + "=" + fmt5(v) + "（step=" + (i + 1) + "/"
                    + values.size() + "）");

            circuit.set(parameter, v);
            double[] energies = circuit.eigenvals(count);
            resultWriter.write(circuit, parameter, v, energies);

            System.out.println("結果: E0=" + fmt5(energies[0]) + ", eigenvalues=" + format(energies));
        }
    }

    private static String format(double[] values) {
        return Arrays.stream(values).mapToObj(ScqCliRunner::fmt5)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
