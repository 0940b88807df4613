package io.github.yok.scq.core.symbolic;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 三角関数因子 cos(Σ a_k θ_k + φ) または sin(Σ a_k θ_k + φ) を表す不変クラスです。
 *
 * <p>
 * θ の係数 a_k は数値、位相 φ はパラメータ式（外部磁束など）です。
 * </p>
 */
@Getter
@EqualsAndHashCode(of = "key")
public final class TrigFactor {

    /**
     * 関数の種類です。
     */
    private final Kind kind;

    /**
     * 変数番号 → θ の係数です。
     */
    private final SortedMap<Integer, Double> coefficients;

    /**
     * 位相です。
     */
    private final Scalar phase;

    /**
     * 同類項判定に使うキー文字列です。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final String key;

    /**
     * 三角関数因子を生成します。
     *
     * @param kind 関数の種類です
     * @param coefficients 変数番号 → θ の係数です（少なくとも 1 つの非ゼロ係数が必要です）
     * @param phase 位相です（null の場合は 0）
     * @throws IllegalArgumentException 係数が空の場合に発生します
     */
    public TrigFactor(Kind kind, Map<Integer, Double> coefficients, Scalar phase) {
        if (kind == null) {
            throw new IllegalArgumentException("kind は null 不可です");
        }
        TreeMap<Integer, Double> c = new TreeMap<>();
        coefficients.forEach((i, a) -> {
            if (a != 0.0) {
                c.put(i, a);
            }
        });
        if (c.isEmpty()) {
            throw new IllegalArgumentException("三角関数の引数に θ が含まれていません");
        }
        this.kind = kind;
        this.coefficients = Collections.unmodifiableSortedMap(c);
        this.phase = (phase != null) ? phase : Scalar.ZERO;
        this.key = render();
    }

    private String render() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase(java.util.Locale.ROOT));
        sb.append('(');
        boolean first = true;
        for (Map.Entry<Integer, Double> e : coefficients.entrySet()) {
            if (!first) {
                sb.append(" + ");
            }
            sb.append(Scalar.constant(e.getValue()).render(2)).append('*')
                    .append(OperatorSymbol.theta(e.getKey()));
            first = false;
        }
        if (!phase.isZero()) {
            sb.append(" + ").append(phase.render(2));
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return key;
    }

    /**
     * 三角関数の種類です。
     */
    public enum Kind {
        COS, SIN
    }
}
