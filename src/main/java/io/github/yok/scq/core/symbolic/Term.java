package io.github.yok.scq.core.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Getter;

/**
 * ハミルトニアンの 1 項（係数 × 演算子の単項式 × 三角関数因子）を表す不変クラスです。
 *
 * <p>
 * 単項式は変数ごとに θ^p · (n または Q)^q の順序で作用するものとして扱います。
 * </p>
 */
@Getter
public final class Term {

    /**
     * 係数です。
     */
    private final Scalar coefficient;

    /**
     * 演算子記号 → 冪指数です。
     */
    private final SortedMap<OperatorSymbol, Integer> monomial;

    /**
     * 三角関数因子です（キー順）。
     */
    private final List<TrigFactor> trigFactors;

    /**
     * 項を生成します。
     *
     * @param coefficient 係数です
     * @param monomial 演算子記号 → 冪指数です
     * @param trigFactors 三角関数因子です
     */
    public Term(Scalar coefficient, Map<OperatorSymbol, Integer> monomial,
            List<TrigFactor> trigFactors) {
        if (coefficient == null) {
            throw new IllegalArgumentException("coefficient は null 不可です");
        }
        TreeMap<OperatorSymbol, Integer> m = new TreeMap<>();
        monomial.forEach((s, p) -> {
            if (p < 0) {
                throw new IllegalArgumentException("演算子の冪指数は 0 以上が必要です: " + s + "^" + p);
            }
            if (p > 0) {
                m.put(s, p);
            }
        });
        List<TrigFactor> t = new ArrayList<>(trigFactors);
        t.sort(Comparator.comparing(TrigFactor::toString));
        this.coefficient = coefficient;
        this.monomial = Collections.unmodifiableSortedMap(m);
        this.trigFactors = Collections.unmodifiableList(t);
    }

    /**
     * 演算子を含まない定数項を生成します。
     *
     * @param coefficient 係数です
     * @return 項です
     */
    public static Term scalar(Scalar coefficient) {
        return new Term(coefficient, Map.of(), List.of());
    }

    /**
     * 係数を差し替えた項を返します。
     *
     * @param newCoefficient 新しい係数です
     * @return 項です
     */
    public Term withCoefficient(Scalar newCoefficient) {
        return new Term(newCoefficient, monomial, trigFactors);
    }

    /**
     * 積を返します。
     *
     * @param other 右から掛ける項です
     * @return 積です
     */
    public Term times(Term other) {
        TreeMap<OperatorSymbol, Integer> m = new TreeMap<>(monomial);
        other.monomial.forEach((s, p) -> m.merge(s, p, Integer::sum));
        List<TrigFactor> t = new ArrayList<>(trigFactors);
        t.addAll(other.trigFactors);
        return new Term(coefficient.times(other.coefficient), m, t);
    }

    /**
     * 演算子を含まない（定数）項かどうかを返します。
     *
     * @return 定数項なら true です
     */
    public boolean isScalar() {
        return monomial.isEmpty() && trigFactors.isEmpty();
    }

    /**
     * 指定した演算子記号の冪指数を返します。
     *
     * @param symbol 演算子記号です
     * @return 冪指数です（含まれなければ 0）
     */
    public int power(OperatorSymbol symbol) {
        return monomial.getOrDefault(symbol, 0);
    }

    /**
     * 単項式の全次数を返します（三角関数因子は含みません）。
     *
     * @return 全次数です
     */
    public int degree() {
        return monomial.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * 項が作用する変数番号の集合を返します。
     *
     * @return 変数番号の集合（昇順）です
     */
    public SortedSet<Integer> variables() {
        TreeSet<Integer> out = new TreeSet<>();
        monomial.keySet().forEach(s -> out.add(s.getIndex()));
        trigFactors.forEach(f -> out.addAll(f.getCoefficients().keySet()));
        return out;
    }

    /**
     * 係数・三角関数の位相に現れるパラメータ記号を返します。
     *
     * @return 記号名の集合です
     */
    public SortedSet<String> parameterSymbols() {
        TreeSet<String> out = new TreeSet<>(coefficient.symbols());
        trigFactors.forEach(f -> out.addAll(f.getPhase().symbols()));
        return out;
    }

    /**
     * 同類項判定に使う演算子部分のキーを返します。
     *
     * @return キー文字列です
     */
    public String operatorKey() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<OperatorSymbol, Integer> e : monomial.entrySet()) {
            if (sb.length() > 0) {
                sb.append('*');
            }
            sb.append(e.getKey());
            if (e.getValue() != 1) {
                sb.append('^').append(e.getValue());
            }
        }
        for (TrigFactor f : trigFactors) {
            if (sb.length() > 0) {
                sb.append('*');
            }
            sb.append(f);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        String ops = operatorKey();
        if (ops.isEmpty()) {
            return coefficient.render(1);
        }
        return coefficient.render(2) + "*" + ops;
    }
}
