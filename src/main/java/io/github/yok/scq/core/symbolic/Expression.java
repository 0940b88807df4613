package io.github.yok.scq.core.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 記号ハミルトニアン（{@link Term} の和）を表す不変クラスです。
 *
 * <p>
 * 生成時に同類項（演算子部分が等しい項）をまとめ、係数が定数 0 の項を除きます。 項の順序は最初に現れた順です。
 * </p>
 */
public final class Expression {

    /**
     * 空の式（0）です。
     */
    public static final Expression ZERO = new Expression(List.of());

    /**
     * 項の一覧です。
     */
    private final List<Term> terms;

    private Expression(List<Term> merged) {
        this.terms = Collections.unmodifiableList(merged);
    }

    /**
     * 項の一覧から式を生成します（同類項をまとめます）。
     *
     * @param terms 項の一覧です
     * @return 式です
     */
    public static Expression of(List<Term> terms) {
        Map<String, Term> merged = new LinkedHashMap<>();
        for (Term t : terms) {
            merged.merge(t.operatorKey(), t,
                    (a, b) -> a.withCoefficient(a.getCoefficient().plus(b.getCoefficient())));
        }
        List<Term> out = new ArrayList<>();
        for (Term t : merged.values()) {
            if (!t.getCoefficient().isZero()) {
                out.add(t);
            }
        }
        return new Expression(out);
    }

    /**
     * 定数式を生成します。
     *
     * @param value 値です
     * @return 式です
     */
    public static Expression scalar(Scalar value) {
        return of(List.of(Term.scalar(value)));
    }

    /**
     * 演算子記号 1 つからなる式を生成します。
     *
     * @param symbol 演算子記号です
     * @return 式です
     */
    public static Expression operator(OperatorSymbol symbol) {
        return of(List.of(new Term(Scalar.ONE, Map.of(symbol, 1), List.of())));
    }

    /**
     * 三角関数因子 1 つからなる式を生成します。
     *
     * @param factor 三角関数因子です
     * @return 式です
     */
    public static Expression trig(TrigFactor factor) {
        return of(List.of(new Term(Scalar.ONE, Map.of(), List.of(factor))));
    }

    public List<Term> getTerms() {
        return terms;
    }

    public Expression plus(Expression other) {
        List<Term> all = new ArrayList<>(terms);
        all.addAll(other.terms);
        return of(all);
    }

    public Expression minus(Expression other) {
        return plus(other.negate());
    }

    public Expression negate() {
        return scale(Scalar.constant(-1.0));
    }

    /**
     * パラメータ式で各項の係数を掛けた式を返します。
     *
     * @param factor 係数です
     * @return 式です
     */
    public Expression scale(Scalar factor) {
        return of(terms.stream().map(t -> t.withCoefficient(t.getCoefficient().times(factor)))
                .collect(Collectors.toList()));
    }

    /**
     * パラメータ式で割った式を返します。
     *
     * @param divisor 除数です
     * @return 式です
     */
    public Expression divide(Scalar divisor) {
        return of(terms.stream().map(t -> t.withCoefficient(t.getCoefficient().divide(divisor)))
                .collect(Collectors.toList()));
    }

    /**
     * 積を展開して返します。
     *
     * @param other 右から掛ける式です
     * @return 積です
     */
    public Expression times(Expression other) {
        List<Term> out = new ArrayList<>();
        for (Term a : terms) {
            for (Term b : other.terms) {
                out.add(a.times(b));
            }
        }
        return of(out);
    }

    /**
     * 非負整数乗を展開して返します。
     *
     * @param exponent 指数です（0 以上）
     * @return 冪です
     */
    public Expression pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent は 0 以上が必要です: " + exponent);
        }
        Expression result = scalar(Scalar.ONE);
        for (int k = 0; k < exponent; k++) {
            result = result.times(this);
        }
        return result;
    }

    /**
     * 演算子を含まない式かどうかを返します。
     *
     * @return 定数式なら true です
     */
    public boolean isScalar() {
        return terms.stream().allMatch(Term::isScalar);
    }

    /**
     * 定数式をパラメータ式として返します。
     *
     * @return パラメータ式です
     * @throws IllegalStateException 演算子を含む場合に発生します
     */
    public Scalar asScalar() {
        if (!isScalar()) {
            throw new IllegalStateException("演算子を含む式です: " + this);
        }
        Scalar sum = Scalar.ZERO;
        for (Term t : terms) {
            sum = sum.plus(t.getCoefficient());
        }
        return sum;
    }

    /**
     * 条件を満たす項だけからなる式を返します。
     *
     * @param predicate 条件です
     * @return 式です
     */
    public Expression filter(Predicate<Term> predicate) {
        return of(terms.stream().filter(predicate).collect(Collectors.toList()));
    }

    /**
     * 式に現れる変数番号を返します。
     *
     * @return 変数番号の集合（昇順）です
     */
    public SortedSet<Integer> variables() {
        TreeSet<Integer> out = new TreeSet<>();
        terms.forEach(t -> out.addAll(t.variables()));
        return out;
    }

    /**
     * 式に現れる演算子記号を返します（三角関数の引数の θ を含みます）。
     *
     * @return 演算子記号の集合です
     */
    public SortedSet<OperatorSymbol> operatorSymbols() {
        TreeSet<OperatorSymbol> out = new TreeSet<>();
        for (Term t : terms) {
            out.addAll(t.getMonomial().keySet());
            t.getTrigFactors().forEach(
                    f -> f.getCoefficients().keySet().forEach(i -> out.add(OperatorSymbol.theta(i))));
        }
        return out;
    }

    /**
     * 式に現れるパラメータ記号を返します。
     *
     * @return 記号名の集合です
     */
    public SortedSet<String> parameterSymbols() {
        TreeSet<String> out = new TreeSet<>();
        terms.forEach(t -> out.addAll(t.parameterSymbols()));
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        return (obj instanceof Expression) && toString().equals(obj.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0.0";
        }
        return terms.stream().map(Term::toString).collect(Collectors.joining(" + "));
    }
}
