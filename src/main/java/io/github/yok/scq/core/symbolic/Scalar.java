package io.github.yok.scq.core.symbolic;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;

/**
 * 演算子を含まない数式（パラメータ・外部磁束・オフセット電荷と定数の式）を表す不変クラスです。
 *
 * <p>
 * 値はパラメータ名から値を引く関数を与えて評価します。 定数同士の演算は生成時に畳み込みます。 {@link #toString()} は
 * {@link ExpressionParser} で再解析できる形式です。
 * </p>
 */
public abstract class Scalar {

    /**
     * 定数 0 です。
     */
    public static final Scalar ZERO = new Constant(0.0);

    /**
     * 定数 1 です。
     */
    public static final Scalar ONE = new Constant(1.0);

    private static final int PREC_SUM = 1;
    private static final int PREC_PRODUCT = 2;
    private static final int PREC_POWER = 3;
    private static final int PREC_ATOM = 4;

    Scalar() {}

    /**
     * 定数を生成します。
     *
     * @param value 値です（有限値）
     * @return 定数です
     * @throws IllegalArgumentException value が有限値でない場合に発生します
     */
    public static Scalar constant(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value は有限値が必要です: " + value);
        }
        if (value == 0.0) {
            return ZERO;
        }
        if (value == 1.0) {
            return ONE;
        }
        return new Constant(value);
    }

    /**
     * パラメータ記号を生成します。
     *
     * @param name 記号名です
     * @return 記号です
     */
    public static Scalar symbol(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name は空不可です");
        }
        return new Symbol(name);
    }

    /**
     * 関数を適用します（sqrt, cos, sin, exp）。
     *
     * @param function 関数名です
     * @param argument 引数です
     * @return 関数適用結果です
     * @throws IllegalArgumentException 未対応の関数名の場合に発生します
     */
    public static Scalar apply(String function, Scalar argument) {
        Function f = new Function(function, argument);
        if (argument.isConstant()) {
            return constant(f.evaluate(name -> {
                throw new IllegalStateException("定数式に記号があります: " + name);
            }));
        }
        return f;
    }

    /**
     * 式を評価します。
     *
     * @param values パラメータ名から値を返す関数です
     * @return 評価値です
     */
    public abstract double evaluate(ToDoubleFunction<String> values);

    abstract void collectSymbols(Set<String> out);

    abstract int precedence();

    /**
     * 式に含まれる記号名の集合を返します。
     *
     * @return 記号名の集合（昇順）です
     */
    public Set<String> symbols() {
        Set<String> out = new TreeSet<>();
        collectSymbols(out);
        return out;
    }

    /**
     * 定数かどうかを返します。
     *
     * @return 定数なら true です
     */
    public boolean isConstant() {
        return false;
    }

    /**
     * 定数値を返します。
     *
     * @return 定数値です
     * @throws IllegalStateException 定数でない場合に発生します
     */
    public double constantValue() {
        throw new IllegalStateException("定数ではありません: " + this);
    }

    public Scalar plus(Scalar other) {
        if (isConstant() && other.isConstant()) {
            return constant(constantValue() + other.constantValue());
        }
        if (isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        return new Sum(this, other);
    }

    public Scalar minus(Scalar other) {
        return plus(other.negate());
    }

    public Scalar negate() {
        return constant(-1.0).times(this);
    }

    public Scalar times(Scalar other) {
        if (isConstant() && other.isConstant()) {
            return constant(constantValue() * other.constantValue());
        }
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        if (isOne()) {
            return other;
        }
        if (other.isOne()) {
            return this;
        }
        return new Product(this, other);
    }

    /**
     * 商を返します。
     *
     * @param other 除数です
     * @return this / other です
     * @throws ArithmeticException 定数 0 で割った場合に発生します
     */
    public Scalar divide(Scalar other) {
        if (other.isZero()) {
            throw new ArithmeticException("0 で除算しました: " + this + " / 0");
        }
        if (isConstant() && other.isConstant()) {
            return constant(constantValue() / other.constantValue());
        }
        if (other.isOne()) {
            return this;
        }
        return new Quotient(this, other);
    }

    public Scalar pow(Scalar exponent) {
        if (isConstant() && exponent.isConstant()) {
            return constant(Math.pow(constantValue(), exponent.constantValue()));
        }
        if (exponent.isOne()) {
            return this;
        }
        return new Power(this, exponent);
    }

    boolean isZero() {
        return isConstant() && constantValue() == 0.0;
    }

    boolean isOne() {
        return isConstant() && constantValue() == 1.0;
    }

    /**
     * 優先順位に応じて括弧を付けた文字列を返します。
     */
    String render(int contextPrecedence) {
        String s = toString();
        return (precedence() < contextPrecedence) ? "(" + s + ")" : s;
    }

    @Override
    public boolean equals(Object obj) {
        return (obj instanceof Scalar) && toString().equals(obj.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
     * 数値定数です。
     */
    static final class Constant extends Scalar {

        private final double value;

        Constant(double value) {
            this.value = value;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            return value;
        }

        @Override
        void collectSymbols(Set<String> out) {}

        @Override
        int precedence() {
            // 負の定数は単項マイナスとして常に括弧で囲みます。
            return (value < 0.0) ? 0 : PREC_ATOM;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public double constantValue() {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * パラメータ記号です。
     */
    static final class Symbol extends Scalar {

        private final String name;

        Symbol(String name) {
            this.name = name;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            return values.applyAsDouble(name);
        }

        @Override
        void collectSymbols(Set<String> out) {
            out.add(name);
        }

        @Override
        int precedence() {
            return PREC_ATOM;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static final class Sum extends Scalar {

        private final Scalar left;

        private final Scalar right;

        Sum(Scalar left, Scalar right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            return left.evaluate(values) + right.evaluate(values);
        }

        @Override
        void collectSymbols(Set<String> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        int precedence() {
            return PREC_SUM;
        }

        @Override
        public String toString() {
            return left.render(PREC_SUM) + " + " + right.render(PREC_SUM);
        }
    }

    static final class Product extends Scalar {

        private final Scalar left;

        private final Scalar right;

        Product(Scalar left, Scalar right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            return left.evaluate(values) * right.evaluate(values);
        }

        @Override
        void collectSymbols(Set<String> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        int precedence() {
            return PREC_PRODUCT;
        }

        @Override
        public String toString() {
            return left.render(PREC_PRODUCT) + "*" + right.render(PREC_POWER);
        }
    }

    static final class Quotient extends Scalar {

        private final Scalar numerator;

        private final Scalar denominator;

        Quotient(Scalar numerator, Scalar denominator) {
            this.numerator = numerator;
            this.denominator = denominator;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            return numerator.evaluate(values) / denominator.evaluate(values);
        }

        @Override
        void collectSymbols(Set<String> out) {
            numerator.collectSymbols(out);
            denominator.collectSymbols(out);
        }

        @Override
        int precedence() {
            return PREC_PRODUCT;
        }

        @Override
        public String toString() {
            return numerator.render(PREC_PRODUCT) + "/" + denominator.render(PREC_POWER);
        }
    }

    static final class Power extends Scalar {

        private final Scalar base;

        private final Scalar exponent;

        Power(Scalar base, Scalar exponent) {
            this.base = base;
            this.exponent = exponent;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            return Math.pow(base.evaluate(values), exponent.evaluate(values));
        }

        @Override
        void collectSymbols(Set<String> out) {
            base.collectSymbols(out);
            exponent.collectSymbols(out);
        }

        @Override
        int precedence() {
            return PREC_POWER;
        }

        @Override
        public String toString() {
            return base.render(PREC_ATOM) + "^" + exponent.render(PREC_ATOM);
        }
    }

    static final class Function extends Scalar {

        private final String name;

        private final Scalar argument;

        Function(String name, Scalar argument) {
            String lower = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
            switch (lower) {
                case "sqrt":
                case "cos":
                case "sin":
                case "exp":
                    break;
                default:
                    throw new IllegalArgumentException("未対応の関数です: " + name);
            }
            this.name = lower;
            this.argument = argument;
        }

        @Override
        public double evaluate(ToDoubleFunction<String> values) {
            double x = argument.evaluate(values);
            switch (name) {
                case "sqrt":
                    return Math.sqrt(x);
                case "cos":
                    return Math.cos(x);
                case "sin":
                    return Math.sin(x);
                default:
                    return Math.exp(x);
            }
        }

        @Override
        void collectSymbols(Set<String> out) {
            argument.collectSymbols(out);
        }

        @Override
        int precedence() {
            return PREC_ATOM;
        }

        @Override
        public String toString() {
            return name + "(" + argument + ")";
        }
    }
}
