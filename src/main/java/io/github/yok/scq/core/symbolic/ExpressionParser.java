package io.github.yok.scq.core.symbolic;

import io.github.yok.scq.core.exception.ExpressionParseException;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * ハミルトニアン文字列を {@link Expression} に変換する再帰下降パーサです。
 *
 * <p>
 * 文法は次のとおりです（{@code ^} と {@code **} は同じ意味で右結合です）。
 * </p>
 *
 * <pre>
 * sum     := product (('+' | '-') product)*
 * product := unary (('*' | '/') unary)*
 * unary   := ('+' | '-') unary | power
 * power   := primary (('^' | '**') unary)?
 * primary := number | name | name '(' sum ')' | '(' sum ')'
 * </pre>
 *
 * <p>
 * θ<i>, n<i>, Q<i> は演算子記号、pi と π は円周率、それ以外の名前はパラメータ記号です。 cos, sin の引数が θ を含む場合は
 * θ について線形（数値係数）である必要があります。
 * </p>
 */
public final class ExpressionParser {

    /**
     * 解析対象の文字列です。
     */
    private final String text;

    /**
     * 現在位置です。
     */
    private int pos;

    private ExpressionParser(String text) {
        this.text = text;
    }

    /**
     * 文字列を解析して式を返します。
     *
     * @param text ハミルトニアン文字列です
     * @return 式です
     * @throws ExpressionParseException 構文が不正な場合に発生します
     */
    public static Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException(0, "式が空です");
        }
        ExpressionParser parser = new ExpressionParser(text);
        Expression result = parser.parseSum();
        parser.skipSpaces();
        if (parser.pos < text.length()) {
            throw new ExpressionParseException(parser.pos,
                    "解釈できない文字があります: '" + text.charAt(parser.pos) + "'");
        }
        return result;
    }

    private Expression parseSum() {
        Expression left = parseProduct();
        while (true) {
            if (accept("+")) {
                left = left.plus(parseProduct());
            } else if (accept("-")) {
                left = left.minus(parseProduct());
            } else {
                return left;
            }
        }
    }

    private Expression parseProduct() {
        Expression left = parseUnary();
        while (true) {
            skipSpaces();
            if (peek("**")) {
                return left;
            }
            if (accept("*")) {
                left = left.times(parseUnary());
            } else if (accept("/")) {
                int at = pos;
                Expression divisor = parseUnary();
                if (!divisor.isScalar()) {
                    throw new ExpressionParseException(at, "演算子で割ることはできません: " + divisor);
                }
                Scalar d = divisor.asScalar();
                if (d.isZero()) {
                    throw new ExpressionParseException(at, "0 で割っています");
                }
                left = left.divide(d);
            } else {
                return left;
            }
        }
    }

    private Expression parseUnary() {
        if (accept("-")) {
            return parseUnary().negate();
        }
        if (accept("+")) {
            return parseUnary();
        }
        return parsePower();
    }

    private Expression parsePower() {
        Expression base = parsePrimary();
        if (accept("**") || accept("^")) {
            int at = pos;
            Expression exponent = parseUnary();
            if (!exponent.isScalar()) {
                throw new ExpressionParseException(at, "指数に演算子は使えません: " + exponent);
            }
            Scalar e = exponent.asScalar();
            if (base.isScalar()) {
                return Expression.scalar(base.asScalar().pow(e));
            }
            if (!e.isConstant() || e.constantValue() < 0 || e.constantValue() != Math.rint(e.constantValue())) {
                throw new ExpressionParseException(at, "演算子の指数は 0 以上の整数が必要です: " + e);
            }
            return base.pow((int) e.constantValue());
        }
        return base;
    }

    private Expression parsePrimary() {
        skipSpaces();
        if (pos >= text.length()) {
            throw new ExpressionParseException(pos, "式が途中で終わっています");
        }
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            Expression inner = parseSum();
            expect(")");
            return inner;
        }
        if (Character.isDigit(c) || c == '.') {
            return Expression.scalar(Scalar.constant(parseNumber()));
        }
        if (Character.isLetter(c)) {
            int start = pos;
            String name = parseName();
            skipSpaces();
            if (pos < text.length() && text.charAt(pos) == '(') {
                pos++;
                Expression argument = parseSum();
                expect(")");
                return applyFunction(start, name, argument);
            }
            if (name.equals("pi") || name.equals("π")) {
                return Expression.scalar(Scalar.constant(Math.PI));
            }
            Optional<OperatorSymbol> op = OperatorSymbol.parse(name);
            if (op.isPresent()) {
                return Expression.operator(op.get());
            }
            return Expression.scalar(Scalar.symbol(name));
        }
        throw new ExpressionParseException(pos, "予期しない文字です: '" + c + "'");
    }

    private Expression applyFunction(int at, String name, Expression argument) {
        if (argument.isScalar()) {
            switch (name) {
                case "cos":
                case "sin":
                case "sqrt":
                case "exp":
                    return Expression.scalar(Scalar.apply(name, argument.asScalar()));
                default:
                    throw new ExpressionParseException(at, "未対応の関数です: " + name);
            }
        }
        TrigFactor.Kind kind;
        if (name.equals("cos")) {
            kind = TrigFactor.Kind.COS;
        } else if (name.equals("sin")) {
            kind = TrigFactor.Kind.SIN;
        } else {
            throw new ExpressionParseException(at, "関数 " + name + " の引数に演算子は使えません");
        }

        // 引数を θ の線形結合（数値係数）と位相に分けます。
        Map<Integer, Double> coefficients = new TreeMap<>();
        Scalar phase = Scalar.ZERO;
        for (Term t : argument.getTerms()) {
            if (t.isScalar()) {
                phase = phase.plus(t.getCoefficient());
                continue;
            }
            Map<OperatorSymbol, Integer> m = t.getMonomial();
            boolean linearTheta = t.getTrigFactors().isEmpty() && m.size() == 1
                    && m.values().iterator().next() == 1
                    && m.keySet().iterator().next().getKind() == OperatorSymbol.Kind.THETA;
            if (!linearTheta || !t.getCoefficient().isConstant()) {
                throw new ExpressionParseException(at,
                        "三角関数の引数は θ の数値係数による線形結合が必要です: " + argument);
            }
            coefficients.merge(m.keySet().iterator().next().getIndex(),
                    t.getCoefficient().constantValue(), Double::sum);
        }
        return Expression.trig(new TrigFactor(kind, coefficients, phase));
    }

    private double parseNumber() {
        int start = pos;
        while (pos < text.length()
                && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        try {
            return Double.parseDouble(text.substring(start, pos));
        } catch (NumberFormatException e) {
            throw new ExpressionParseException(start, "数値として解釈できません: " + text.substring(start, pos));
        }
    }

    private String parseName() {
        int start = pos;
        pos++;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos))
                || text.charAt(pos) == '_')) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean peek(String token) {
        skipSpaces();
        return text.startsWith(token, pos);
    }

    private boolean accept(String token) {
        if (peek(token)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token)) {
            throw new ExpressionParseException(pos, "'" + token + "' が必要です");
        }
    }
}
