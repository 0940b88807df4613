package io.github.yok.scq.core.symbolic;

import io.github.yok.scq.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 記号ハミルトニアンを分類するユーティリティです。
 *
 * <p>
 * 記号名のパターンから外部磁束（Φ<i>）・オフセット電荷（ng<i>）・変数分類を求め、 項を運動エネルギー項とポテンシャル項に分け、
 * 純調和（厳密な二次形式）かどうかを判定します。
 * </p>
 */
@Slf4j
public final class ExpressionClassifier {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    private static final Pattern EXTERNAL_FLUX = Pattern.compile("^Φ\\d+$");

    private static final Pattern OFFSET_CHARGE = Pattern.compile("^ng\\d+$");

    private ExpressionClassifier() {}

    /**
     * 記号名の末尾の番号を返します。
     *
     * @param name 記号名です
     * @return 末尾の番号です（なければ空）
     */
    public static OptionalInt trailingNumber(String name) {
        Matcher m = TRAILING_NUMBER.matcher(name);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /**
     * 外部磁束の記号名を番号順に返します。
     *
     * @param expression 記号ハミルトニアンです
     * @return 外部磁束の記号名です
     */
    public static List<String> externalFluxes(Expression expression) {
        return matching(expression, "Φ", EXTERNAL_FLUX);
    }

    /**
     * オフセット電荷の記号名を番号順に返します。
     *
     * @param expression 記号ハミルトニアンです
     * @return オフセット電荷の記号名です
     */
    public static List<String> offsetCharges(Expression expression) {
        return matching(expression, "ng", OFFSET_CHARGE);
    }

    private static List<String> matching(Expression expression, String prefix, Pattern pattern) {
        List<String> out = new ArrayList<>();
        for (String name : expression.parameterSymbols()) {
            if (pattern.matcher(name).matches()) {
                out.add(name);
            } else if (name.startsWith(prefix)) {
                log.debug("番号のない記号名のため分類から除外します: name={}", name);
            }
        }
        out.sort(Comparator.comparingInt(n -> trailingNumber(n).getAsInt()));
        return out;
    }

    /**
     * 演算子記号から変数分類を求めます。
     *
     * <p>
     * n<i> を持つ変数は周期変数、Q<i> を持つ変数は拡張変数、θ<i> だけが現れる変数は凍結変数です。
     * </p>
     *
     * @param expression 記号ハミルトニアンです
     * @return 変数分類です
     * @throws ConfigurationException 同じ変数に n と Q が現れる場合に発生します
     */
    public static VariableCategories categorize(Expression expression) {
        Set<Integer> periodic = new TreeSet<>();
        Set<Integer> extended = new TreeSet<>();
        Set<Integer> all = new TreeSet<>();
        for (OperatorSymbol s : expression.operatorSymbols()) {
            all.add(s.getIndex());
            if (s.getKind() == OperatorSymbol.Kind.CHARGE) {
                periodic.add(s.getIndex());
            } else if (s.getKind() == OperatorSymbol.Kind.EXTENDED_CHARGE) {
                extended.add(s.getIndex());
            }
        }
        for (Integer i : periodic) {
            if (extended.contains(i)) {
                throw new ConfigurationException("変数 " + i + " に n と Q の両方が現れています");
            }
        }
        Set<Integer> frozen = new TreeSet<>(all);
        frozen.removeAll(periodic);
        frozen.removeAll(extended);

        EnumMap<VariableCategory, Set<Integer>> map = new EnumMap<>(VariableCategory.class);
        map.put(VariableCategory.PERIODIC, periodic);
        map.put(VariableCategory.EXTENDED, extended);
        map.put(VariableCategory.FROZEN, frozen);
        return VariableCategories.of(map);
    }

    /**
     * ポテンシャル項かどうかを返します。
     *
     * <p>
     * 位相 θ または外部磁束 Φ を含む項をポテンシャル項とします。
     * </p>
     *
     * @param term 項です
     * @return ポテンシャル項なら true です
     */
    public static boolean isPotentialTerm(Term term) {
        if (!term.getTrigFactors().isEmpty()) {
            return true;
        }
        for (OperatorSymbol s : term.getMonomial().keySet()) {
            if (s.getKind() == OperatorSymbol.Kind.THETA) {
                return true;
            }
        }
        for (String name : term.parameterSymbols()) {
            if (name.contains("θ") || name.contains("Φ")) {
                return true;
            }
        }
        return false;
    }

    /**
     * ポテンシャル項だけからなる式を返します。
     *
     * @param expression 記号ハミルトニアンです
     * @return ポテンシャル部分です
     */
    public static Expression potentialPart(Expression expression) {
        return expression.filter(ExpressionClassifier::isPotentialTerm);
    }

    /**
     * 運動エネルギー項だけからなる式を返します。
     *
     * @param expression 記号ハミルトニアンです
     * @return 運動エネルギー部分です
     */
    public static Expression kineticPart(Expression expression) {
        return expression.filter(t -> !isPotentialTerm(t));
    }

    /**
     * 純調和かどうかを、現在のパラメータ値で数値的に判定します。
     *
     * <p>
     * 周期変数がなく、拡張変数が 1 つ以上あり、 平方完成しても二次形式に含まれない項（三角関数項・3 次以上の項・θ と Q の混合項）の係数の絶対値の和が
     * tolerance 以下のとき純調和とします。
     * </p>
     *
     * @param expression 記号ハミルトニアンです
     * @param categories 変数分類です
     * @param values パラメータ値です
     * @param tolerance 許容誤差（絶対値）です
     * @return 判定結果です
     */
    public static HarmonicCheck checkPurelyHarmonic(Expression expression,
            VariableCategories categories, ToDoubleFunction<String> values, double tolerance) {
        if (!categories.indices(VariableCategory.PERIODIC).isEmpty()
                || !categories.indices(VariableCategory.FROZEN).isEmpty()
                || categories.indices(VariableCategory.EXTENDED).isEmpty()) {
            return new HarmonicCheck(false, Double.POSITIVE_INFINITY);
        }
        double residual = 0.0;
        for (Term t : expression.getTerms()) {
            if (!isQuadraticFormTerm(t)) {
                residual += Math.abs(t.getCoefficient().evaluate(values));
            }
        }
        return new HarmonicCheck(residual <= tolerance, residual);
    }

    /**
     * 平方完成で二次形式に帰着できる項（定数・θ・Q・θθ・QQ）かどうかを返します。
     */
    static boolean isQuadraticFormTerm(Term t) {
        if (!t.getTrigFactors().isEmpty()) {
            return false;
        }
        int degree = t.degree();
        if (degree <= 1) {
            return true;
        }
        if (degree != 2) {
            return false;
        }
        int theta = 0;
        int momentum = 0;
        for (Map.Entry<OperatorSymbol, Integer> e : t.getMonomial().entrySet()) {
            if (e.getKey().isMomentum()) {
                momentum += e.getValue();
            } else {
                theta += e.getValue();
            }
        }
        return theta == 2 || momentum == 2;
    }

    /**
     * 純調和判定の結果です。
     */
    @Value
    public static class HarmonicCheck {

        /**
         * 純調和なら true です。
         */
        boolean purelyHarmonic;

        /**
         * 二次形式に含まれない項の係数の絶対値の和です。
         */
        double residual;
    }
}
