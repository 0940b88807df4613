package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.OperatorSymbol;
import io.github.yok.scq.core.symbolic.Term;
import io.github.yok.scq.core.symbolic.TrigFactor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * 記号式にパラメータ値と演算子行列を代入して数値行列を組み立てるクラスです。
 *
 * <p>
 * 三角関数因子は cos x = (e^{ix} + e^{-ix})/2、 sin x = (e^{ix} - e^{-ix})/(2i) で変位演算子の積に書き換え、 各項を変数ごとの
 * {@link LocalFactor} の積（プレースホルダ）にしてから行列へ置き換えます。 同じプレースホルダの行列は 1 回の構築の中で 1 度だけ生成します。
 * </p>
 */
@Slf4j
final class NumericHamiltonianBuilder {

    /**
     * パラメータ値です。
     */
    private final ToDoubleFunction<String> values;

    /**
     * 演算子を組み立てる系です。
     */
    private final OperatorSpace space;

    /**
     * プレースホルダ → 行列のキャッシュです（構築 1 回分）。
     */
    private final Map<String, ComplexMatrix> placeholders = new HashMap<>();

    private int lookups;

    NumericHamiltonianBuilder(ToDoubleFunction<String> values, OperatorSpace space) {
        this.values = values;
        this.space = space;
    }

    /**
     * 式を数値行列にします。
     *
     * @param expression 記号式です
     * @return 行列です
     */
    ComplexMatrix build(Expression expression) {
        int dim = space.dimension();
        ComplexMatrix sum = ComplexMatrix.zeros(dim, dim, space.matrixType());
        for (Term term : expression.getTerms()) {
            double c = term.getCoefficient().evaluate(values);
            if (c == 0.0) {
                continue;
            }
            for (Displaced d : expandTrig(term)) {
                ComplexMatrix op = placeholder(factorsOf(term, d.shifts));
                sum = sum.plus(op.scale(c * d.re, c * d.im));
            }
        }
        log.debug("数値ハミルトニアンを構築しました: dim={}, placeholders={}, lookups={}", dim,
                placeholders.size(), lookups);
        return sum;
    }

    private ComplexMatrix placeholder(SortedMap<Integer, LocalFactor> factors) {
        lookups++;
        String key = factors.toString();
        ComplexMatrix cached = placeholders.get(key);
        if (cached == null) {
            cached = space.product(factors);
            placeholders.put(key, cached);
        }
        return cached;
    }

    /**
     * 項の単項式と変位から変数ごとの局所演算子を作ります。
     */
    private static SortedMap<Integer, LocalFactor> factorsOf(Term term, Map<Integer, Double> shifts) {
        SortedMap<Integer, LocalFactor> out = new TreeMap<>();
        for (Integer i : term.variables()) {
            int p = term.power(OperatorSymbol.theta(i));
            int q = term.power(OperatorSymbol.charge(i)) + term.power(OperatorSymbol.extendedCharge(i));
            double a = shifts.getOrDefault(i, 0.0);
            LocalFactor f = new LocalFactor(p, a, q);
            if (!f.isIdentity()) {
                out.put(i, f);
            }
        }
        return out;
    }

    /**
     * 三角関数因子を変位演算子の線形結合に展開します。
     */
    private List<Displaced> expandTrig(Term term) {
        List<Displaced> combos = new ArrayList<>();
        combos.add(new Displaced(1.0, 0.0, new TreeMap<>()));
        for (TrigFactor f : term.getTrigFactors()) {
            double phase = f.getPhase().evaluate(values);
            double cos = Math.cos(phase);
            double sin = Math.sin(phase);
            // e^{+i(x+φ)} と e^{-i(x+φ)} の重みです。
            double plusRe;
            double plusIm;
            double minusRe;
            double minusIm;
            if (f.getKind() == TrigFactor.Kind.COS) {
                plusRe = 0.5 * cos;
                plusIm = 0.5 * sin;
                minusRe = 0.5 * cos;
                minusIm = -0.5 * sin;
            } else {
                // -i/2 e^{iφ} と i/2 e^{-iφ} です。
                plusRe = 0.5 * sin;
                plusIm = -0.5 * cos;
                minusRe = 0.5 * sin;
                minusIm = 0.5 * cos;
            }
            List<Displaced> next = new ArrayList<>();
            for (Displaced d : combos) {
                next.add(d.times(plusRe, plusIm, f.getCoefficients(), 1.0));
                next.add(d.times(minusRe, minusIm, f.getCoefficients(), -1.0));
            }
            combos = next;
        }
        return combos;
    }

    /**
     * 複素重みと変数ごとの変位の組です。
     */
    private static final class Displaced {

        private final double re;

        private final double im;

        private final Map<Integer, Double> shifts;

        Displaced(double re, double im, Map<Integer, Double> shifts) {
            this.re = re;
            this.im = im;
            this.shifts = shifts;
        }

        Displaced times(double wRe, double wIm, Map<Integer, Double> coefficients, double sign) {
            Map<Integer, Double> s = new TreeMap<>(shifts);
            coefficients.forEach((i, a) -> s.merge(i, sign * a, Double::sum));
            return new Displaced(re * wRe - im * wIm, re * wIm + im * wRe, s);
        }
    }
}
