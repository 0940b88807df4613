package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.basis.HarmonicOscillatorBasis;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import io.github.yok.scq.core.linearalgebra.TensorComposition;
import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.OperatorSymbol;
import io.github.yok.scq.core.symbolic.Term;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.function.ToDoubleFunction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 純調和な系の基準モード分解です。
 *
 * <p>
 * 一次項 b_θ^T θ、 b_Q^T Q は平方完成して θ_0 = -L^{-1} b_θ / 2、 Q_0 = -C^{-1} b_Q / 2 だけずらし、 定数項に
 * (b_θ^T θ_0 + b_Q^T Q_0) / 2 を加えます。 ずらした後の H = Q^T C Q + θ^T L θ + 定数 に対し、 c = C^{1/2} と c L c = U diag(λ) U^T から θ = c U ξ、 Q = c^{-1} U π
 * と変換すると H = Σ (π_k^2 + λ_k ξ_k^2) になります。 各モードは周波数 ω_k = 2√λ_k の調和振動子で、
 * ξ_k = (a + a†)/√ω_k、 π_k = i (√ω_k / 2)(a† - a) です。 ハミルトニアンは基準モードの数基底で対角になります。
 * </p>
 */
@Getter
@Slf4j
final class HarmonicNormalModes {

    /**
     * 変数番号（昇順）です。
     */
    private final List<Integer> variables;

    /**
     * 各モードの次元です。
     */
    private final int[] modeDims;

    /**
     * 基準モード周波数です。
     */
    private final double[] frequencies;

    /**
     * 定数項です。
     */
    private final double constant;

    /**
     * θ = θ_0 + S ξ の変換行列 S です。
     */
    private final DMatrixRMaj thetaTransform;

    /**
     * Q = Q_0 + R π の変換行列 R です。
     */
    private final DMatrixRMaj chargeTransform;

    /**
     * 平方完成による θ の中心 θ_0 です。
     */
    private final double[] thetaOffset;

    /**
     * 平方完成による Q の中心 Q_0 です。
     */
    private final double[] chargeOffset;

    /**
     * 固有分解バックエンドです（変位演算子用）。
     */
    private final EigenDecompositionBackend eigenBackend;

    private HarmonicNormalModes(List<Integer> variables, int[] modeDims, double[] frequencies,
            double constant, DMatrixRMaj thetaTransform, DMatrixRMaj chargeTransform,
            double[] thetaOffset, double[] chargeOffset, EigenDecompositionBackend eigenBackend) {
        this.variables = List.copyOf(variables);
        this.modeDims = modeDims.clone();
        this.frequencies = frequencies;
        this.constant = constant;
        this.thetaTransform = thetaTransform;
        this.chargeTransform = chargeTransform;
        this.thetaOffset = thetaOffset;
        this.chargeOffset = chargeOffset;
        this.eigenBackend = eigenBackend;
    }

    /**
     * 二次形式の係数から基準モードを求めます。
     *
     * @param expression 純調和な記号ハミルトニアンです
     * @param variables 拡張変数の番号（昇順）です
     * @param modeDims 各モードの次元です
     * @param values パラメータ値です
     * @param eigenBackend 固有分解バックエンドです
     * @return 基準モードです（運動エネルギー行列が正定値でない、 またはポテンシャルが正定値でない場合は null）
     */
    static HarmonicNormalModes solve(Expression expression, List<Integer> variables, int[] modeDims,
            ToDoubleFunction<String> values, EigenDecompositionBackend eigenBackend) {
        int m = variables.size();
        DMatrixRMaj kinetic = new DMatrixRMaj(m, m);
        DMatrixRMaj potential = new DMatrixRMaj(m, m);
        double[] linearTheta = new double[m];
        double[] linearCharge = new double[m];
        double constant = 0.0;

        // 定数項・一次項・二次項の係数を行列に振り分けます。
        for (Term t : expression.getTerms()) {
            if (!t.getTrigFactors().isEmpty()) {
                continue;
            }
            double c = t.getCoefficient().evaluate(values);
            if (t.degree() == 0) {
                constant += c;
                continue;
            }
            if (t.degree() == 1) {
                OperatorSymbol symbol = t.getMonomial().keySet().iterator().next();
                double[] linear = symbol.isMomentum() ? linearCharge : linearTheta;
                linear[variables.indexOf(symbol.getIndex())] += c;
                continue;
            }
            if (t.degree() != 2) {
                continue;
            }
            // 二次項は対称行列の成分として、 非対角は半分ずつ加えます。
            List<OperatorSymbol> symbols = new ArrayList<>();
            for (Map.Entry<OperatorSymbol, Integer> e : t.getMonomial().entrySet()) {
                for (int k = 0; k < e.getValue(); k++) {
                    symbols.add(e.getKey());
                }
            }
            OperatorSymbol s0 = symbols.get(0);
            OperatorSymbol s1 = symbols.get(1);
            if (s0.isMomentum() != s1.isMomentum()) {
                continue;
            }
            DMatrixRMaj target = s0.isMomentum() ? kinetic : potential;
            int i = variables.indexOf(s0.getIndex());
            int j = variables.indexOf(s1.getIndex());
            if (i == j) {
                target.add(i, i, c);
            } else {
                target.add(i, j, 0.5 * c);
                target.add(j, i, 0.5 * c);
            }
        }

        // c = C^{1/2} と c^{-1} を求めます。
        EigenDecompositionResult ce = eigenBackend.decomposeSymmetricAndSort(kinetic);
        double[] mu = ce.getEigenvalues();
        if (!(mu[0] > 0.0)) {
            log.warn("運動エネルギー行列が正定値でないため基準モード分解を行いません: min={}", fmt5(mu[0]));
            return null;
        }
        double[] sqrtMu = new double[m];
        double[] invSqrtMu = new double[m];
        for (int k = 0; k < m; k++) {
            sqrtMu[k] = Math.sqrt(mu[k]);
            invSqrtMu[k] = 1.0 / sqrtMu[k];
        }
        DMatrixRMaj w = ce.getEigenvectors();
        DMatrixRMaj sqrtC = similarity(w, sqrtMu);
        DMatrixRMaj invSqrtC = similarity(w, invSqrtMu);

        // c L c = U diag(λ) U^T を求めます。
        DMatrixRMaj tmp = new DMatrixRMaj(m, m);
        DMatrixRMaj clc = new DMatrixRMaj(m, m);
        CommonOps_DDRM.mult(sqrtC, potential, tmp);
        CommonOps_DDRM.mult(tmp, sqrtC, clc);
        symmetrize(clc);
        EigenDecompositionResult le = eigenBackend.decomposeSymmetricAndSort(clc);
        double[] lambda = le.getEigenvalues();
        if (!(lambda[0] > 0.0)) {
            log.warn("ポテンシャルが正定値でないため基準モード分解を行いません: min={}", fmt5(lambda[0]));
            return null;
        }

        // 周波数と変換行列 S = c U、 R = c^{-1} U を求めます。
        double[] omega = new double[m];
        for (int k = 0; k < m; k++) {
            omega[k] = 2.0 * Math.sqrt(lambda[k]);
        }
        DMatrixRMaj u = le.getEigenvectors();
        DMatrixRMaj s = new DMatrixRMaj(m, m);
        DMatrixRMaj r = new DMatrixRMaj(m, m);
        CommonOps_DDRM.mult(sqrtC, u, s);
        CommonOps_DDRM.mult(invSqrtC, u, r);

        // 一次項を平方完成します。 L^{-1} = S diag(1/λ) S^T、 C^{-1} = c^{-1} c^{-1} です。
        double[] invLambda = new double[m];
        for (int k = 0; k < m; k++) {
            invLambda[k] = 1.0 / lambda[k];
        }
        DMatrixRMaj invPotential = new DMatrixRMaj(m, m);
        DMatrixRMaj scaled = new DMatrixRMaj(m, m);
        CommonOps_DDRM.mult(s, diagonal(invLambda), scaled);
        CommonOps_DDRM.multTransB(scaled, s, invPotential);
        DMatrixRMaj invKinetic = new DMatrixRMaj(m, m);
        CommonOps_DDRM.mult(invSqrtC, invSqrtC, invKinetic);
        double[] thetaOffset = center(invPotential, linearTheta);
        double[] chargeOffset = center(invKinetic, linearCharge);
        for (int k = 0; k < m; k++) {
            constant += 0.5 * (linearTheta[k] * thetaOffset[k] + linearCharge[k] * chargeOffset[k]);
        }

        return new HarmonicNormalModes(variables, modeDims, omega, constant, s, r, thetaOffset,
                chargeOffset, eigenBackend);
    }

    /**
     * 空間の次元（各モードの次元の積）を返します。
     *
     * @return 次元です
     */
    int dimension() {
        int d = 1;
        for (int k : modeDims) {
            d *= k;
        }
        return d;
    }

    /**
     * 数基底（モード 1 が最上位の添字）の各状態のエネルギーを返します。
     *
     * @return エネルギーの配列です
     */
    double[] energies() {
        int dim = dimension();
        double[] e = new double[dim];
        int[] occupation = new int[modeDims.length];
        for (int state = 0; state < dim; state++) {
            double sum = constant;
            for (int k = 0; k < modeDims.length; k++) {
                sum += frequencies[k] * (occupation[k] + 0.5);
            }
            e[state] = sum;
            // 最下位のモードから繰り上げます。
            for (int k = modeDims.length - 1; k >= 0; k--) {
                occupation[k]++;
                if (occupation[k] < modeDims[k]) {
                    break;
                }
                occupation[k] = 0;
            }
        }
        return e;
    }

    /**
     * 変数 i の θ_i = θ_0i + Σ_k S_ik ξ_k を返します。
     */
    private ComplexMatrix thetaOf(int variable) {
        int i = variables.indexOf(variable);
        ComplexMatrix sum =
                ComplexMatrix.identity(dimension(), MatrixType.DENSE).scale(thetaOffset[i]);
        for (int k = 0; k < modeDims.length; k++) {
            ComplexMatrix a = HarmonicOscillatorBasis.annihilation(modeDims[k], MatrixType.DENSE);
            ComplexMatrix xi = a.plus(a.dagger()).scale(1.0 / Math.sqrt(frequencies[k]));
            sum = sum.plus(wrap(xi, k).scale(thetaTransform.get(i, k)));
        }
        return sum;
    }

    /**
     * 変数 i の Q_i = Q_0i + Σ_k R_ik π_k を返します。
     */
    private ComplexMatrix chargeOf(int variable) {
        int i = variables.indexOf(variable);
        ComplexMatrix sum =
                ComplexMatrix.identity(dimension(), MatrixType.DENSE).scale(chargeOffset[i]);
        for (int k = 0; k < modeDims.length; k++) {
            ComplexMatrix a = HarmonicOscillatorBasis.annihilation(modeDims[k], MatrixType.DENSE);
            ComplexMatrix pi = a.dagger().minus(a).scale(0.0, 0.5 * Math.sqrt(frequencies[k]));
            sum = sum.plus(wrap(pi, k).scale(chargeTransform.get(i, k)));
        }
        return sum;
    }

    private ComplexMatrix wrap(ComplexMatrix op, int mode) {
        List<Integer> dims = new ArrayList<>();
        for (int d : modeDims) {
            dims.add(d);
        }
        return TensorComposition.identityWrap(op, mode, dims, MatrixType.DENSE);
    }

    /**
     * 局所演算子の積を基準モードの数基底で返します。
     *
     * @param factors 変数番号 → 局所演算子です
     * @return 演算子（密行列）です
     */
    ComplexMatrix product(SortedMap<Integer, LocalFactor> factors) {
        ComplexMatrix result = ComplexMatrix.identity(dimension(), MatrixType.DENSE);
        for (Map.Entry<Integer, LocalFactor> e : factors.entrySet()) {
            LocalFactor f = e.getValue();
            ComplexMatrix theta = thetaOf(e.getKey());
            if (f.getThetaPower() > 0) {
                result = result.times(theta.power(f.getThetaPower()));
            }
            if (f.getDisplacement() != 0.0) {
                result = result.times(exponential(theta, f.getDisplacement()));
            }
            if (f.getMomentumPower() > 0) {
                result = result.times(chargeOf(e.getKey()).power(f.getMomentumPower()));
            }
        }
        return result;
    }

    /**
     * e^{i a θ} を θ のスペクトル分解から求めます。
     */
    private ComplexMatrix exponential(ComplexMatrix theta, double a) {
        EigenDecompositionResult eig = eigenBackend.decomposeSymmetricAndSort(theta.realPart());
        double[] x = eig.getEigenvalues();
        double[] re = new double[x.length];
        double[] im = new double[x.length];
        for (int k = 0; k < x.length; k++) {
            re[k] = Math.cos(a * x[k]);
            im[k] = Math.sin(a * x[k]);
        }
        ComplexMatrix v = ComplexMatrix.dense(eig.getEigenvectors(), null);
        return v.times(ComplexMatrix.diagonal(re, im, MatrixType.DENSE)).times(v.dagger());
    }

    /**
     * 二次形式の中心 -A^{-1} b / 2 を返します。
     */
    private static double[] center(DMatrixRMaj inverse, double[] linear) {
        int m = linear.length;
        double[] x = new double[m];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < m; j++) {
                x[i] -= 0.5 * inverse.get(i, j) * linear[j];
            }
        }
        return x;
    }

    private static DMatrixRMaj diagonal(double[] diag) {
        int m = diag.length;
        DMatrixRMaj d = new DMatrixRMaj(m, m);
        for (int k = 0; k < m; k++) {
            d.set(k, k, diag[k]);
        }
        return d;
    }

    private static DMatrixRMaj similarity(DMatrixRMaj w, double[] diag) {
        int m = diag.length;
        DMatrixRMaj d = diagonal(diag);
        DMatrixRMaj tmp = new DMatrixRMaj(m, m);
        DMatrixRMaj out = new DMatrixRMaj(m, m);
        CommonOps_DDRM.mult(w, d, tmp);
        CommonOps_DDRM.multTransB(tmp, w, out);
        return out;
    }

    private static void symmetrize(DMatrixRMaj a) {
        for (int i = 0; i < a.numRows; i++) {
            for (int j = i + 1; j < a.numCols; j++) {
                double v = 0.5 * (a.get(i, j) + a.get(j, i));
                a.set(i, j, v);
                a.set(j, i, v);
            }
        }
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    @Override
    public String toString() {
        return "HarmonicNormalModes[variables=" + variables + ", ω=" + Arrays.toString(frequencies) + "]";
    }
}
