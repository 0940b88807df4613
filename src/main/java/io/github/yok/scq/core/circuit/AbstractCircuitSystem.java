package io.github.yok.scq.core.circuit;

import com.google.common.base.Preconditions;
import io.github.yok.scq.core.basis.BasisOperatorFactory;
import io.github.yok.scq.core.basis.ExtBasis;
import io.github.yok.scq.core.basis.HarmonicOscillatorBasis;
import io.github.yok.scq.core.basis.VariableBasis;
import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.exception.StructuralSyncException;
import io.github.yok.scq.core.exception.ValidationException;
import io.github.yok.scq.core.hierarchy.HierarchyNode;
import io.github.yok.scq.core.hierarchy.SystemHierarchy;
import io.github.yok.scq.core.hierarchy.TruncationSpec;
import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend.HermitianEigenResult;
import io.github.yok.scq.core.linearalgebra.EjmlHermitianEigenDecompositionBackend;
import io.github.yok.scq.core.linearalgebra.MatrixType;
import io.github.yok.scq.core.linearalgebra.TensorComposition;
import io.github.yok.scq.core.registry.PropertyRegistry;
import io.github.yok.scq.core.registry.PropertySlot;
import io.github.yok.scq.core.registry.UpdateKind;
import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.ExpressionClassifier;
import io.github.yok.scq.core.symbolic.ExpressionClassifier.HarmonicCheck;
import io.github.yok.scq.core.symbolic.ExpressionParser;
import io.github.yok.scq.core.symbolic.OperatorSymbol;
import io.github.yok.scq.core.symbolic.Term;
import io.github.yok.scq.core.symbolic.TrigFactor;
import io.github.yok.scq.core.symbolic.VariableCategories;
import io.github.yok.scq.core.symbolic.VariableCategory;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * 回路とサブシステムに共通する、記号ハミルトニアンを数値行列として扱う系の基底クラスです。
 *
 * <p>
 * 系は次のいずれかです。
 * </p>
 * <ul>
 * <li>末端の系: 変数ごとの局所基底（または純調和なら基準モード）の上で演算子を組み立てます。</li>
 * <li>階層的対角化を行う系: 子サブシステムの固有基底で打ち切った空間のクロネッカー積の上で演算子を組み立てます。</li>
 * </ul>
 *
 * <p>
 * ハミルトニアンと固有分解は改訂番号（自分と子孫の最大値）ごとにキャッシュし、 パラメータの書き込みで改訂番号が進むと次の要求時に作り直します。
 * </p>
 */
@Slf4j
public abstract class AbstractCircuitSystem implements OperatorSpace, OperatorProvider {

    /**
     * 拡張変数の基底を保持するプロパティ名です。
     */
    public static final String EXT_BASIS = "ext_basis";

    /**
     * 改訂番号の採番元です（全インスタンスで単調増加）。
     */
    private static final AtomicLong REVISIONS = new AtomicLong();

    /**
     * 共有部品です。
     */
    final CircuitContext context;

    /**
     * この系のプロパティです。
     */
    final PropertyRegistry registry = new PropertyRegistry();

    /**
     * 記号ハミルトニアンです。
     */
    Expression hamiltonianSymbolic = Expression.ZERO;

    /**
     * 変数分類です。
     */
    VariableCategories categories = VariableCategories.of(Map.<VariableCategory, List<Integer>>of());

    /**
     * 打ち切り次元です。
     */
    int truncatedDim;

    /**
     * 子の階層です（末端の系では null）。
     */
    SystemHierarchy hierarchy;

    /**
     * 子の打ち切り次元です（末端の系では null）。
     */
    List<TruncationSpec> truncationSpecs;

    /**
     * 子サブシステムです（階層順）。
     */
    List<Subsystem> children = List.of();

    /**
     * 子をまたぐ相互作用項と定数項です。
     */
    Expression interaction = Expression.ZERO;

    /**
     * 変数番号 → 離散化範囲です（未指定の変数は既定値）。
     */
    final Map<Integer, double[]> phiRanges = new TreeMap<>();

    /**
     * 変数番号 → 局所基底です。
     */
    Map<Integer, VariableBasis> bases = Map.of();

    /**
     * 基準モードです（適用しない場合は null）。
     */
    HarmonicNormalModes normalModes;

    /**
     * 直前の局所演算子生成で基準モード分解を適用したかどうかです。
     */
    private Boolean lastFastPath;

    /**
     * 構成状態です。
     */
    LifecycleState state = LifecycleState.UNCONFIGURED;

    private long revision;

    private long hamiltonianStamp = -1;

    private ComplexMatrix cachedHamiltonian;

    private long eigenStamp = -1;

    private HermitianEigenResult cachedEigen;

    AbstractCircuitSystem(CircuitContext context) {
        this.context = context;
        for (UpdateKind kind : UpdateKind.values()) {
            registry.onUpdate(kind, this::onPropertyUpdate);
        }
        registry.addCrossCheck(this::checkCutoffWrite);
    }

    /**
     * ルートからの添字パスを返します（ルートは空）。
     *
     * @return 添字パスです
     */
    public abstract List<Integer> path();

    /**
     * 打ち切り次元の制約を受ける系かどうかを返します。
     */
    abstract boolean isTruncated();

    public Expression getHamiltonianSymbolic() {
        return hamiltonianSymbolic;
    }

    public VariableCategories getCategories() {
        return categories;
    }

    public int getTruncatedDim() {
        return truncatedDim;
    }

    public SystemHierarchy getHierarchy() {
        return hierarchy;
    }

    public List<TruncationSpec> getTruncationSpecs() {
        return truncationSpecs;
    }

    public LifecycleState getState() {
        return state;
    }

    /**
     * 子サブシステムを返します。
     *
     * @return 子サブシステム（階層順、読み取り専用）です
     */
    public List<Subsystem> subsystems() {
        return Collections.unmodifiableList(children);
    }

    /**
     * 階層的対角化を行っているかどうかを返します。
     *
     * @return 子サブシステムを持つ場合は true です
     */
    public boolean isHierarchical() {
        return !children.isEmpty();
    }

    /**
     * 基準モード分解を適用しているかどうかを返します。
     *
     * @return 適用している場合は true です
     */
    public boolean isHarmonicFastPath() {
        return normalModes != null;
    }

    /**
     * 基準モード周波数を返します。
     *
     * @return 周波数です（適用していない場合は空）
     */
    public double[] normalModeFrequencies() {
        return (normalModes != null) ? normalModes.getFrequencies().clone() : new double[0];
    }

    /**
     * プロパティ値を返します。
     *
     * @param name プロパティ名です
     * @return 値です
     * @throws ValidationException 未登録の場合に発生します
     */
    public Object get(String name) {
        return registry.get(name);
    }

    /**
     * プロパティ値を書き込み、依存する子サブシステムへ伝播します。
     *
     * @param name プロパティ名です
     * @param value 値です
     * @throws ValidationException 値が制約を満たさない場合に発生します
     */
    public void set(String name, Object value) {
        registry.set(name, value);
    }

    /**
     * 登録済みのプロパティ名を返します。
     *
     * @return 名前の集合です
     */
    public Set<String> propertyNames() {
        return registry.names();
    }

    long stamp() {
        long s = revision;
        for (Subsystem c : children) {
            s = Math.max(s, c.stamp());
        }
        return s;
    }

    void touch() {
        revision = REVISIONS.incrementAndGet();
    }

    /**
     * 演算子を要求できる状態か確認します。
     *
     * @throws StructuralSyncException 構成済みでない場合に発生します
     */
    void checkInSync() {
        if (state != LifecycleState.CONFIGURED) {
            throw new StructuralSyncException(
                    "再構築が必要です: path=" + path() + ", state=" + state);
        }
    }

    @Override
    public int dimension() {
        int d = 1;
        if (!children.isEmpty()) {
            for (Subsystem c : children) {
                d *= c.getTruncatedDim();
            }
            return d;
        }
        if (normalModes != null) {
            return normalModes.dimension();
        }
        for (VariableBasis b : bases.values()) {
            d *= b.dimension();
        }
        return d;
    }

    /**
     * 打ち切りを 1 つ置き換えたときの末端の系の次元を返します。
     */
    int dimensionWith(String cutoffName, int cutoff) {
        int d = 1;
        for (Integer i : categories.dynamicIndices()) {
            VariableCategory cat = categories.categoryOf(i).orElseThrow();
            String name = BasisOperatorFactory.cutoffName(i, cat);
            int value = name.equals(cutoffName) ? cutoff : registry.getInt(name);
            d *= BasisOperatorFactory.dimensionFor(cat, value);
        }
        return d;
    }

    @Override
    public MatrixType matrixType() {
        if (children.isEmpty() && categories.dynamicIndices().size() == 1) {
            if (normalModes != null) {
                return MatrixType.DENSE;
            }
            boolean extended = !categories.indices(VariableCategory.EXTENDED).isEmpty();
            if (extended && registry.contains(EXT_BASIS)
                    && registry.getExtBasis(EXT_BASIS) == ExtBasis.HARMONIC) {
                return MatrixType.DENSE;
            }
        }
        return MatrixType.SPARSE;
    }

    @Override
    public ComplexMatrix product(SortedMap<Integer, LocalFactor> factors) {
        List<Integer> vars = categories.dynamicIndices();
        for (Integer i : factors.keySet()) {
            if (!vars.contains(i)) {
                throw new ConfigurationException("変数 " + i + " はこの系に含まれません: path=" + path());
            }
        }
        if (!children.isEmpty()) {
            return hierarchicalProduct(factors);
        }
        if (normalModes != null) {
            return normalModes.product(factors);
        }
        // 1 変数の系はクロネッカー積を経由しません。
        if (vars.size() == 1) {
            return localOperator(vars.get(0), factors).as(matrixType());
        }
        List<ComplexMatrix> parts = new ArrayList<>();
        for (Integer i : vars) {
            parts.add(localOperator(i, factors));
        }
        return TensorComposition.kron(parts).as(matrixType());
    }

    private ComplexMatrix localOperator(int variable, SortedMap<Integer, LocalFactor> factors) {
        VariableBasis basis = bases.get(variable);
        LocalFactor f = factors.get(variable);
        if (f == null) {
            return basis.identity();
        }
        return basis.localOperator(f.getThetaPower(), f.getDisplacement(), f.getMomentumPower());
    }

    /**
     * 子ごとに打ち切った演算子を求め、階層順にクロネッカー積で合成します。
     */
    private ComplexMatrix hierarchicalProduct(SortedMap<Integer, LocalFactor> factors) {
        List<ComplexMatrix> parts = new ArrayList<>();
        for (Subsystem c : children) {
            SortedMap<Integer, LocalFactor> sub = new TreeMap<>();
            for (Integer i : c.getCategories().dynamicIndices()) {
                LocalFactor f = factors.get(i);
                if (f != null) {
                    sub.put(i, f);
                }
            }
            parts.add(sub.isEmpty() ? ComplexMatrix.identity(c.getTruncatedDim(), MatrixType.DENSE)
                    : c.truncatedOperator(sub));
        }
        return TensorComposition.kron(parts).as(matrixType());
    }

    /**
     * 局所演算子の積を、自分の固有基底の先頭 truncatedDim 個で表した行列を返します。
     */
    ComplexMatrix truncatedOperator(SortedMap<Integer, LocalFactor> factors) {
        HermitianEigenResult eig = eigensys(truncatedDim);
        return TensorComposition.toEigenbasis(product(factors), eig.getEigenvectors());
    }

    @Override
    public ComplexMatrix hamiltonian() {
        checkInSync();
        long s = stamp();
        if (cachedHamiltonian != null && hamiltonianStamp == s) {
            return cachedHamiltonian;
        }
        ComplexMatrix h = buildHamiltonian();
        cachedHamiltonian = h;
        hamiltonianStamp = s;
        return h;
    }

    private ComplexMatrix buildHamiltonian() {
        MatrixType type = matrixType();
        if (!children.isEmpty()) {
            // 子の打ち切り次元を並べます。
            List<Integer> dims = new ArrayList<>();
            for (Subsystem c : children) {
                dims.add(c.getTruncatedDim());
            }
            // 子の固有エネルギーの対角行列に、子をまたぐ項を加えます。
            ComplexMatrix sum = new NumericHamiltonianBuilder(registry.asLookup(), this).build(interaction);
            for (int k = 0; k < children.size(); k++) {
                double[] e = children.get(k).eigenvals(dims.get(k));
                ComplexMatrix diag = ComplexMatrix.diagonal(e, null, MatrixType.DENSE);
                sum = sum.plus(TensorComposition.identityWrap(diag, k, dims, type));
            }
            return sum.hermitianPart().as(type);
        }
        // 基準モード分解済みなら数基底のエネルギーをそのまま並べます。
        if (normalModes != null) {
            return ComplexMatrix.diagonal(normalModes.energies(), null, MatrixType.DENSE).as(type);
        }
        // それ以外は局所基底で記号ハミルトニアンを数値化します。
        return new NumericHamiltonianBuilder(registry.asLookup(), this).build(hamiltonianSymbolic)
                .hermitianPart().as(type);
    }

    /**
     * 固有値の小さい順に count 個の固有対を返します。
     *
     * @param count 個数です（1 以上、次元以下）
     * @return 固有分解結果です
     * @throws IllegalArgumentException count が範囲外の場合に発生します
     * @throws StructuralSyncException 再構築待ちの場合に発生します
     */
    public HermitianEigenResult eigensys(int count) {
        checkInSync();
        int dim = dimension();
        Preconditions.checkArgument(count >= 1 && count <= dim, "count は 1 以上 %s 以下が必要です: %s",
                dim, count);
        long s = stamp();
        if (cachedEigen != null && eigenStamp == s && cachedEigen.getEigenvalues().length >= count) {
            return leading(cachedEigen, count);
        }
        HermitianEigenResult r = (children.isEmpty() && normalModes != null) ? normalModeEigensys(count)
                : context.getEigenBackend().decomposeHermitianAndSort(hamiltonian(), count);
        cachedEigen = r;
        eigenStamp = s;
        return r;
    }

    /**
     * 固有値の小さい順に count 個の固有値を返します。
     *
     * @param count 個数です（1 以上、次元以下）
     * @return 固有値です
     */
    public double[] eigenvals(int count) {
        return eigensys(count).getEigenvalues().clone();
    }

    /**
     * 打ち切り次元（次元を超える場合は次元）個の固有値を返します。
     *
     * @return 固有値です
     */
    public double[] eigenvals() {
        checkInSync();
        return eigenvals(Math.max(1, Math.min(truncatedDim, dimension())));
    }

    private static HermitianEigenResult leading(HermitianEigenResult r, int count) {
        if (r.getEigenvalues().length == count) {
            return r;
        }
        ComplexMatrix v = r.getEigenvectors();
        return new HermitianEigenResult(Arrays.copyOf(r.getEigenvalues(), count),
                v.leadingBlock(v.numRows(), count));
    }

    /**
     * 基準モードの数基底では固有ベクトルが単位ベクトルになります。
     */
    private HermitianEigenResult normalModeEigensys(int count) {
        double[] energies = normalModes.energies();
        int[] order = EjmlHermitianEigenDecompositionBackend.argsortAscending(energies);
        double[] values = new double[count];
        ComplexMatrix.Builder vectors = ComplexMatrix.builder(energies.length, count);
        for (int k = 0; k < count; k++) {
            values[k] = energies[order[k]];
            vectors.add(order[k], k, 1.0, 0.0);
        }
        return new HermitianEigenResult(values, vectors.build(MatrixType.DENSE));
    }

    @Override
    public ComplexMatrix operator(String expressionText) {
        checkInSync();
        Expression e = ExpressionParser.parse(expressionText);
        validateOperators(e, categories);
        for (Integer i : e.variables()) {
            if (!categories.dynamicIndices().contains(i)) {
                throw new ConfigurationException("変数 " + i + " はこの系に含まれません: path=" + path());
            }
        }
        return new NumericHamiltonianBuilder(registry.asLookup(), this).build(e).as(matrixType());
    }

    @Override
    public Map<String, OperatorHandle> operatorHandles() {
        Map<String, OperatorHandle> out = new LinkedHashMap<>();
        for (Integer i : categories.dynamicIndices()) {
            List<String> names = (categories.categoryOf(i).orElseThrow() == VariableCategory.PERIODIC)
                    ? List.of("n" + i, "cos(θ" + i + ")", "sin(θ" + i + ")")
                    : List.of("θ" + i, "Q" + i, "cos(θ" + i + ")", "sin(θ" + i + ")");
            for (String name : names) {
                out.put(name, new OperatorHandle(name, () -> operator(name)));
            }
        }
        return out;
    }

    /**
     * プロパティ書き込み時の再生成処理です。
     */
    private void onPropertyUpdate(PropertySlot slot) {
        if (children.isEmpty() && state != LifecycleState.UNCONFIGURED) {
            regenerateLocals();
        }
        touch();
        for (List<Integer> dependent : slot.getDependents()) {
            children.get(dependent.get(0)).set(slot.getName(), slot.getValue());
        }
    }

    /**
     * 打ち切りの書き込みで、子孫の次元が打ち切り次元を下回らないか検証します。
     */
    private void checkCutoffWrite(PropertySlot slot, Object value) {
        if (slot.getUpdateKind() != UpdateKind.CUTOFFS) {
            return;
        }
        verifyCutoff(slot.getName(), (Integer) value, isTruncated());
    }

    void verifyCutoff(String name, int cutoff, boolean includeSelf) {
        if (includeSelf && children.isEmpty() && registry.contains(name)) {
            int dim = dimensionWith(name, cutoff);
            if (dim < truncatedDim) {
                throw new ValidationException(name + "=" + cutoff + " では次元 " + dim + " が打ち切り次元 "
                        + truncatedDim + " を下回ります: path=" + path());
            }
        }
        for (Subsystem c : children) {
            c.verifyCutoff(name, cutoff, true);
        }
    }

    void regenerateLocals() {
        installLocals(computeLocals());
    }

    void installLocals(LocalOperators locals) {
        bases = locals.getBases();
        normalModes = locals.getNormalModes();
        lastFastPath = (normalModes != null);
    }

    /**
     * 現在のプロパティ値から末端の系の局所演算子を生成します。
     */
    LocalOperators computeLocals() {
        List<Integer> vars = categories.dynamicIndices();
        ToDoubleFunction<String> values = registry.asLookup();
        ExtBasis extBasis = registry.getExtBasis(EXT_BASIS);
        CircuitOptions options = context.getOptions();

        // 純調和なら基準モード分解を試みます。
        if (options.isHarmonicFastPath() && !vars.isEmpty()) {
            HarmonicCheck check = ExpressionClassifier.checkPurelyHarmonic(hamiltonianSymbolic,
                    categories, values, options.getHarmonicTolerance());
            if (check.isPurelyHarmonic()) {
                int[] modeDims = new int[vars.size()];
                for (int k = 0; k < vars.size(); k++) {
                    modeDims[k] = registry.getInt(
                            BasisOperatorFactory.cutoffName(vars.get(k), VariableCategory.EXTENDED));
                }
                HarmonicNormalModes modes = HarmonicNormalModes.solve(hamiltonianSymbolic, vars,
                        modeDims, values, context.getEigenBackend());
                if (modes != null) {
                    // 局所基底から切り替わったときだけ通知します。
                    if (!Boolean.TRUE.equals(lastFastPath)) {
                        if (extBasis == ExtBasis.DISCRETIZED) {
                            log.warn("純調和な系のため ext_basis={} を HARMONIC として扱います: path={}", extBasis,
                                    path());
                        }
                        log.info("基準モード分解を適用します: path={}, ω={}", path(),
                                formatAll(modes.getFrequencies()));
                    }
                    return new LocalOperators(Map.of(), modes);
                }
            }
        }

        // 変数ごとに分類と打ち切りに応じた局所基底を作ります。
        Map<Integer, VariableBasis> out = new TreeMap<>();
        for (Integer i : vars) {
            VariableCategory cat = categories.categoryOf(i).orElseThrow();
            int cutoff = registry.getInt(BasisOperatorFactory.cutoffName(i, cat));
            double length = (cat == VariableCategory.EXTENDED && extBasis == ExtBasis.HARMONIC)
                    ? oscillatorLength(i) : 0.0;
            out.put(i, context.getBasisFactory().create(i, cat, extBasis, cutoff, phiRange(i),
                    length));
        }
        return new LocalOperators(Collections.unmodifiableMap(out), null);
    }

    double[] phiRange(int variable) {
        double[] range = phiRanges.get(variable);
        return (range != null) ? range : context.getOptions().getDiscretizedPhiRange();
    }

    /**
     * 二次の係数から振動子長 l = (8 E_C / E_L)^{1/4} を求めます。
     */
    private double oscillatorLength(int variable) {
        double ec = quadraticCoefficient(OperatorSymbol.extendedCharge(variable)) / 4.0;
        double el = 2.0 * quadraticCoefficient(OperatorSymbol.theta(variable));
        if (!(ec > 0.0) || !(el > 0.0)) {
            throw new ConfigurationException("調和振動子基底の振動子長を決められません: 変数 " + variable
                    + ", EC=" + fmt5(ec) + ", EL=" + fmt5(el));
        }
        return HarmonicOscillatorBasis.oscillatorLength(ec, el);
    }

    private double quadraticCoefficient(OperatorSymbol symbol) {
        double c = 0.0;
        for (Term t : hamiltonianSymbolic.getTerms()) {
            if (t.getTrigFactors().isEmpty() && t.degree() == 2 && t.power(symbol) == 2) {
                c += t.getCoefficient().evaluate(registry.asLookup());
            }
        }
        return c;
    }

    /**
     * 離散化範囲を自分と子孫に適用し、局所演算子を作り直します。
     */
    void applyPhiRange(int variable, double[] range) {
        if (!categories.dynamicIndices().contains(variable)) {
            return;
        }
        phiRanges.put(variable, range.clone());
        for (Subsystem c : children) {
            c.applyPhiRange(variable, range);
        }
        if (children.isEmpty()) {
            regenerateLocals();
        }
        touch();
    }

    /**
     * 階層の各項目から子サブシステムを生成します。
     *
     * @param h 階層です
     * @param specs 打ち切り次元です
     * @param expression 分割する記号ハミルトニアンです
     * @param cats 分割する変数分類です
     * @return 子サブシステムです
     * @throws ConfigurationException 階層が変数を分割していない、形状が一致しない、打ち切り次元が次元を超える場合に発生します
     */
    List<Subsystem> generateSubsystems(SystemHierarchy h, List<TruncationSpec> specs,
            Expression expression, VariableCategories cats) {
        h.checkPartition(cats.dynamicIndices());
        TruncationSpec.checkShape(h, specs);
        List<Subsystem> out = new ArrayList<>();
        for (int k = 0; k < h.getEntries().size(); k++) {
            HierarchyNode node = h.getEntries().get(k);
            SortedSet<Integer> indices = node.allIndices();
            Expression part = expression.filter(
                    t -> !t.variables().isEmpty() && indices.containsAll(t.variables()));
            List<Integer> childPath = new ArrayList<>(path());
            childPath.add(k);
            out.add(new Subsystem(context, childPath, part, cats.filter(indices), node, specs.get(k),
                    registry, phiRanges));
        }
        log.info("サブシステムを生成しました: path={}, hierarchy={}, truncation={}", path(), h,
                TruncationSpec.format(specs));
        return List.copyOf(out);
    }

    /**
     * どの子にも収まらない項（子をまたぐ項と定数項）を返します。
     */
    static Expression interactionOf(Expression expression, List<Subsystem> subsystems) {
        return expression.filter(t -> {
            for (Subsystem c : subsystems) {
                if (!t.variables().isEmpty()
                        && c.getCategories().dynamicIndices().containsAll(t.variables())) {
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * 子のうち同じ名前のプロパティを持つものを依存先として設定します。
     */
    void linkDependents() {
        for (String name : registry.names()) {
            List<List<Integer>> deps = new ArrayList<>();
            for (int k = 0; k < children.size(); k++) {
                if (children.get(k).registry.contains(name)) {
                    deps.add(List.of(k));
                }
            }
            registry.slot(name).replaceDependents(deps);
        }
    }

    /**
     * 子孫のサブシステムを深さ優先で集めます。
     */
    void collectSubtree(List<Subsystem> out) {
        for (Subsystem c : children) {
            out.add(c);
            c.collectSubtree(out);
        }
    }

    /**
     * 記号式の演算子が数値化できる構造か検証します。
     *
     * @param expression 記号式です
     * @param cats 変数分類です
     * @throws ConfigurationException 自由・凍結変数の演算子、周期変数の θ 多項式、 周期変数の非整数の三角関数係数を含む場合に発生します
     */
    static void validateOperators(Expression expression, VariableCategories cats) {
        for (Term t : expression.getTerms()) {
            for (OperatorSymbol s : t.getMonomial().keySet()) {
                VariableCategory c = cats.categoryOf(s.getIndex()).orElse(null);
                if (c != VariableCategory.PERIODIC && c != VariableCategory.EXTENDED) {
                    throw new ConfigurationException(
                            "変数 " + s.getIndex() + " は " + c + " のため演算子を使えません: " + t);
                }
                if (c == VariableCategory.PERIODIC && s.getKind() == OperatorSymbol.Kind.THETA) {
                    throw new ConfigurationException("周期変数の θ" + s.getIndex() + " の多項式は扱えません: " + t);
                }
            }
            for (TrigFactor f : t.getTrigFactors()) {
                for (Map.Entry<Integer, Double> e : f.getCoefficients().entrySet()) {
                    VariableCategory c = cats.categoryOf(e.getKey()).orElse(null);
                    if (c != VariableCategory.PERIODIC && c != VariableCategory.EXTENDED) {
                        throw new ConfigurationException(
                                "変数 " + e.getKey() + " は " + c + " のため演算子を使えません: " + t);
                    }
                    double a = e.getValue();
                    if (c == VariableCategory.PERIODIC && a != Math.rint(a)) {
                        throw new ConfigurationException(
                                "周期変数 θ" + e.getKey() + " の三角関数の係数は整数が必要です: " + t);
                    }
                }
            }
        }
    }

    static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    static String formatAll(double[] values) {
        List<String> out = new ArrayList<>();
        for (double v : values) {
            out.add(fmt5(v));
        }
        return out.toString();
    }
}
