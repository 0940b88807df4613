package io.github.yok.scq.core.circuit;

import com.google.common.base.Preconditions;
import io.github.yok.scq.core.basis.BasisOperatorFactory;
import io.github.yok.scq.core.basis.ExtBasis;
import io.github.yok.scq.core.dispatch.CentralDispatch;
import io.github.yok.scq.core.dispatch.DispatchTopic;
import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.hierarchy.SystemHierarchy;
import io.github.yok.scq.core.hierarchy.TruncationSpec;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.scq.core.linearalgebra.EjmlHermitianEigenDecompositionBackend;
import io.github.yok.scq.core.registry.UpdateKind;
import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.ExpressionClassifier;
import io.github.yok.scq.core.symbolic.ExpressionParser;
import io.github.yok.scq.core.symbolic.OperatorSymbol;
import io.github.yok.scq.core.symbolic.Term;
import io.github.yok.scq.core.symbolic.VariableCategories;
import io.github.yok.scq.core.symbolic.VariableCategory;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * 量子化した回路のルートです。
 *
 * <p>
 * 記号回路ビルダーから記号ハミルトニアンを受け取り、プロパティを登録し、 階層を指定した場合は子サブシステムへ分割します。 構成に失敗した場合は呼び出し前の構成に戻します。
 * </p>
 *
 * <pre>
 * Circuit c = Circuit.fromHamiltonian("4*EC*Q1^2 + 0.5*EL*θ1^2 - EJ*cos(θ1 + Φ1)",
 *         Map.of("EC", 1.0, "EL", 10.0, "EJ", 20.0));
 * double[] e = c.eigenvals(5);
 * </pre>
 */
@Slf4j
public final class Circuit extends AbstractCircuitSystem
        implements SerializableCircuit, NoiseChannelProvider {

    /**
     * 記号回路ビルダーです。
     */
    private final SymbolicCircuitBuilder builder;

    /**
     * 直近の導出結果です。
     */
    private SymbolicCircuit symbolicCircuit;

    /**
     * 変数変換行列です。
     */
    private double[][] transformationMatrix;

    /**
     * 閉路枝です。
     */
    private List<Branch> closureBranches = List.of();

    /**
     * 既定の固有分解バックエンドで回路を生成します（未構成）。
     *
     * @param builder 記号回路ビルダーです
     * @param options 構成オプションです
     */
    public Circuit(SymbolicCircuitBuilder builder, CircuitOptions options) {
        this(builder, options, new EjmlHermitianEigenDecompositionBackend());
    }

    /**
     * 回路を生成します（未構成）。
     *
     * @param builder 記号回路ビルダーです
     * @param options 構成オプションです
     * @param eigenBackend 固有分解バックエンドです
     */
    public Circuit(SymbolicCircuitBuilder builder, CircuitOptions options,
            EigenDecompositionBackend eigenBackend) {
        super(new CircuitContext(new CentralDispatch(), Preconditions.checkNotNull(options,
                "options は null 不可です"), eigenBackend, new BasisOperatorFactory(eigenBackend)));
        this.builder = Preconditions.checkNotNull(builder, "builder は null 不可です");
        this.truncatedDim = options.getTruncatedDim();
    }

    /**
     * 記号ハミルトニアンの文字列から回路を生成して構成します。
     *
     * @param hamiltonian 記号ハミルトニアンです
     * @param parameters パラメータ値です
     * @return 構成済みの回路です
     */
    public static Circuit fromHamiltonian(String hamiltonian, Map<String, Double> parameters) {
        return fromHamiltonian(hamiltonian, parameters, CircuitOptions.defaults());
    }

    /**
     * 記号ハミルトニアンの文字列から回路を生成して構成します。
     *
     * @param hamiltonian 記号ハミルトニアンです
     * @param parameters パラメータ値です
     * @param options 構成オプションです
     * @return 構成済みの回路です
     * @throws ConfigurationException 構成に失敗した場合に発生します
     */
    public static Circuit fromHamiltonian(String hamiltonian, Map<String, Double> parameters,
            CircuitOptions options) {
        Circuit c = new Circuit(new FixedHamiltonianBuilder(hamiltonian, parameters), options);
        c.configure();
        return c;
    }

    @Override
    public List<Integer> path() {
        return List.of();
    }

    @Override
    boolean isTruncated() {
        return false;
    }

    public CentralDispatch getDispatch() {
        return context.getDispatch();
    }

    public CircuitOptions getOptions() {
        return context.getOptions();
    }

    public SymbolicCircuitBuilder getBuilder() {
        return builder;
    }

    public List<Branch> getClosureBranches() {
        return closureBranches;
    }

    /**
     * 変数変換行列の写しを返します。
     *
     * @return 変数変換行列です（未構成の場合は null）
     */
    public double[][] getTransformationMatrix() {
        return copyOf(transformationMatrix);
    }

    /**
     * 現在の構成（変換行列・階層・打ち切り次元・閉路枝）で構成し直します。
     */
    public void configure() {
        configure(transformationMatrix, hierarchy, truncationSpecs, closureBranches);
    }

    /**
     * 変換行列と閉路枝を保ったまま階層と打ち切り次元を指定して構成します。
     *
     * @param systemHierarchy 階層です（null の場合は階層的対角化を行いません）
     * @param subsystemTruncDims 打ち切り次元です（null の場合はひな形）
     */
    public void configure(SystemHierarchy systemHierarchy, List<TruncationSpec> subsystemTruncDims) {
        configure(transformationMatrix, systemHierarchy, subsystemTruncDims, closureBranches);
    }

    /**
     * 回路を構成します。
     *
     * <p>
     * 失敗した場合は階層・打ち切り次元・変換行列・閉路枝・プロパティの集合・サブシステムを呼び出し前に戻します。
     * </p>
     *
     * @param tm 変数変換行列です（null の場合は現在の行列、未構成ならビルダーの既定）
     * @param systemHierarchy 階層です（null の場合は階層的対角化を行いません）
     * @param subsystemTruncDims 打ち切り次元です（null の場合はひな形）
     * @param closure 閉路枝です（null の場合は現在の閉路枝）
     * @throws ConfigurationException 構成に失敗した場合に発生します（原因は元の例外）
     * @throws IllegalStateException 構成中に呼び出した場合に発生します
     */
    public void configure(double[][] tm, SystemHierarchy systemHierarchy,
            List<TruncationSpec> subsystemTruncDims, List<Branch> closure) {
        if (state == LifecycleState.REBUILDING) {
            throw new IllegalStateException("構成中の回路は構成できません");
        }
        long start = System.nanoTime();

        // 取り消し用に現在の構成を保存します。
        LifecycleState prevState = state;
        SymbolicCircuit prevSymbolic = symbolicCircuit;
        double[][] prevTm = transformationMatrix;
        List<Branch> prevClosure = closureBranches;
        Expression prevHamiltonian = hamiltonianSymbolic;
        VariableCategories prevCategories = categories;
        Set<String> prevNames = registry.names();

        state = LifecycleState.REBUILDING;
        log.info("回路を構成します: hierarchy={}, truncation={}", systemHierarchy,
                (subsystemTruncDims != null) ? TruncationSpec.format(subsystemTruncDims) : null);
        try {
            List<Branch> closureArg = (closure != null) ? List.copyOf(closure) : closureBranches;
            if (builder.isFluxDynamic() && !closureArg.isEmpty()) {
                throw new ConfigurationException("時間依存の外部磁束では閉路枝を指定できません");
            }
            SymbolicCircuit sc = builder.derive((tm != null) ? tm : transformationMatrix, closureArg);
            validateOperators(sc.getHamiltonian(), sc.getCategories());
            addMissingSlots(sc);

            symbolicCircuit = sc;
            hamiltonianSymbolic = sc.getHamiltonian();
            categories = sc.getCategories();
            transformationMatrix = copyOf(sc.getTransformationMatrix());
            closureBranches = closureArg;

            List<Subsystem> newChildren = List.of();
            List<TruncationSpec> newSpecs = null;
            Expression newInteraction = Expression.ZERO;
            LocalOperators locals = LocalOperators.EMPTY;
            if (systemHierarchy != null) {
                newSpecs = (subsystemTruncDims != null) ? List.copyOf(subsystemTruncDims)
                        : TruncationSpec.template(systemHierarchy);
                newChildren = generateSubsystems(systemHierarchy, newSpecs, hamiltonianSymbolic,
                        categories);
                newInteraction = interactionOf(hamiltonianSymbolic, newChildren);
            } else {
                locals = computeLocals();
            }

            // ここから先は失敗しないため、新しい構成に切り替えます。
            CentralDispatch dispatch = context.getDispatch();
            dispatch.broadcast(DispatchTopic.STRUCTURAL_UPDATE, this);
            List<Subsystem> old = new ArrayList<>();
            collectSubtree(old);
            old.forEach(dispatch::unregisterAll);

            hierarchy = systemHierarchy;
            truncationSpecs = newSpecs;
            children = newChildren;
            interaction = newInteraction;
            installLocals(locals);

            List<Subsystem> fresh = new ArrayList<>();
            collectSubtree(fresh);
            for (Subsystem s : fresh) {
                dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, s);
            }
            linkDependents();
            state = LifecycleState.CONFIGURED;
            touch();
            log.info("回路を構成しました: dimension={}, subsystems={}, elapsedMs={}", dimension(),
                    fresh.size(), (System.nanoTime() - start) / 1_000_000);
        } catch (RuntimeException e) {
            registry.retainOnly(prevNames);
            symbolicCircuit = prevSymbolic;
            transformationMatrix = prevTm;
            closureBranches = prevClosure;
            hamiltonianSymbolic = prevHamiltonian;
            categories = prevCategories;
            state = prevState;
            log.warn("構成に失敗したため元の構成に戻します: reason={}", e.getMessage());
            throw new ConfigurationException("回路の構成に失敗しました: " + e.getMessage(), e);
        }
    }

    /**
     * 導出結果が参照するプロパティのうち未登録のものを登録します。
     */
    private void addMissingSlots(SymbolicCircuit sc) {
        CircuitOptions options = context.getOptions();
        for (String name : sc.getHamiltonian().parameterSymbols()) {
            if (registry.contains(name)) {
                continue;
            }
            Double value = sc.getParameterDefaults().get(name);
            if (sc.getExternalFluxes().contains(name) || sc.getOffsetCharges().contains(name)) {
                registry.makeProperty(name, (value != null) ? value : 0.0,
                        UpdateKind.EXTERNAL_FLUX_OR_CHARGE);
            } else {
                if (value == null) {
                    throw new ConfigurationException("未定義のパラメータです: " + name);
                }
                registry.makeProperty(name, value, UpdateKind.PARAM_VARS);
            }
        }
        for (Integer i : sc.getCategories().dynamicIndices()) {
            VariableCategory cat = sc.getCategories().categoryOf(i).orElseThrow();
            String name = BasisOperatorFactory.cutoffName(i, cat);
            if (!registry.contains(name)) {
                int fallback = (cat == VariableCategory.PERIODIC) ? options.getDefaultCutoffN()
                        : options.getDefaultCutoffExt();
                registry.makeProperty(name, options.getCutoffs().getOrDefault(name, fallback),
                        UpdateKind.CUTOFFS);
            }
        }
        if (!registry.contains(EXT_BASIS)) {
            registry.makeProperty(EXT_BASIS, options.getExtBasis(), UpdateKind.EXT_BASIS);
        }
    }

    /**
     * 拡張変数の離散化範囲を設定します。
     *
     * @param variables 変数番号です
     * @param phiRange 範囲 {min, max} です
     * @throws ConfigurationException 離散化基底でない、拡張変数でない、範囲が不正な場合に発生します
     */
    public void setDiscretizedPhiRange(List<Integer> variables, double[] phiRange) {
        checkInSync();
        Preconditions.checkNotNull(variables, "variables は null 不可です");
        if (phiRange == null || phiRange.length != 2 || !Double.isFinite(phiRange[0])
                || !Double.isFinite(phiRange[1]) || !(phiRange[0] < phiRange[1])) {
            throw new ConfigurationException("離散化範囲は min < max の有限値が必要です: "
                    + Arrays.toString(phiRange));
        }
        if (registry.getExtBasis(EXT_BASIS) != ExtBasis.DISCRETIZED) {
            throw new ConfigurationException("離散化範囲は ext_basis=DISCRETIZED のときのみ指定できます");
        }
        for (Integer i : variables) {
            if (categories.categoryOf(i).orElse(null) != VariableCategory.EXTENDED) {
                throw new ConfigurationException("離散化範囲は拡張変数にのみ指定できます: " + i);
            }
        }
        for (Integer i : variables) {
            applyPhiRange(i, phiRange);
        }
    }

    /**
     * 離散化範囲の写しを返します。
     *
     * @return 変数番号 → 範囲です（明示的に設定したもののみ）
     */
    public Map<Integer, double[]> getDiscretizedPhiRanges() {
        Map<Integer, double[]> out = new TreeMap<>();
        phiRanges.forEach((k, v) -> out.put(k, v.clone()));
        return out;
    }

    /**
     * 構造変更の通知で再構築待ちになったサブシステムを作り直します。
     */
    public void rebuild() {
        for (Subsystem c : children) {
            c.rebuild();
        }
        touch();
    }

    /**
     * 拡張変数を 1 つだけ持つ純調和な（基準モード分解を適用した）子サブシステムを返します。
     *
     * <p>
     * 複数の拡張変数を持つ純調和なサブシステムは単一の振動子ではないため含めません。
     * </p>
     *
     * @return 振動子のサブシステムです
     * @throws ConfigurationException 階層的対角化を行っていない場合に発生します
     */
    public List<Subsystem> oscillatorSubsystems() {
        requireHierarchical();
        return children.stream()
                .filter(s -> s.isHarmonicFastPath()
                        && s.getCategories().indices(VariableCategory.EXTENDED).size() == 1)
                .collect(Collectors.toList());
    }

    /**
     * 純調和でない子サブシステムを返します。 多モードの純調和なサブシステムは振動子にも量子ビットにも含めません。
     *
     * @return 量子ビットのサブシステムです
     * @throws ConfigurationException 階層的対角化を行っていない場合に発生します
     */
    public List<Subsystem> qubitSubsystems() {
        requireHierarchical();
        return children.stream().filter(s -> !s.isHarmonicFastPath()).collect(Collectors.toList());
    }

    private void requireHierarchical() {
        if (children.isEmpty()) {
            throw new ConfigurationException("階層的対角化を行っていない回路にはサブシステムがありません");
        }
    }

    @Override
    public List<String> supportedNoiseChannels() {
        checkInSync();
        List<String> out = new ArrayList<>();
        out.add("t1_capacitive");
        out.add("t1_charge_impedance");
        boolean inductive = builder.branches().stream().anyMatch(b -> "L".equals(b.getType()));
        for (Term t : hamiltonianSymbolic.getTerms()) {
            if (ExpressionClassifier.isPotentialTerm(t) && t.getMonomial().keySet().stream()
                    .anyMatch(s -> s.getKind() == OperatorSymbol.Kind.THETA)) {
                inductive = true;
            }
        }
        if (inductive) {
            out.add("t1_inductive");
        }
        if (!symbolicCircuit.getOffsetCharges().isEmpty()) {
            out.add("tphi_1_over_f_ng");
        }
        if (!symbolicCircuit.getExternalFluxes().isEmpty()) {
            if (!builder.isFluxDynamic()) {
                log.warn("静的な外部磁束の回路に磁束雑音のチャネルを含めます: fluxes={}",
                        symbolicCircuit.getExternalFluxes());
            }
            out.add("tphi_1_over_f_flux");
            out.add("t1_flux_bias_line");
        }
        if (hamiltonianSymbolic.getTerms().stream().anyMatch(t -> !t.getTrigFactors().isEmpty())) {
            out.add("tphi_1_over_f_cc");
        }
        return out;
    }

    @Override
    public CircuitSnapshot serialize() {
        checkInSync();
        Map<String, Object> init = new LinkedHashMap<>();
        init.put("ext_basis", registry.getExtBasis(EXT_BASIS).name());
        init.put("input_string", builder.inputString());
        init.put("truncated_dim", truncatedDim);
        init.put("harmonic_fast_path", context.getOptions().isHarmonicFastPath());
        init.put("harmonic_tolerance", context.getOptions().getHarmonicTolerance());

        Map<String, Object> modified = new LinkedHashMap<>();
        modified.putAll(registry.values(UpdateKind.PARAM_VARS));
        modified.putAll(registry.values(UpdateKind.EXTERNAL_FLUX_OR_CHARGE));
        modified.putAll(registry.values(UpdateKind.CUTOFFS));
        if (hierarchy != null) {
            modified.put("system_hierarchy", hierarchy.toString());
            modified.put("subsystem_trunc_dims", TruncationSpec.format(truncationSpecs));
        }
        modified.put("transformation_matrix", copyOf(transformationMatrix));
        modified.put("closure_branches_data",
                closureBranches.stream().map(Branch::toIdentifier).collect(Collectors.toList()));
        modified.put("discretized_phi_range", getDiscretizedPhiRanges());
        return new CircuitSnapshot(Collections.unmodifiableMap(init),
                Collections.unmodifiableMap(modified));
    }

    /**
     * 直列化データから回路を復元します。
     *
     * <p>
     * 構築 → 変換行列と閉路枝で構成 → 値と離散化範囲の書き込み → 階層の構成 の順に行います。
     * </p>
     *
     * @param snapshot 直列化データです
     * @param builder 記号回路ビルダーです（null の場合は入力文字列を記号ハミルトニアンとして扱います）
     * @return 復元した回路です
     * @throws ConfigurationException 復元に失敗した場合に発生します
     */
    public static Circuit deserialize(CircuitSnapshot snapshot, SymbolicCircuitBuilder builder) {
        Preconditions.checkNotNull(snapshot, "snapshot は null 不可です");
        Map<String, Object> init = snapshot.getInitParams();
        Map<String, Object> modified = snapshot.getModifiedAttributes();

        // ビルダーがなければ入力文字列から記号ハミルトニアンのビルダーを作ります。
        SymbolicCircuitBuilder b = builder;
        if (b == null) {
            String text = (String) init.get("input_string");
            Map<String, Double> defaults = new LinkedHashMap<>();
            for (String name : ExpressionParser.parse(text).parameterSymbols()) {
                Object v = modified.get(name);
                if (v instanceof Number) {
                    defaults.put(name, ((Number) v).doubleValue());
                }
            }
            b = new FixedHamiltonianBuilder(text, defaults);
        }

        // 構築時の引数で回路を作ります。
        CircuitOptions options = CircuitOptions.builder()
                .extBasis(ExtBasis.valueOf((String) init.get("ext_basis")))
                .truncatedDim(((Number) init.get("truncated_dim")).intValue())
                .harmonicFastPath((Boolean) init.get("harmonic_fast_path"))
                .harmonicTolerance(((Number) init.get("harmonic_tolerance")).doubleValue()).build();
        Circuit c = new Circuit(b, options);

        // 閉路枝を探し直し、変換行列とあわせて構成します。
        List<Branch> closure = new ArrayList<>();
        for (CircuitSnapshot.ClosureBranchId id : snapshot.closureBranchIds()) {
            closure.add(b.findBranch(id.getNode1(), id.getNode2(), id.getType(), id.getParams())
                    .orElseThrow(() -> new ConfigurationException("閉路枝を復元できません: " + id)));
        }
        c.configure(snapshot.transformationMatrix(), null, null, closure);

        // 値と離散化範囲を書き込みます。
        for (Map.Entry<String, Object> e : modified.entrySet()) {
            if (c.registry.contains(e.getKey())) {
                c.set(e.getKey(), e.getValue());
            }
        }
        snapshot.discretizedPhiRanges().forEach(c::applyPhiRange);

        // 階層が記録されていれば最後に構成します。
        Object h = modified.get("system_hierarchy");
        if (h != null) {
            c.configure(SystemHierarchy.parse((String) h),
                    TruncationSpec.parseList((String) modified.get("subsystem_trunc_dims")));
        }
        return c;
    }

    /**
     * 直列化データを経由して独立した写しを作ります。
     *
     * @return 写しです
     */
    public Circuit copy() {
        return deserialize(serialize(), builder);
    }

    private static double[][] copyOf(double[][] m) {
        if (m == null) {
            return null;
        }
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i].clone();
        }
        return out;
    }

    @Override
    public String toString() {
        return "Circuit[hamiltonian=" + hamiltonianSymbolic + ", hierarchy=" + hierarchy + ", state="
                + state + "]";
    }
}
