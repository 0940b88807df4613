package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.basis.BasisOperatorFactory;
import io.github.yok.scq.core.dispatch.DispatchClient;
import io.github.yok.scq.core.dispatch.DispatchTopic;
import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.hierarchy.HierarchyNode;
import io.github.yok.scq.core.hierarchy.SystemHierarchy;
import io.github.yok.scq.core.hierarchy.TruncationSpec;
import io.github.yok.scq.core.registry.PropertyRegistry;
import io.github.yok.scq.core.registry.UpdateKind;
import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.VariableCategories;
import io.github.yok.scq.core.symbolic.VariableCategory;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 階層的対角化で生成される部分系です。
 *
 * <p>
 * 親の記号ハミルトニアンのうち、自分の変数だけを含む項を持ちます。 パラメータ・打ち切り・基底の値は親から書き込まれ、 構造変更の通知を受けると {@link #rebuild()}
 * まで演算子を提供しません。
 * </p>
 */
@Slf4j
public final class Subsystem extends AbstractCircuitSystem implements DispatchClient {

    /**
     * ルートからの添字パスです。
     */
    private final List<Integer> path;

    /**
     * 対応する階層の項目です。
     */
    private final HierarchyNode node;

    /**
     * 部分系を生成します。
     *
     * @param context 共有部品です
     * @param path ルートからの添字パスです
     * @param expression 自分の変数だけを含む記号ハミルトニアンです
     * @param categories 親の変数分類を自分の変数に絞ったものです
     * @param node 階層の項目です
     * @param spec 打ち切り次元です
     * @param parentRegistry 初期値を読む親のプロパティです
     * @param parentRanges 親の離散化範囲です
     * @throws ConfigurationException 打ち切り次元が次元を超える場合などに発生します
     */
    Subsystem(CircuitContext context, List<Integer> path, Expression expression,
            VariableCategories categories, HierarchyNode node, TruncationSpec spec,
            PropertyRegistry parentRegistry, Map<Integer, double[]> parentRanges) {
        super(context);
        this.path = List.copyOf(path);
        this.node = node;
        this.hamiltonianSymbolic = expression;
        this.categories = categories;
        this.truncatedDim = spec.truncatedDim();
        for (Map.Entry<Integer, double[]> e : parentRanges.entrySet()) {
            if (categories.dynamicIndices().contains(e.getKey())) {
                phiRanges.put(e.getKey(), e.getValue().clone());
            }
        }
        copySlots(parentRegistry);
        validateOperators(expression, categories);

        if (node.isGroup()) {
            this.hierarchy = new SystemHierarchy(((HierarchyNode.Group) node).getChildren());
            this.truncationSpecs = ((TruncationSpec.Group) spec).getChildren();
            this.children = generateSubsystems(hierarchy, truncationSpecs, expression, categories);
            this.interaction = interactionOf(expression, children);
        } else {
            installLocals(computeLocals());
        }
        linkDependents();
        checkTruncationIndices();
        state = LifecycleState.CONFIGURED;
        touch();
        log.debug("サブシステムを構成しました: path={}, variables={}, truncatedDim={}, dimension={}",
                this.path, categories.dynamicIndices(), truncatedDim, dimension());
    }

    /**
     * 自分の記号ハミルトニアンが参照するパラメータと、自分の変数の打ち切り・基底を親から写します。
     */
    private void copySlots(PropertyRegistry parent) {
        for (String name : hamiltonianSymbolic.parameterSymbols()) {
            registry.makeProperty(name, parent.get(name), parent.slot(name).getUpdateKind());
        }
        for (Integer i : categories.dynamicIndices()) {
            VariableCategory cat = categories.categoryOf(i).orElseThrow();
            String name = BasisOperatorFactory.cutoffName(i, cat);
            registry.makeProperty(name, parent.get(name), UpdateKind.CUTOFFS);
        }
        registry.makeProperty(EXT_BASIS, parent.get(EXT_BASIS), UpdateKind.EXT_BASIS);
    }

    /**
     * 打ち切り次元が自分の次元以下か検証します。
     *
     * @throws ConfigurationException 打ち切り次元が次元を超える場合に発生します
     */
    void checkTruncationIndices() {
        int dim = dimension();
        if (truncatedDim > dim) {
            throw new ConfigurationException("打ち切り次元が行列の次元を超えています: path=" + path
                    + ", truncatedDim=" + truncatedDim + ", dimension=" + dim);
        }
    }

    @Override
    public List<Integer> path() {
        return path;
    }

    @Override
    boolean isTruncated() {
        return true;
    }

    public HierarchyNode getNode() {
        return node;
    }

    @Override
    public void receive(DispatchTopic topic, Object sender) {
        if (topic == DispatchTopic.STRUCTURAL_UPDATE && state == LifecycleState.CONFIGURED) {
            state = LifecycleState.OUT_OF_SYNC;
            log.debug("構造変更を受信しました: path={}", path);
        }
    }

    /**
     * 子孫を含めて局所演算子を作り直し、演算子を提供できる状態に戻します。
     */
    public void rebuild() {
        for (Subsystem c : children) {
            c.rebuild();
        }
        if (children.isEmpty()) {
            regenerateLocals();
        }
        state = LifecycleState.CONFIGURED;
        touch();
        log.debug("サブシステムを再構築しました: path={}", path);
    }

    @Override
    public String toString() {
        return "Subsystem[path=" + path + ", node=" + node + ", truncatedDim=" + truncatedDim + "]";
    }
}
