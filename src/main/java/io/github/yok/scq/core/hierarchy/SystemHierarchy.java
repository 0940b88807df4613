package io.github.yok.scq.core.hierarchy;

import io.github.yok.scq.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 系統階層（サブシステムへの変数の分け方）を表す不変クラスです。
 *
 * <p>
 * 例えば "[[1], [2, 3]]" は変数 1 と変数 2, 3 の 2 つのサブシステムに分け、 "[[1], [[2], [3]]]" は 2 つ目のサブシステムをさらに 2
 * つに分けて階層的に対角化します。
 * </p>
 */
public final class SystemHierarchy {

    /**
     * 最上位の要素です（兄弟サブシステムに対応します）。
     */
    private final List<HierarchyNode> entries;

    /**
     * 要素の一覧から生成します。
     *
     * @param entries 要素の一覧です（1 つ以上）
     */
    public SystemHierarchy(List<HierarchyNode> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new ConfigurationException("system_hierarchy は 1 つ以上の要素が必要です");
        }
        this.entries = Collections.unmodifiableList(List.copyOf(entries));
    }

    /**
     * 入れ子リスト表記を解析します。
     *
     * @param text 表記です（例: "[[1], [2, 3]]"）
     * @return 系統階層です
     * @throws ConfigurationException 表記が不正な場合に発生します
     */
    public static SystemHierarchy parse(String text) {
        return fromNested(BracketListParser.parse(text));
    }

    /**
     * Integer と List の入れ子リストから生成します。
     *
     * @param nested 入れ子リストです
     * @return 系統階層です
     * @throws ConfigurationException 最上位にリストでない要素がある場合などに発生します
     */
    public static SystemHierarchy fromNested(List<?> nested) {
        List<HierarchyNode> entries = new ArrayList<>();
        for (Object o : nested) {
            if (!(o instanceof List)) {
                throw new ConfigurationException("system_hierarchy の要素はリストが必要です: " + o);
            }
            entries.add(toNode((List<?>) o));
        }
        return new SystemHierarchy(entries);
    }

    private static HierarchyNode toNode(List<?> list) {
        if (list.isEmpty()) {
            throw new ConfigurationException("system_hierarchy に空のリストがあります");
        }
        boolean allInts = list.stream().allMatch(o -> o instanceof Integer);
        boolean allLists = list.stream().allMatch(o -> o instanceof List);
        if (allInts) {
            List<Integer> indices = new ArrayList<>();
            list.forEach(o -> indices.add((Integer) o));
            return new HierarchyNode.Leaf(indices);
        }
        if (allLists) {
            List<HierarchyNode> children = new ArrayList<>();
            list.forEach(o -> children.add(toNode((List<?>) o)));
            return new HierarchyNode.Group(children);
        }
        throw new ConfigurationException("変数番号とリストが混在しています: " + list);
    }

    public List<HierarchyNode> getEntries() {
        return entries;
    }

    /**
     * 含まれるすべての変数番号を返します。
     *
     * @return 変数番号（昇順）です
     */
    public Set<Integer> allIndices() {
        TreeSet<Integer> out = new TreeSet<>();
        entries.forEach(e -> out.addAll(e.allIndices()));
        return out;
    }

    /**
     * 各階層で兄弟要素が親の変数集合を重複なく過不足なく分割していることを検証します。
     *
     * @param parentIndices 親の変数番号です
     * @throws ConfigurationException 分割になっていない場合に発生します
     */
    public void checkPartition(Collection<Integer> parentIndices) {
        checkPartition(entries, new TreeSet<>(parentIndices));
    }

    private static void checkPartition(List<HierarchyNode> siblings, Set<Integer> parent) {
        Set<Integer> seen = new TreeSet<>();
        for (HierarchyNode node : siblings) {
            List<Integer> own = (node instanceof HierarchyNode.Leaf)
                    ? ((HierarchyNode.Leaf) node).getIndices()
                    : new ArrayList<>(node.allIndices());
            for (Integer i : own) {
                if (!parent.contains(i)) {
                    throw new ConfigurationException("system_hierarchy に存在しない変数番号があります: " + i);
                }
                if (!seen.add(i)) {
                    throw new ConfigurationException("system_hierarchy で変数番号が重複しています: " + i);
                }
            }
            if (node.isGroup()) {
                checkPartition(((HierarchyNode.Group) node).getChildren(), node.allIndices());
            }
        }
        if (!seen.equals(parent)) {
            Set<Integer> missing = new TreeSet<>(parent);
            missing.removeAll(seen);
            throw new ConfigurationException("system_hierarchy に含まれない変数番号があります: " + missing);
        }
    }

    @Override
    public boolean equals(Object obj) {
        return (obj instanceof SystemHierarchy) && entries.equals(((SystemHierarchy) obj).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.stream().map(HierarchyNode::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
