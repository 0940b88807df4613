package io.github.yok.scq.core.hierarchy;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 系統階層の 1 要素です。
 *
 * <p>
 * 変数番号の平坦なリスト（{@link Leaf}）か、 さらに階層的対角化を行う入れ子（{@link Group}）のどちらかです。
 * </p>
 */
public abstract class HierarchyNode {

    HierarchyNode() {}

    /**
     * この要素に含まれるすべての変数番号を返します。
     *
     * @return 変数番号（昇順）です
     */
    public abstract SortedSet<Integer> allIndices();

    /**
     * 入れ子かどうかを返します。
     *
     * @return 入れ子なら true です
     */
    public abstract boolean isGroup();

    /**
     * 変数番号の平坦なリストです。
     */
    public static final class Leaf extends HierarchyNode {

        private final List<Integer> indices;

        public Leaf(List<Integer> indices) {
            if (indices == null || indices.isEmpty()) {
                throw new IllegalArgumentException("indices は 1 つ以上が必要です");
            }
            this.indices = Collections.unmodifiableList(List.copyOf(indices));
        }

        public List<Integer> getIndices() {
            return indices;
        }

        @Override
        public SortedSet<Integer> allIndices() {
            return new TreeSet<>(indices);
        }

        @Override
        public boolean isGroup() {
            return false;
        }

        @Override
        public boolean equals(Object obj) {
            return (obj instanceof Leaf) && indices.equals(((Leaf) obj).indices);
        }

        @Override
        public int hashCode() {
            return indices.hashCode();
        }

        @Override
        public String toString() {
            return indices.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * 入れ子の階層です。
     */
    public static final class Group extends HierarchyNode {

        private final List<HierarchyNode> children;

        public Group(List<HierarchyNode> children) {
            if (children == null || children.isEmpty()) {
                throw new IllegalArgumentException("children は 1 つ以上が必要です");
            }
            this.children = Collections.unmodifiableList(List.copyOf(children));
        }

        public List<HierarchyNode> getChildren() {
            return children;
        }

        @Override
        public SortedSet<Integer> allIndices() {
            TreeSet<Integer> out = new TreeSet<>();
            children.forEach(c -> out.addAll(c.allIndices()));
            return out;
        }

        @Override
        public boolean isGroup() {
            return true;
        }

        @Override
        public boolean equals(Object obj) {
            return (obj instanceof Group) && children.equals(((Group) obj).children);
        }

        @Override
        public int hashCode() {
            return children.hashCode();
        }

        @Override
        public String toString() {
            return children.stream().map(HierarchyNode::toString)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }
}
