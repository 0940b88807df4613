package io.github.yok.scq.core.hierarchy;

import io.github.yok.scq.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * サブシステムの切り詰め次元の指定です。
 *
 * <p>
 * 平坦なサブシステムには整数（{@link Leaf}）、入れ子のサブシステムには [合成後の次元, 子の指定] （{@link Group}）を与えます。
 * 例えば "[6, [30, [6, 6]]]" です。
 * </p>
 */
public abstract class TruncationSpec {

    TruncationSpec() {}

    /**
     * このサブシステムの切り詰め次元を返します。
     *
     * @return 切り詰め次元です
     */
    public abstract int truncatedDim();

    /**
     * 入れ子リスト表記を解析します。
     *
     * @param text 表記です
     * @return 最上位の指定の一覧です
     * @throws ConfigurationException 表記が不正な場合に発生します
     */
    public static List<TruncationSpec> parseList(String text) {
        return fromNested(BracketListParser.parse(text));
    }

    /**
     * Integer と List の入れ子リストから生成します。
     *
     * @param nested 入れ子リストです
     * @return 指定の一覧です
     */
    public static List<TruncationSpec> fromNested(List<?> nested) {
        List<TruncationSpec> out = new ArrayList<>();
        for (Object o : nested) {
            if (o instanceof Integer) {
                out.add(new Leaf((Integer) o));
            } else if (o instanceof List && ((List<?>) o).size() == 2
                    && ((List<?>) o).get(0) instanceof Integer
                    && ((List<?>) o).get(1) instanceof List) {
                List<?> pair = (List<?>) o;
                out.add(new Group((Integer) pair.get(0), fromNested((List<?>) pair.get(1))));
            } else {
                throw new ConfigurationException(
                        "subsystem_trunc_dims の要素は整数または [整数, リスト] が必要です: " + o);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 一覧を入れ子リスト表記にします。
     *
     * @param specs 指定の一覧です
     * @return 表記です
     */
    public static String format(List<TruncationSpec> specs) {
        return specs.stream().map(TruncationSpec::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * 系統階層と同じ入れ子構造かどうかを検証します。
     *
     * @param hierarchy 系統階層です
     * @param specs 切り詰め次元の指定です
     * @throws ConfigurationException 構造が一致しない場合に発生します
     */
    public static void checkShape(SystemHierarchy hierarchy, List<TruncationSpec> specs) {
        checkShape(hierarchy.getEntries(), specs, "");
    }

    private static void checkShape(List<HierarchyNode> nodes, List<TruncationSpec> specs,
            String path) {
        if (specs == null || nodes.size() != specs.size()) {
            throw new ConfigurationException("system_hierarchy と subsystem_trunc_dims の要素数が一致しません: path=["
                    + path + "], hierarchy=" + nodes.size() + ", trunc="
                    + ((specs == null) ? "null" : specs.size()));
        }
        for (int i = 0; i < nodes.size(); i++) {
            HierarchyNode node = nodes.get(i);
            TruncationSpec spec = specs.get(i);
            if (node.isGroup() != (spec instanceof Group)) {
                throw new ConfigurationException("system_hierarchy と subsystem_trunc_dims の構造が一致しません: path=["
                        + path + i + "], hierarchy=" + node + ", trunc=" + spec);
            }
            if (node.isGroup()) {
                checkShape(((HierarchyNode.Group) node).getChildren(), ((Group) spec).getChildren(),
                        path + i + ".");
            }
        }
    }

    /**
     * 系統階層に合わせた切り詰め次元の雛形を生成します。
     *
     * @param hierarchy 系統階層です
     * @param individual 平坦なサブシステムの次元です
     * @param combined 入れ子のサブシステムの合成後の次元です
     * @return 指定の一覧です
     */
    public static List<TruncationSpec> template(SystemHierarchy hierarchy, int individual,
            int combined) {
        return template(hierarchy.getEntries(), individual, combined);
    }

    /**
     * 既定値（平坦 6、入れ子 30）で雛形を生成します。
     *
     * @param hierarchy 系統階層です
     * @return 指定の一覧です
     */
    public static List<TruncationSpec> template(SystemHierarchy hierarchy) {
        return template(hierarchy, 6, 30);
    }

    private static List<TruncationSpec> template(List<HierarchyNode> nodes, int individual,
            int combined) {
        List<TruncationSpec> out = new ArrayList<>();
        for (HierarchyNode node : nodes) {
            if (node.isGroup()) {
                out.add(new Group(combined,
                        template(((HierarchyNode.Group) node).getChildren(), individual, combined)));
            } else {
                out.add(new Leaf(individual));
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 平坦なサブシステムの切り詰め次元です。
     */
    public static final class Leaf extends TruncationSpec {

        private final int dim;

        public Leaf(int dim) {
            if (dim <= 0) {
                throw new ConfigurationException("切り詰め次元は 1 以上が必要です: " + dim);
            }
            this.dim = dim;
        }

        @Override
        public int truncatedDim() {
            return dim;
        }

        @Override
        public boolean equals(Object obj) {
            return (obj instanceof Leaf) && dim == ((Leaf) obj).dim;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(dim);
        }

        @Override
        public String toString() {
            return String.valueOf(dim);
        }
    }

    /**
     * 入れ子のサブシステムの切り詰め次元です。
     */
    public static final class Group extends TruncationSpec {

        private final int combinedDim;

        private final List<TruncationSpec> children;

        public Group(int combinedDim, List<TruncationSpec> children) {
            if (combinedDim <= 0) {
                throw new ConfigurationException("切り詰め次元は 1 以上が必要です: " + combinedDim);
            }
            this.combinedDim = combinedDim;
            this.children = Collections.unmodifiableList(List.copyOf(children));
        }

        public List<TruncationSpec> getChildren() {
            return children;
        }

        @Override
        public int truncatedDim() {
            return combinedDim;
        }

        @Override
        public boolean equals(Object obj) {
            return (obj instanceof Group) && combinedDim == ((Group) obj).combinedDim
                    && children.equals(((Group) obj).children);
        }

        @Override
        public int hashCode() {
            return 31 * combinedDim + children.hashCode();
        }

        @Override
        public String toString() {
            return "[" + combinedDim + ", " + format(children) + "]";
        }
    }
}
