package io.github.yok.scq.core.symbolic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 変数分類（分類 → 変数番号の集合）を保持する不変クラスです。
 *
 * <p>
 * 1 つの変数番号は高々 1 つの分類に属します。
 * </p>
 */
public final class VariableCategories {

    /**
     * 分類 → 変数番号（昇順）です。
     */
    private final Map<VariableCategory, SortedSet<Integer>> indices;

    private VariableCategories(Map<VariableCategory, SortedSet<Integer>> indices) {
        this.indices = indices;
    }

    /**
     * 分類ごとの変数番号から生成します。
     *
     * @param source 分類 → 変数番号です
     * @return 変数分類です
     * @throws IllegalArgumentException 同じ変数番号が複数の分類に属する場合に発生します
     */
    public static VariableCategories of(Map<VariableCategory, ? extends Collection<Integer>> source) {
        EnumMap<VariableCategory, SortedSet<Integer>> map = new EnumMap<>(VariableCategory.class);
        TreeSet<Integer> seen = new TreeSet<>();
        for (VariableCategory c : VariableCategory.values()) {
            Collection<? extends Integer> src = source.get(c);
            TreeSet<Integer> set = new TreeSet<>();
            if (src != null) {
                set.addAll(src);
            }
            for (Integer i : set) {
                if (!seen.add(i)) {
                    throw new IllegalArgumentException("変数番号が複数の分類に属しています: " + i);
                }
            }
            map.put(c, Collections.unmodifiableSortedSet(set));
        }
        return new VariableCategories(map);
    }

    /**
     * 指定分類の変数番号を返します。
     *
     * @param category 分類です
     * @return 変数番号（昇順）です
     */
    public SortedSet<Integer> indices(VariableCategory category) {
        return indices.get(category);
    }

    /**
     * 周期変数・拡張変数（演算子を持つ変数）の番号を昇順で返します。
     *
     * @return 変数番号の一覧です
     */
    public List<Integer> dynamicIndices() {
        TreeSet<Integer> out = new TreeSet<>(indices.get(VariableCategory.PERIODIC));
        out.addAll(indices.get(VariableCategory.EXTENDED));
        return new ArrayList<>(out);
    }

    /**
     * 変数番号の分類を返します。
     *
     * @param index 変数番号です
     * @return 分類です（未分類なら空）
     */
    public Optional<VariableCategory> categoryOf(int index) {
        for (Map.Entry<VariableCategory, SortedSet<Integer>> e : indices.entrySet()) {
            if (e.getValue().contains(index)) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * 指定した変数番号だけに絞り込んだ分類を返します。
     *
     * @param keep 残す変数番号です
     * @return 絞り込んだ変数分類です
     */
    public VariableCategories filter(Collection<Integer> keep) {
        EnumMap<VariableCategory, List<Integer>> map = new EnumMap<>(VariableCategory.class);
        indices.forEach((c, set) -> {
            List<Integer> kept = new ArrayList<>();
            for (Integer i : set) {
                if (keep.contains(i)) {
                    kept.add(i);
                }
            }
            map.put(c, kept);
        });
        return of(map);
    }

    /**
     * この分類が other の部分集合（各分類ごと）かどうかを返します。
     *
     * @param other 比較対象です
     * @return 部分集合なら true です
     */
    public boolean isSubsetOf(VariableCategories other) {
        for (VariableCategory c : VariableCategory.values()) {
            if (!other.indices(c).containsAll(indices(c))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return (obj instanceof VariableCategories)
                && indices.equals(((VariableCategories) obj).indices);
    }

    @Override
    public int hashCode() {
        return indices.hashCode();
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
