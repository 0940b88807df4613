package io.github.yok.scq.core.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 名前付きの可変プロパティ（値・更新種別・依存先）です。
 *
 * <p>
 * 依存先は同じ名前のプロパティを持つ子サブシステムの添字パスです。
 * </p>
 */
@Getter
@ToString
public final class PropertySlot {

    /**
     * プロパティ名です。
     */
    private final String name;

    /**
     * 更新種別です。
     */
    private final UpdateKind updateKind;

    /**
     * 現在値です。
     */
    @Setter(AccessLevel.PACKAGE)
    private Object value;

    /**
     * 依存先サブシステムの添字パスです。
     */
    @Getter(AccessLevel.NONE)
    private final List<List<Integer>> dependents = new ArrayList<>();

    PropertySlot(String name, UpdateKind updateKind, Object value) {
        this.name = name;
        this.updateKind = updateKind;
        this.value = value;
    }

    /**
     * 依存先の添字パスを返します。
     *
     * @return 依存先（読み取り専用）です
     */
    public List<List<Integer>> getDependents() {
        return Collections.unmodifiableList(dependents);
    }

    /**
     * 依存先を置き換えます。
     *
     * @param paths 依存先の添字パスです
     */
    public void replaceDependents(List<List<Integer>> paths) {
        dependents.clear();
        for (List<Integer> p : paths) {
            dependents.add(List.copyOf(p));
        }
    }
}
