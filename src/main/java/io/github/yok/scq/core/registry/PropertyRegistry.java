package io.github.yok.scq.core.registry;

import com.google.common.base.Preconditions;
import io.github.yok.scq.core.basis.ExtBasis;
import io.github.yok.scq.core.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.ToDoubleFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * 名前 → プロパティの対応と、更新種別 → 再生成処理の対応を保持するレジストリです。
 *
 * <p>
 * 書き込みは「検証 → 横断検証 → 保存 → 更新種別の処理」の順に行います。 検証に失敗した書き込みは拒否され、値は変わりません。
 * </p>
 */
@Slf4j
public final class PropertyRegistry {

    /**
     * 名前 → プロパティ（登録順）です。
     */
    private final Map<String, PropertySlot> slots = new LinkedHashMap<>();

    /**
     * 更新種別 → 再生成処理です。
     */
    private final Map<UpdateKind, Consumer<PropertySlot>> handlers = new EnumMap<>(UpdateKind.class);

    /**
     * 保存前に実行する横断検証です。
     */
    private final List<BiConsumer<PropertySlot, Object>> crossChecks = new ArrayList<>();

    /**
     * プロパティを登録します。
     *
     * @param name 名前です
     * @param initialValue 初期値です
     * @param updateKind 更新種別です
     * @return 登録したプロパティです
     * @throws IllegalArgumentException 同じ名前が登録済みの場合に発生します
     * @throws ValidationException 初期値が制約を満たさない場合に発生します
     */
    public PropertySlot makeProperty(String name, Object initialValue, UpdateKind updateKind) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "name は空不可です");
        Preconditions.checkArgument(updateKind != null, "updateKind は null 不可です");
        Preconditions.checkArgument(!slots.containsKey(name), "プロパティ名が重複しています: %s", name);
        PropertySlot slot = new PropertySlot(name, updateKind, normalize(name, updateKind, initialValue));
        slots.put(name, slot);
        return slot;
    }

    /**
     * 更新種別の再生成処理を設定します。
     *
     * @param kind 更新種別です
     * @param handler 再生成処理です
     */
    public void onUpdate(UpdateKind kind, Consumer<PropertySlot> handler) {
        handlers.put(kind, handler);
    }

    /**
     * 横断検証を追加します。
     *
     * @param check 書き込み前のプロパティと新しい値を受け取り、不正なら {@link ValidationException} を投げる処理です
     */
    public void addCrossCheck(BiConsumer<PropertySlot, Object> check) {
        crossChecks.add(check);
    }

    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    /**
     * プロパティを返します。
     *
     * @param name 名前です
     * @return プロパティです
     * @throws ValidationException 未登録の場合に発生します
     */
    public PropertySlot slot(String name) {
        PropertySlot slot = slots.get(name);
        if (slot == null) {
            throw new ValidationException("未登録のプロパティです: " + name);
        }
        return slot;
    }

    public Object get(String name) {
        return slot(name).getValue();
    }

    public double getDouble(String name) {
        Object v = get(name);
        if (!(v instanceof Double)) {
            throw new ValidationException("数値のプロパティではありません: " + name);
        }
        return (Double) v;
    }

    public int getInt(String name) {
        Object v = get(name);
        if (!(v instanceof Integer)) {
            throw new ValidationException("整数のプロパティではありません: " + name);
        }
        return (Integer) v;
    }

    public ExtBasis getExtBasis(String name) {
        Object v = get(name);
        if (!(v instanceof ExtBasis)) {
            throw new ValidationException("基底のプロパティではありません: " + name);
        }
        return (ExtBasis) v;
    }

    /**
     * パラメータ値を引く関数を返します（記号式の評価用）。
     *
     * @return 名前 → 値の関数です
     */
    public ToDoubleFunction<String> asLookup() {
        return this::getDouble;
    }

    /**
     * 値を書き込みます。
     *
     * @param name 名前です
     * @param value 新しい値です
     * @throws ValidationException 値が制約を満たさない場合に発生します
     */
    public void set(String name, Object value) {
        PropertySlot slot = slot(name);
        Object normalized = normalize(name, slot.getUpdateKind(), value);
        for (BiConsumer<PropertySlot, Object> check : crossChecks) {
            check.accept(slot, normalized);
        }
        Object previous = slot.getValue();
        slot.setValue(normalized);
        Consumer<PropertySlot> handler = handlers.get(slot.getUpdateKind());
        if (handler == null) {
            return;
        }
        try {
            handler.accept(slot);
        } catch (RuntimeException e) {
            // 再生成に失敗した場合は元の値に戻して再生成し直します。
            log.warn("再生成に失敗したため値を戻します: name={}, value={}", name, normalized);
            slot.setValue(previous);
            try {
                handler.accept(slot);
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
    }

    /**
     * 登録済みの名前を登録順に返します。
     *
     * @return 名前の集合です
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(slots.keySet()));
    }

    /**
     * 指定種別のプロパティの名前 → 値を登録順に返します。
     *
     * @param kind 更新種別です
     * @return 名前 → 値です
     */
    public Map<String, Object> values(UpdateKind kind) {
        Map<String, Object> out = new LinkedHashMap<>();
        slots.values().stream().filter(s -> s.getUpdateKind() == kind)
                .forEach(s -> out.put(s.getName(), s.getValue()));
        return out;
    }

    /**
     * 指定した名前以外のプロパティを削除します（構成の取り消し用）。
     *
     * @param keep 残す名前です
     */
    public void retainOnly(Set<String> keep) {
        slots.keySet().retainAll(keep);
    }

    /**
     * 更新種別ごとの制約で値を検証し、保存用の型へ正規化します。
     */
    private static Object normalize(String name, UpdateKind kind, Object value) {
        if (value == null) {
            throw new ValidationException(name + " に null は設定できません");
        }
        switch (kind) {
            case CUTOFFS: {
                if (!(value instanceof Number)) {
                    throw new ValidationException(name + " は正の整数が必要です: " + value);
                }
                double d = ((Number) value).doubleValue();
                if (!(d > 0) || d != Math.rint(d) || d > Integer.MAX_VALUE) {
                    throw new ValidationException(name + " は正の整数が必要です: " + value);
                }
                return (int) d;
            }
            case PARAM_VARS:
            case EXTERNAL_FLUX_OR_CHARGE: {
                if (!(value instanceof Number) || !Double.isFinite(((Number) value).doubleValue())) {
                    throw new ValidationException(name + " は有限の実数が必要です: " + value);
                }
                return ((Number) value).doubleValue();
            }
            default: {
                if (value instanceof ExtBasis) {
                    return value;
                }
                if (value instanceof String) {
                    try {
                        return ExtBasis.valueOf(((String) value).trim().toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new ValidationException(
                                name + " は DISCRETIZED または HARMONIC が必要です: " + value, e);
                    }
                }
                throw new ValidationException(name + " は DISCRETIZED または HARMONIC が必要です: " + value);
            }
        }
    }
}
