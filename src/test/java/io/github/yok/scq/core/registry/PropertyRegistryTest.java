package io.github.yok.scq.core.registry;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.basis.ExtBasis;
import io.github.yok.scq.core.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PropertyRegistryTest {

    private PropertyRegistry registry;

    private final List<String> updated = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new PropertyRegistry();
        registry.makeProperty("EJ", 10, UpdateKind.PARAM_VARS);
        registry.makeProperty("Φ1", 0.0, UpdateKind.EXTERNAL_FLUX_OR_CHARGE);
        registry.makeProperty("cutoff_n_1", 5, UpdateKind.CUTOFFS);
        registry.makeProperty("ext_basis", "harmonic", UpdateKind.EXT_BASIS);
        registry.onUpdate(UpdateKind.PARAM_VARS, s -> updated.add(s.getName()));
        registry.onUpdate(UpdateKind.CUTOFFS, s -> updated.add(s.getName()));
    }

    @Nested
    @DisplayName("登録")
    class Registration {

        @Test
        @DisplayName("値は種別ごとに正規化されます")
        void normalized() {
            assertThat(registry.get("EJ")).isEqualTo(10.0);
            assertThat(registry.getInt("cutoff_n_1")).isEqualTo(5);
            assertThat(registry.getExtBasis("ext_basis")).isEqualTo(ExtBasis.HARMONIC);
            assertThat(registry.names()).containsExactly("EJ", "Φ1", "cutoff_n_1", "ext_basis");
        }

        @Test
        @DisplayName("同じ名前は二重に登録できません")
        void duplicate() {
            assertThatThrownBy(() -> registry.makeProperty("EJ", 1.0, UpdateKind.PARAM_VARS))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("EJ");
        }

        @Test
        @DisplayName("未登録の名前は検証エラーです")
        void unknown() {
            assertThatThrownBy(() -> registry.get("EL")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("種別ごとの値を取り出せます")
        void valuesByKind() {
            assertThat(registry.values(UpdateKind.EXTERNAL_FLUX_OR_CHARGE)).containsOnlyKeys("Φ1");
            assertThat(registry.asLookup().applyAsDouble("EJ")).isEqualTo(10.0);
        }

        @Test
        @DisplayName("retainOnly は指定外の名前を削除します")
        void retainOnly() {
            registry.retainOnly(Set.of("EJ", "ext_basis"));
            assertThat(registry.names()).containsExactly("EJ", "ext_basis");
            assertThat(registry.contains("Φ1")).isFalse();
        }
    }

    @Nested
    @DisplayName("更新")
    class Update {

        @Test
        @DisplayName("更新すると種別のハンドラが呼ばれます")
        void handlerCalled() {
            registry.set("EJ", 3.5);
            registry.set("cutoff_n_1", 7.0);
            registry.set("Φ1", 0.5);
            assertThat(updated).containsExactly("EJ", "cutoff_n_1");
            assertThat(registry.getInt("cutoff_n_1")).isEqualTo(7);
            assertThat(registry.getDouble("Φ1")).isEqualTo(0.5);
        }

        @Test
        @DisplayName("不正な値は値を変えずに拒否します")
        void invalidValues() {
            assertThatThrownBy(() -> registry.set("cutoff_n_1", 0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.set("cutoff_n_1", 2.5))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.set("EJ", Double.NaN))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.set("EJ", "ten"))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.set("ext_basis", "fourier"))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.set("EJ", null))
                    .isInstanceOf(ValidationException.class);
            assertThat(registry.get("EJ")).isEqualTo(10.0);
            assertThat(registry.get("cutoff_n_1")).isEqualTo(5);
            assertThat(updated).isEmpty();
        }

        @Test
        @DisplayName("相互検証で拒否された値は反映されません")
        void crossCheckRejects() {
            registry.addCrossCheck((slot, value) -> {
                if (slot.getName().equals("cutoff_n_1") && (Integer) value > 10) {
                    throw new ValidationException("大きすぎます");
                }
            });
            assertThatThrownBy(() -> registry.set("cutoff_n_1", 11))
                    .isInstanceOf(ValidationException.class);
            assertThat(registry.getInt("cutoff_n_1")).isEqualTo(5);
        }

        @Test
        @DisplayName("ハンドラが失敗すると元の値に戻します")
        void handlerFailureRestores() {
            List<Object> seen = new ArrayList<>();
            registry.onUpdate(UpdateKind.PARAM_VARS, s -> {
                seen.add(s.getValue());
                if ((Double) s.getValue() < 0) {
                    throw new IllegalStateException("負の値です");
                }
            });
            assertThatThrownBy(() -> registry.set("EJ", -1.0))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(registry.get("EJ")).isEqualTo(10.0);
            assertThat(seen).containsExactly(-1.0, 10.0);
        }
    }

    @Test
    @DisplayName("依存先のパスを置き換えられます")
    void dependents() {
        PropertySlot slot = registry.slot("EJ");
        slot.replaceDependents(List.of(List.of(0), List.of(1, 0)));
        assertThat(slot.getDependents()).containsExactly(List.of(0), List.of(1, 0));
        assertThatThrownBy(() -> slot.getDependents().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
