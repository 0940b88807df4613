package io.github.yok.scq.core.hierarchy;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.exception.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SystemHierarchyTest {

    @Nested
    @DisplayName("解析")
    class Parse {

        @Test
        @DisplayName("入れ子のリスト表記を葉とグループに分けます")
        void nested() {
            SystemHierarchy h = SystemHierarchy.parse("[[1], [[2], [3, 4]]]");
            assertThat(h.getEntries()).hasSize(2);
            assertThat(h.getEntries().get(0)).isEqualTo(new HierarchyNode.Leaf(List.of(1)));
            assertThat(h.getEntries().get(1).isGroup()).isTrue();
            assertThat(h.allIndices()).containsExactly(1, 2, 3, 4);
            assertThat(h).hasToString("[[1], [[2], [3, 4]]]");
        }

        @Test
        @DisplayName("文字列表現は再解析しても同じ階層になります")
        void reparse() {
            SystemHierarchy h = SystemHierarchy.parse(" [ [1,2] , [[3],[4]] ] ");
            assertThat(SystemHierarchy.parse(h.toString())).isEqualTo(h);
        }

        @Test
        @DisplayName("入れ子の Java リストからも生成できます")
        void fromNested() {
            SystemHierarchy h = SystemHierarchy.fromNested(List.of(List.of(1, 2), List.of(3)));
            assertThat(h).isEqualTo(SystemHierarchy.parse("[[1, 2], [3]]"));
        }

        @Test
        @DisplayName("不正な表記は構成エラーです")
        void invalid() {
            assertThatThrownBy(() -> SystemHierarchy.parse("[[1], [2]"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> SystemHierarchy.parse("[[1], [2]] x"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> SystemHierarchy.parse("[[1, [2]]]"))
                    .isInstanceOf(ConfigurationException.class).hasMessageContaining("混在");
            assertThatThrownBy(() -> SystemHierarchy.parse("[1, 2]"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> SystemHierarchy.parse("[]"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> SystemHierarchy.parse(""))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("分割の検証")
    class Partition {

        @Test
        @DisplayName("全変数を重複なく覆えば通ります")
        void valid() {
            assertThatCode(() -> SystemHierarchy.parse("[[1], [[2], [3]]]")
                    .checkPartition(List.of(1, 2, 3))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("重複・欠落・未知の番号を拒否します")
        void invalid() {
            assertThatThrownBy(() -> SystemHierarchy.parse("[[1, 2], [2, 3]]")
                    .checkPartition(List.of(1, 2, 3))).isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("重複");
            assertThatThrownBy(() -> SystemHierarchy.parse("[[1], [2]]")
                    .checkPartition(List.of(1, 2, 3))).isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("[3]");
            assertThatThrownBy(() -> SystemHierarchy.parse("[[1], [2], [5]]")
                    .checkPartition(List.of(1, 2, 3))).isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("5");
        }
    }
}
