package io.github.yok.scq.core.circuit;

import java.util.List;
import lombok.Value;

/**
 * 回路グラフの枝（ノード対・素子種別・パラメータ名）です。
 */
@Value
public class Branch {

    int node1;

    int node2;

    /**
     * 素子種別（C, L, JJ など）です。
     */
    String type;

    /**
     * パラメータ名です。
     */
    List<String> params;

    public Branch(int node1, int node2, String type, List<String> params) {
        this.node1 = node1;
        this.node2 = node2;
        this.type = type;
        this.params = List.copyOf(params);
    }

    /**
     * 直列化用の識別子 [node1, node2, type, params] を返します。
     *
     * @return 識別子です
     */
    public List<Object> toIdentifier() {
        return List.of(node1, node2, type, params);
    }
}
