package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Value;

/**
 * 回路の直列化データです。
 *
 * <p>
 * 構築時の引数（initParams）と、構築後に変更された属性（modifiedAttributes）からなります。 復元は構築 → 構成 → 値の書き込み → 階層の構成の順に行います。
 * </p>
 */
@Value
public class CircuitSnapshot {

    /**
     * 構築時の引数です（ext_basis, input_string, truncated_dim, harmonic_fast_path, harmonic_tolerance）。
     */
    Map<String, Object> initParams;

    /**
     * 変更された属性です（パラメータ・磁束・電荷・打ち切りの値、階層、打ち切り次元、変換行列、閉路枝、離散化範囲）。
     */
    Map<String, Object> modifiedAttributes;

    /**
     * 変数変換行列を返します。
     *
     * @return 変数変換行列です（記録されていなければ null）
     * @throws ConfigurationException 値が行列でない場合に発生します
     */
    public double[][] transformationMatrix() {
        Object raw = modifiedAttributes.get("transformation_matrix");
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof double[][])) {
            throw new ConfigurationException("transformation_matrix が行列ではありません: " + raw);
        }
        return (double[][]) raw;
    }

    /**
     * 閉路枝の識別子を返します。
     *
     * @return 閉路枝の識別子です（記録されていなければ空）
     * @throws ConfigurationException 識別子の形式が不正な場合に発生します
     */
    public List<ClosureBranchId> closureBranchIds() {
        Object raw = modifiedAttributes.get("closure_branches_data");
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List)) {
            throw new ConfigurationException("closure_branches_data が一覧ではありません: " + raw);
        }
        List<ClosureBranchId> out = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            // [node1, node2, type, params] の 4 要素を検査します。
            if (!(item instanceof List) || ((List<?>) item).size() != 4) {
                throw new ConfigurationException("閉路枝の識別子が不正です: " + item);
            }
            List<?> id = (List<?>) item;
            if (!(id.get(0) instanceof Number) || !(id.get(1) instanceof Number)
                    || !(id.get(2) instanceof String) || !(id.get(3) instanceof List)) {
                throw new ConfigurationException("閉路枝の識別子が不正です: " + item);
            }
            List<String> params = new ArrayList<>();
            for (Object p : (List<?>) id.get(3)) {
                if (!(p instanceof String)) {
                    throw new ConfigurationException("閉路枝のパラメータ名が不正です: " + item);
                }
                params.add((String) p);
            }
            out.add(new ClosureBranchId(((Number) id.get(0)).intValue(),
                    ((Number) id.get(1)).intValue(), (String) id.get(2), List.copyOf(params)));
        }
        return out;
    }

    /**
     * 変数番号ごとの離散化範囲を返します。
     *
     * @return 変数番号 → [下端, 上端] です（記録されていなければ空）
     * @throws ConfigurationException 値の形式が不正な場合に発生します
     */
    public Map<Integer, double[]> discretizedPhiRanges() {
        Object raw = modifiedAttributes.get("discretized_phi_range");
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map)) {
            throw new ConfigurationException("discretized_phi_range が対応表ではありません: " + raw);
        }
        Map<Integer, double[]> out = new TreeMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) raw).entrySet()) {
            if (!(e.getKey() instanceof Number) || !(e.getValue() instanceof double[])) {
                throw new ConfigurationException("離散化範囲の形式が不正です: " + e.getKey());
            }
            out.put(((Number) e.getKey()).intValue(), (double[]) e.getValue());
        }
        return out;
    }

    /**
     * 閉路枝の識別子（両端の節点・種類・パラメータ名）です。
     */
    @Value
    public static class ClosureBranchId {

        int node1;

        int node2;

        String type;

        List<String> params;
    }
}
