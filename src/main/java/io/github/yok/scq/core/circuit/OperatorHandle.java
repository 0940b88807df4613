package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.linearalgebra.ComplexMatrix;
import java.util.function.Supplier;
import lombok.Value;

/**
 * 名前付きの演算子生成器です。
 */
@Value
public class OperatorHandle {

    /**
     * 演算子名（例: n1, cos(θ1)）です。
     */
    String name;

    /**
     * 生成器です。
     */
    Supplier<ComplexMatrix> generator;

    /**
     * 現在の状態で演算子を生成します。
     *
     * @return 演算子です
     */
    public ComplexMatrix generate() {
        return generator.get();
    }
}
