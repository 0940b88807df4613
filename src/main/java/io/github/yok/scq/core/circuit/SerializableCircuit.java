package io.github.yok.scq.core.circuit;

/**
 * 直列化データへの変換能力です。
 */
public interface SerializableCircuit {

    /**
     * 直列化データを返します。
     *
     * @return 直列化データです
     */
    CircuitSnapshot serialize();
}
