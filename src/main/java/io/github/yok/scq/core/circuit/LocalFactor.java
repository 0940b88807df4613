package io.github.yok.scq.core.circuit;

import lombok.Value;

/**
 * 1 つの変数に作用する局所演算子 θ^p · e^{i a θ} · (n または Q)^q の指定です。
 *
 * <p>
 * 数値ハミルトニアン構築時のプレースホルダとして使い、{@link #toString()} をキャッシュのキーにします。
 * </p>
 */
@Value
public class LocalFactor {

    /**
     * θ の指数です。
     */
    int thetaPower;

    /**
     * 変位の係数 a です。
     */
    double displacement;

    /**
     * 運動量の指数です。
     */
    int momentumPower;

    /**
     * 単位演算子かどうかを返します。
     *
     * @return 単位演算子なら true です
     */
    public boolean isIdentity() {
        return thetaPower == 0 && displacement == 0.0 && momentumPower == 0;
    }

    @Override
    public String toString() {
        return "θ^" + thetaPower + "·exp(i" + displacement + "θ)·p^" + momentumPower;
    }
}
