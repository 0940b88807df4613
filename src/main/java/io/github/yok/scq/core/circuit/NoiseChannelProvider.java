package io.github.yok.scq.core.circuit;

import java.util.List;

/**
 * 対応する雑音チャネル名を列挙する能力です（コヒーレンス時間の計算式は扱いません）。
 */
public interface NoiseChannelProvider {

    /**
     * 対応する雑音チャネル名を返します。
     *
     * @return チャネル名の一覧です
     */
    List<String> supportedNoiseChannels();
}
