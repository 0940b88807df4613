package io.github.yok.scq.core.dispatch;

/**
 * 同期ディスパッチャで配信するトピックです。
 */
public enum DispatchTopic {

    /**
     * 構造更新（階層・切り詰め次元・変数変換・閉路ブランチの変更）です。
     */
    STRUCTURAL_UPDATE
}
