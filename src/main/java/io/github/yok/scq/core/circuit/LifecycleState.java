package io.github.yok.scq.core.circuit;

/**
 * 回路・サブシステムの構成状態です。
 */
public enum LifecycleState {

    /**
     * 未構成です。
     */
    UNCONFIGURED,

    /**
     * 構成済みで、演算子を要求できます。
     */
    CONFIGURED,

    /**
     * 構造変更の通知を受け、再構築待ちです。
     */
    OUT_OF_SYNC,

    /**
     * 構成中です（再入不可）。
     */
    REBUILDING
}
