package io.github.yok.scq.core.registry;

/**
 * プロパティ書き込み後に実行する再生成処理の種類です。
 */
public enum UpdateKind {

    /**
     * 打ち切りに依存する演算子の再生成です。
     */
    CUTOFFS,

    /**
     * 回路パラメータに依存するハミルトニアンの再生成です。
     */
    PARAM_VARS,

    /**
     * 外部磁束・オフセット電荷に依存するハミルトニアンの再生成です。
     */
    EXTERNAL_FLUX_OR_CHARGE,

    /**
     * 拡張変数の基底に依存する演算子の再生成です。
     */
    EXT_BASIS
}
