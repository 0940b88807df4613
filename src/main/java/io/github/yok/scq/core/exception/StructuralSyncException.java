package io.github.yok.scq.core.exception;

/**
 * 構造更新により同期が外れたサブシステムへ演算子を要求した場合の例外です。
 */
public class StructuralSyncException extends CircuitException {

    private static final long serialVersionUID = 1L;

    public StructuralSyncException(String message) {
        super(message);
    }
}
