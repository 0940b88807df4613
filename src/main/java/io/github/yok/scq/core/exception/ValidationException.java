package io.github.yok.scq.core.exception;

/**
 * プロパティへの書き込み値が制約を満たさない場合の例外です。
 *
 * <p>
 * 書き込みは拒否され、既存の値はそのまま残ります。
 * </p>
 */
public class ValidationException extends CircuitException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
