package io.github.yok.scq.core.exception;

/**
 * 回路モデルの処理で発生する例外の基底クラスです。
 *
 * <p>
 * 非検査例外として扱い、呼び出し側は必要な箇所で個別の派生型を捕捉します。
 * </p>
 */
public class CircuitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * メッセージを指定して例外を生成します。
     *
     * @param message メッセージです
     */
    public CircuitException(String message) {
        super(message);
    }

    /**
     * メッセージと原因を指定して例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public CircuitException(String message, Throwable cause) {
        super(message, cause);
    }
}
