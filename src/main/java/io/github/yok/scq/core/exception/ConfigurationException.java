package io.github.yok.scq.core.exception;

/**
 * 回路の構成（階層・切り詰め次元・変数変換・閉路ブランチ・基底）が不正な場合の例外です。
 *
 * <p>
 * configure の途中で発生した場合、回路は呼び出し前の状態へ戻されます。
 * </p>
 */
public class ConfigurationException extends CircuitException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
