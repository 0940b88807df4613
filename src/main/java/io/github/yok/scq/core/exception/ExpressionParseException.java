package io.github.yok.scq.core.exception;

import lombok.Getter;

/**
 * ハミルトニアン文字列の構文が不正な場合の例外です。
 */
@Getter
public class ExpressionParseException extends CircuitException {

    private static final long serialVersionUID = 1L;

    /**
     * エラー位置（0 始まりの文字オフセット）です。
     */
    private final int position;

    /**
     * 位置と理由を指定して例外を生成します。
     *
     * @param position エラー位置です
     * @param reason 理由です
     */
    public ExpressionParseException(int position, String reason) {
        super("式の解析に失敗しました（位置 " + position + "）: " + reason);
        this.position = position;
    }
}
