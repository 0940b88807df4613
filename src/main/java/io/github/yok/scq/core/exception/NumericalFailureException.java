package io.github.yok.scq.core.exception;

import java.util.List;
import lombok.Getter;

/**
 * 固有分解が代替手段を含めて失敗した場合の例外です。
 *
 * <p>
 * 行列サイズ・要求固有値数・試行したソルバ名を保持します。
 * </p>
 */
@Getter
public class NumericalFailureException extends CircuitException {

    private static final long serialVersionUID = 1L;

    /**
     * 対象行列の次元です。
     */
    private final int matrixSize;

    /**
     * 要求された固有値の個数です。
     */
    private final int requestedCount;

    /**
     * 試行したソルバ名の一覧です（試行順）。
     */
    private final List<String> attemptedSolvers;

    /**
     * 診断情報付きの例外を生成します。
     *
     * @param matrixSize 行列の次元です
     * @param requestedCount 要求固有値数です
     * @param attemptedSolvers 試行したソルバ名です
     */
    public NumericalFailureException(int matrixSize, int requestedCount,
            List<String> attemptedSolvers) {
        super("固有分解に失敗しました: size=" + matrixSize + ", requested=" + requestedCount
                + ", solvers=" + attemptedSolvers);
        this.matrixSize = matrixSize;
        this.requestedCount = requestedCount;
        this.attemptedSolvers = List.copyOf(attemptedSolvers);
    }
}
