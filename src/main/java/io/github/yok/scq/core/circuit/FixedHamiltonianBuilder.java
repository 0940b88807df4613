package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.exception.ConfigurationException;
import io.github.yok.scq.core.symbolic.Expression;
import io.github.yok.scq.core.symbolic.ExpressionClassifier;
import io.github.yok.scq.core.symbolic.ExpressionParser;
import io.github.yok.scq.core.symbolic.VariableCategories;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 記号ハミルトニアンの文字列をそのまま使うビルダーです。
 *
 * <p>
 * 回路グラフを持たないため、変数変換行列は単位行列に固定され、閉路枝も指定できません。
 * </p>
 */
public final class FixedHamiltonianBuilder implements SymbolicCircuitBuilder {

    private final String text;

    private final Expression hamiltonian;

    private final VariableCategories categories;

    private final Map<String, Double> parameterDefaults;

    /**
     * ビルダーを生成します。
     *
     * @param text 記号ハミルトニアンの文字列です
     * @param parameterDefaults パラメータの既定値です
     * @throws io.github.yok.scq.core.exception.ExpressionParseException 文字列を解釈できない場合に発生します
     */
    public FixedHamiltonianBuilder(String text, Map<String, Double> parameterDefaults) {
        if (text == null) {
            throw new IllegalArgumentException("text は null 不可です");
        }
        this.text = text;
        this.hamiltonian = ExpressionParser.parse(text);
        this.categories = ExpressionClassifier.categorize(hamiltonian);
        this.parameterDefaults = new LinkedHashMap<>(
                (parameterDefaults != null) ? parameterDefaults : Map.of());
    }

    @Override
    public SymbolicCircuit derive(double[][] transformationMatrix, List<Branch> closureBranches) {
        int n = variableCount();
        if (transformationMatrix != null && !isIdentity(transformationMatrix, n)) {
            throw new ConfigurationException("記号ハミルトニアンから生成した回路では変数変換行列を変更できません");
        }
        if (closureBranches != null && !closureBranches.isEmpty()) {
            throw new ConfigurationException("記号ハミルトニアンから生成した回路では閉路枝を指定できません");
        }
        return new SymbolicCircuit(hamiltonian, categories,
                ExpressionClassifier.externalFluxes(hamiltonian),
                ExpressionClassifier.offsetCharges(hamiltonian), Map.copyOf(parameterDefaults),
                identity(n), List.of());
    }

    @Override
    public List<Branch> branches() {
        return List.of();
    }

    @Override
    public boolean isFluxDynamic() {
        return false;
    }

    @Override
    public Optional<Branch> findBranch(int node1, int node2, String type, List<String> params) {
        return Optional.empty();
    }

    @Override
    public String inputString() {
        return text;
    }

    private int variableCount() {
        return hamiltonian.variables().isEmpty() ? 0 : hamiltonian.variables().last();
    }

    private static double[][] identity(int n) {
        double[][] m = new double[n][n];
        for (int i = 0; i < n; i++) {
            m[i][i] = 1.0;
        }
        return m;
    }

    private static boolean isIdentity(double[][] m, int n) {
        if (m.length != n) {
            return false;
        }
        for (int i = 0; i < n; i++) {
            if (m[i].length != n) {
                return false;
            }
            for (int j = 0; j < n; j++) {
                if (m[i][j] != ((i == j) ? 1.0 : 0.0)) {
                    return false;
                }
            }
        }
        return true;
    }
}
