package io.github.yok.scq.core.symbolic;

import static org.assertj.core.api.Assertions.*;

import io.github.yok.scq.core.exception.ExpressionParseException;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpressionParserTest {

    private static final Map<String, Double> VALUES =
            Map.of("EC", 1.0, "EL", 10.0, "EJ", 4.0, "Φ1", 0.25);

    private static Optional<Term> termWithKey(Expression e, String key) {
        return e.getTerms().stream().filter(t -> t.operatorKey().equals(key)).findFirst();
    }

    private static double coefficientOf(Expression e, String key) {
        return termWithKey(e, key).orElseThrow().getCoefficient().evaluate(VALUES::get);
    }

    @Nested
    @DisplayName("正常系")
    class Valid {

        @Test
        @DisplayName("fluxonium のハミルトニアンを項に分解します")
        void fluxonium() {
            Expression e = ExpressionParser.parse("4*EC*Q1^2 + 0.5*EL*θ1^2 - EJ*cos(θ1 + Φ1)");
            assertThat(e.getTerms()).hasSize(3);
            assertThat(coefficientOf(e, "Q1^2")).isCloseTo(4.0, within(1e-15));
            assertThat(coefficientOf(e, "θ1^2")).isCloseTo(5.0, within(1e-15));
            assertThat(coefficientOf(e, "cos(1.0*θ1 + Φ1)")).isCloseTo(-4.0, within(1e-15));
            assertThat(e.parameterSymbols()).containsExactly("EC", "EJ", "EL", "Φ1");
            assertThat(e.variables()).containsExactly(1);
        }

        @Test
        @DisplayName("積を展開して同類項をまとめます")
        void expandsProducts() {
            Expression e = ExpressionParser.parse("EC*(n1 - n2)**2");
            assertThat(e.getTerms()).hasSize(3);
            assertThat(coefficientOf(e, "n1^2")).isEqualTo(1.0);
            assertThat(coefficientOf(e, "n1*n2")).isEqualTo(-2.0);
            assertThat(coefficientOf(e, "n2^2")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("theta 表記と θ 表記を同じ演算子として扱います")
        void thetaAliases() {
            Expression e = ExpressionParser.parse("EL*theta1^2 + EL*θ1^2");
            assertThat(e.getTerms()).hasSize(1);
            assertThat(coefficientOf(e, "θ1^2")).isEqualTo(20.0);
        }

        @Test
        @DisplayName("パラメータだけの割り算と関数は係数に残ります")
        void scalarDivisionAndFunctions() {
            Expression e = ExpressionParser.parse("EL/2*θ1^2 + sqrt(EC)*Q1^2 + 3");
            assertThat(coefficientOf(e, "θ1^2")).isCloseTo(5.0, within(1e-15));
            assertThat(coefficientOf(e, "Q1^2")).isCloseTo(1.0, within(1e-15));
            assertThat(coefficientOf(e, "")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("三角関数の引数の θ 係数を合算します")
        void trigCoefficients() {
            Expression e = ExpressionParser.parse("cos(2*θ1 - θ2 + θ1)");
            TrigFactor f = e.getTerms().get(0).getTrigFactors().get(0);
            assertThat(f.getKind()).isEqualTo(TrigFactor.Kind.COS);
            assertThat(f.getCoefficients()).containsEntry(1, 3.0).containsEntry(2, -1.0);
            assertThat(e.operatorSymbols()).containsExactly(OperatorSymbol.theta(1),
                    OperatorSymbol.theta(2));
        }

        @Test
        @DisplayName("文字列表現は再解析しても同じ式になります")
        void renderingReparses() {
            Expression e = ExpressionParser.parse("4*EC*Q1^2 + 0.5*EL*θ1^2 - EJ*cos(θ1 + Φ1)");
            assertThat(ExpressionParser.parse(e.toString())).isEqualTo(e);
        }
    }

    @Nested
    @DisplayName("異常系")
    class Invalid {

        @Test
        @DisplayName("空文字列は位置 0 のエラーです")
        void empty() {
            assertThatThrownBy(() -> ExpressionParser.parse(" "))
                    .isInstanceOf(ExpressionParseException.class)
                    .extracting(e -> ((ExpressionParseException) e).getPosition()).isEqualTo(0);
        }

        @Test
        @DisplayName("演算子による割り算は拒否します")
        void divisionByOperator() {
            assertThatThrownBy(() -> ExpressionParser.parse("EC/n1"))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageContaining("演算子で割ることはできません");
        }

        @Test
        @DisplayName("演算子の負や非整数の指数は拒否します")
        void invalidOperatorPower() {
            assertThatThrownBy(() -> ExpressionParser.parse("θ1^-1"))
                    .isInstanceOf(ExpressionParseException.class);
            assertThatThrownBy(() -> ExpressionParser.parse("θ1^0.5"))
                    .isInstanceOf(ExpressionParseException.class);
        }

        @Test
        @DisplayName("三角関数の引数が θ の線形結合でなければ拒否します")
        void nonLinearTrigArgument() {
            assertThatThrownBy(() -> ExpressionParser.parse("cos(θ1^2)"))
                    .isInstanceOf(ExpressionParseException.class);
            assertThatThrownBy(() -> ExpressionParser.parse("cos(EJ*θ1)"))
                    .isInstanceOf(ExpressionParseException.class);
            assertThatThrownBy(() -> ExpressionParser.parse("cos(n1)"))
                    .isInstanceOf(ExpressionParseException.class);
        }

        @Test
        @DisplayName("閉じ括弧の欠落や余分な文字を位置付きで報告します")
        void unbalanced() {
            assertThatThrownBy(() -> ExpressionParser.parse("2*(EC + n1"))
                    .isInstanceOf(ExpressionParseException.class).hasMessageContaining("')'");
            assertThatThrownBy(() -> ExpressionParser.parse("EC n1"))
                    .isInstanceOf(ExpressionParseException.class)
                    .extracting(e -> ((ExpressionParseException) e).getPosition()).isEqualTo(3);
        }

        @Test
        @DisplayName("未対応の関数は拒否します")
        void unknownFunction() {
            assertThatThrownBy(() -> ExpressionParser.parse("tan(θ1)"))
                    .isInstanceOf(ExpressionParseException.class);
            assertThatThrownBy(() -> ExpressionParser.parse("log(EC)"))
                    .isInstanceOf(ExpressionParseException.class);
        }
    }
}
