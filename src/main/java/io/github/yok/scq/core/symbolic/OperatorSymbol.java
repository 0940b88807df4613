package io.github.yok.scq.core.symbolic;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * ハミルトニアン中の演算子記号（θ<i>, n<i>, Q<i>）を表すクラスです。
 *
 * <p>
 * 変数番号の昇順、同じ番号では θ, n, Q の順に並びます。
 * </p>
 */
@Value
public class OperatorSymbol implements Comparable<OperatorSymbol> {

    private static final Pattern PATTERN = Pattern.compile("^(θ|theta|n|Q)(\\d+)$");

    /**
     * 演算子の種類です。
     */
    Kind kind;

    /**
     * 変数番号です（1 始まり）。
     */
    int index;

    /**
     * 記号名が演算子記号であれば解析して返します。
     *
     * @param name 記号名です
     * @return 演算子記号です（演算子でなければ空）
     */
    public static Optional<OperatorSymbol> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Matcher m = PATTERN.matcher(name);
        if (!m.matches()) {
            return Optional.empty();
        }
        Kind kind;
        switch (m.group(1)) {
            case "n":
                kind = Kind.CHARGE;
                break;
            case "Q":
                kind = Kind.EXTENDED_CHARGE;
                break;
            default:
                kind = Kind.THETA;
                break;
        }
        return Optional.of(new OperatorSymbol(kind, Integer.parseInt(m.group(2))));
    }

    public static OperatorSymbol theta(int index) {
        return new OperatorSymbol(Kind.THETA, index);
    }

    public static OperatorSymbol charge(int index) {
        return new OperatorSymbol(Kind.CHARGE, index);
    }

    public static OperatorSymbol extendedCharge(int index) {
        return new OperatorSymbol(Kind.EXTENDED_CHARGE, index);
    }

    /**
     * 共役運動量（n または Q）かどうかを返します。
     *
     * @return 運動量演算子なら true です
     */
    public boolean isMomentum() {
        return kind != Kind.THETA;
    }

    @Override
    public int compareTo(OperatorSymbol o) {
        int c = Integer.compare(index, o.index);
        return (c != 0) ? c : kind.compareTo(o.kind);
    }

    @Override
    public String toString() {
        return kind.getPrefix() + index;
    }

    /**
     * 演算子の種類です。
     */
    public enum Kind {
        /**
         * 位相（磁束）変数 θ です。
         */
        THETA("θ"),
        /**
         * 周期変数の電荷数 n です。
         */
        CHARGE("n"),
        /**
         * 拡張変数の電荷 Q です。
         */
        EXTENDED_CHARGE("Q");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }
}
