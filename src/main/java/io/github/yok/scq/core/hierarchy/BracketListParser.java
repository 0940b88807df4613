package io.github.yok.scq.core.hierarchy;

import io.github.yok.scq.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;

/**
 * "[[1], [2, 3]]" のような入れ子リスト表記を、Integer と List の入れ子に変換します。
 */
final class BracketListParser {

    private final String text;

    private int pos;

    private BracketListParser(String text) {
        this.text = text;
    }

    /**
     * 入れ子リスト表記を解析します。
     *
     * @param text 表記です
     * @return 要素が Integer または List の入れ子リストです
     * @throws ConfigurationException 表記が不正な場合に発生します
     */
    static List<Object> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("リスト表記が空です");
        }
        BracketListParser p = new BracketListParser(text);
        p.skipSpaces();
        List<Object> result = p.parseList();
        p.skipSpaces();
        if (p.pos != text.length()) {
            throw new ConfigurationException("リスト表記の末尾に余分な文字があります: " + text);
        }
        return result;
    }

    private List<Object> parseList() {
        expect('[');
        List<Object> out = new ArrayList<>();
        skipSpaces();
        if (peek() == ']') {
            pos++;
            return out;
        }
        while (true) {
            skipSpaces();
            char c = peek();
            if (c == '[') {
                out.add(parseList());
            } else if (Character.isDigit(c) || c == '-') {
                out.add(parseInt());
            } else {
                throw new ConfigurationException("リスト表記が不正です（位置 " + pos + "）: " + text);
            }
            skipSpaces();
            if (peek() == ',') {
                pos++;
            } else {
                expect(']');
                return out;
            }
        }
    }

    private int parseInt() {
        int start = pos;
        if (peek() == '-') {
            pos++;
        }
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        try {
            return Integer.parseInt(text.substring(start, pos));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("整数として解釈できません: " + text.substring(start, pos), e);
        }
    }

    private char peek() {
        if (pos >= text.length()) {
            throw new ConfigurationException("リスト表記が途中で終わっています: " + text);
        }
        return text.charAt(pos);
    }

    private void expect(char c) {
        if (peek() != c) {
            throw new ConfigurationException("'" + c + "' が必要です（位置 " + pos + "）: " + text);
        }
        pos++;
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
