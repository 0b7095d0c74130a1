package com.kinetic.modeller.parser;

import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.parser.RateLawToken.TokenType;
import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Tokenizer for rate-law expressions.
 *
 * Identifiers may contain dots so that names such as {@code glc.D} or
 * {@code math.exp} stay single tokens. Names may also start with digits ({@code 3PG}).
 */
public class RateLawTokenizer {

    private final String source;
    private int pos = 0;

    public RateLawTokenizer(String source) {
        this.source = source;
    }

    public List<RateLawToken> tokenize() {
        List<RateLawToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new RateLawToken(TokenType.EOF, "", source.length(), source.length()));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private RateLawToken nextToken() {
        char c = source.charAt(pos);
        int start = pos;

        if (Character.isDigit(c) && startsIdentifier(pos)) {
            return readIdentifier(start);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber(start);
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifier(start);
        }

        switch (c) {
            case '+':
                return single(TokenType.PLUS, start);
            case '-':
                return single(TokenType.MINUS, start);
            case '/':
                return single(TokenType.SLASH, start);
            case '^':
                return single(TokenType.POWER, start);
            case '(':
                return single(TokenType.LPAREN, start);
            case ')':
                return single(TokenType.RPAREN, start);
            case '[':
                return single(TokenType.LBRACKET, start);
            case ']':
                return single(TokenType.RBRACKET, start);
            case ',':
                return single(TokenType.COMMA, start);
            case '*':
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '*') {
                    pos += 2;
                    return new RateLawToken(TokenType.POWER, "**", start, pos);
                }
                return single(TokenType.STAR, start);
            default:
                throw new ParseException("Unexpected character '" + c + "' at column " + (start + 1) + " in rate law: " + source);
        }
    }

    /**
     * A digit run followed directly by a letter or underscore is a name such as {@code 3PG},
     * unless the letter opens an exponent ({@code 2e5}, {@code 1E-3}).
     */
    private boolean startsIdentifier(int from) {
        int i = from;
        while (i < source.length() && Character.isDigit(source.charAt(i))) {
            i++;
        }
        if (i >= source.length()) {
            return false;
        }
        char c = source.charAt(i);
        if (c == 'e' || c == 'E') {
            int j = i + 1;
            if (j < source.length() && (source.charAt(j) == '+' || source.charAt(j) == '-')) {
                j++;
            }
            if (j < source.length() && Character.isDigit(source.charAt(j))) {
                return false;
            }
        }
        return Character.isLetter(c) || c == '_';
    }

    private RateLawToken single(TokenType type, int start) {
        pos++;
        return new RateLawToken(type, source.substring(start, pos), start, pos);
    }

    private RateLawToken readNumber(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                // Not an exponent, leave the 'e' for the next token
                pos = mark;
            }
        }
        return new RateLawToken(TokenType.NUMBER, source.substring(start, pos), start, pos);
    }

    private RateLawToken readIdentifier(int start) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        return new RateLawToken(TokenType.IDENTIFIER, source.substring(start, pos), start, pos);
    }
}
