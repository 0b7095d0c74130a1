package com.kinetic.modeller.parser;

import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.model.expression.BinaryNode;
import com.kinetic.modeller.model.expression.BinaryNode.Operator;
import com.kinetic.modeller.model.expression.ExpressionNode;
import com.kinetic.modeller.model.expression.FunctionNode;
import com.kinetic.modeller.model.expression.IdentifierNode;
import com.kinetic.modeller.model.expression.MathFunction;
import com.kinetic.modeller.model.expression.NumberNode;
import com.kinetic.modeller.model.expression.SlotNode;
import com.kinetic.modeller.model.expression.UnaryNode;
import com.kinetic.modeller.parser.RateLawToken.TokenType;
import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Recursive-descent parser turning rate-law tokens into an expression tree.
 *
 * Grammar:
 *   expr    := term (('+' | '-') term)*
 *   term    := unary (('*' | '/') unary)*
 *   unary   := ('+' | '-') unary | power
 *   power   := primary (('**' | '^') unary)?
 *   primary := NUMBER | NAME '(' args ')' | 'y' '[' NUMBER ']' | NAME | '(' expr ')'
 *
 * Power is right associative and binds tighter than a leading sign, so -2**2 is -4.
 */
public class RateLawParser {

    private static final String STATE_VECTOR = "y";

    private final List<RateLawToken> tokens;
    private final String source;
    private int pos = 0;

    public RateLawParser(List<RateLawToken> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    /**
     * Tokenizes and parses a rate law in one call.
     */
    public static ExpressionNode parse(String rateLaw) {
        List<RateLawToken> tokens = new RateLawTokenizer(rateLaw).tokenize();
        return new RateLawParser(tokens, rateLaw).parse();
    }

    public ExpressionNode parse() {
        if (check(TokenType.EOF)) {
            throw error("Empty rate law");
        }
        ExpressionNode expression = parseExpression();
        if (!check(TokenType.EOF)) {
            throw error("Unexpected '" + peek().getValue() + "'");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator operator = advance().is(TokenType.PLUS) ? Operator.PLUS : Operator.MINUS;
            left = new BinaryNode(operator, left, parseTerm());
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseUnary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Operator operator = advance().is(TokenType.STAR) ? Operator.TIMES : Operator.DIVIDE;
            left = new BinaryNode(operator, left, parseUnary());
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (check(TokenType.MINUS) || check(TokenType.PLUS)) {
            boolean negated = advance().is(TokenType.MINUS);
            return new UnaryNode(negated, parseUnary());
        }
        return parsePower();
    }

    private ExpressionNode parsePower() {
        ExpressionNode base = parsePrimary();
        if (check(TokenType.POWER)) {
            advance();
            return new BinaryNode(Operator.POWER, base, parseUnary());
        }
        return base;
    }

    private ExpressionNode parsePrimary() {
        RateLawToken token = peek();

        if (token.is(TokenType.NUMBER)) {
            advance();
            return new NumberNode(Double.parseDouble(token.getValue()), token.getValue());
        }

        if (token.is(TokenType.LPAREN)) {
            advance();
            ExpressionNode inner = parseExpression();
            expect(TokenType.RPAREN);
            return inner;
        }

        if (token.is(TokenType.IDENTIFIER)) {
            advance();
            if (check(TokenType.LPAREN)) {
                return parseFunctionCall(token);
            }
            if (check(TokenType.LBRACKET) && STATE_VECTOR.equals(token.getValue())) {
                return parseSlot();
            }
            return new IdentifierNode(token.getValue());
        }

        throw error(token.is(TokenType.EOF) ? "Unexpected end of rate law" : "Unexpected '" + token.getValue() + "'");
    }

    private ExpressionNode parseFunctionCall(RateLawToken nameToken) {
        MathFunction function = MathFunction.lookup(nameToken.getValue())
                .orElseThrow(() -> error("Unknown function '" + nameToken.getValue() + "'"));
        expect(TokenType.LPAREN);

        List<ExpressionNode> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseExpression());
            while (check(TokenType.COMMA)) {
                advance();
                arguments.add(parseExpression());
            }
        }
        expect(TokenType.RPAREN);

        // log(x, base) is accepted as a two-argument form
        if (function == MathFunction.LOG && arguments.size() == 2) {
            return new BinaryNode(Operator.DIVIDE,
                    new FunctionNode(MathFunction.LOG, List.of(arguments.get(0))),
                    new FunctionNode(MathFunction.LOG, List.of(arguments.get(1))));
        }
        if (arguments.size() != function.getArity()) {
            throw error("Function '" + function.getName() + "' expects " + function.getArity()
                    + " argument(s), got " + arguments.size());
        }
        return new FunctionNode(function, List.copyOf(arguments));
    }

    private ExpressionNode parseSlot() {
        expect(TokenType.LBRACKET);
        RateLawToken index = expect(TokenType.NUMBER);
        expect(TokenType.RBRACKET);
        try {
            return new SlotNode(Integer.parseInt(index.getValue()));
        } catch (NumberFormatException e) {
            throw error("State vector index must be a non-negative integer: " + index.getValue());
        }
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private RateLawToken peek() {
        return tokens.get(pos);
    }

    private RateLawToken advance() {
        RateLawToken token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private RateLawToken expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but found '" + peek().getValue() + "'");
        }
        return advance();
    }

    private ParseException error(String message) {
        return new ParseException(message + " at column " + (peek().getStart() + 1) + " in rate law: " + source);
    }
}
