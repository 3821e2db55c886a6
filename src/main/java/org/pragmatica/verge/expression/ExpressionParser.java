package org.pragmatica.verge.expression;

import org.pragmatica.verge.error.AnalysisError;
import org.pragmatica.verge.error.AnalysisException;

import java.util.List;

/**
 * Recursive-descent parser for sequence expressions.
 *
 * <p>Binding, from tightest to loosest:
 * <pre>
 * Primary        <- Number / Call / Identifier / '(' Additive ')'
 * Unary          <- ('+' / '-') Unary / Primary
 * Power          <- Unary ('^' Power)?
 * Implicit       <- Power Power*              (juxtaposition, e.g. 2n, (n)(n+1))
 * Multiplicative <- Implicit (('*' / '/') Implicit)*
 * Additive       <- Multiplicative (('+' / '-') Multiplicative)*
 * </pre>
 * An identifier directly followed by {@code (} is a function call, and {@code e^x} is read as
 * the call {@code exp(x)}.
 */
public final class ExpressionParser {

    private final List<Token> tokens;
    private int pos;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse expression text into an expression tree.
     */
    public static Expression parse(String text) {
        return parse(Lexer.tokenize(text));
    }

    /**
     * Parse an already tokenized expression. The list must end with {@link Token.Eof}.
     */
    public static Expression parse(List<Token> tokens) {
        return new ExpressionParser(tokens).parseInput();
    }

    private Expression parseInput() {
        var expression = parseAdditive();
        if (!isAtEnd()) {
            throw unexpected(peek(), "operator or end of input");
        }
        return expression;
    }

    private Expression parseAdditive() {
        var left = parseMultiplicative();

        while (peek() instanceof Token.Plus || peek() instanceof Token.Minus) {
            var operator = peek() instanceof Token.Plus
                           ? Expression.Operator.ADD
                           : Expression.Operator.SUBTRACT;
            advance();
            var right = parseMultiplicative();
            left = new Expression.BinaryExpression(operator, left, right);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        var left = parseImplicit();

        while (peek() instanceof Token.Star || peek() instanceof Token.Slash) {
            var operator = peek() instanceof Token.Star
                           ? Expression.Operator.MULTIPLY
                           : Expression.Operator.DIVIDE;
            advance();
            var right = parseImplicit();
            left = new Expression.BinaryExpression(operator, left, right);
        }
        return left;
    }

    private Expression parseImplicit() {
        var left = parsePower();

        while (needsImplicitMultiply()) {
            var right = parsePower();
            left = new Expression.BinaryExpression(Expression.Operator.MULTIPLY, left, right);
        }
        return left;
    }

    private Expression parsePower() {
        var base = parseUnary();

        if (peek() instanceof Token.Caret) {
            advance();
            // right-associative
            var exponent = parsePower();
            return new Expression.PowerExpression(base, exponent);
        }
        return base;
    }

    private Expression parseUnary() {
        var token = peek();
        if (token instanceof Token.Plus || token instanceof Token.Minus) {
            var sign = token instanceof Token.Minus
                       ? Expression.Sign.MINUS
                       : Expression.Sign.PLUS;
            advance();
            var operand = parseUnary();
            if (operand instanceof Expression.NumericLiteral literal) {
                return new Expression.NumericLiteral(sign == Expression.Sign.MINUS
                                                     ? -literal.value()
                                                     : literal.value());
            }
            return new Expression.UnaryExpression(sign, operand);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        var token = peek();

        if (token instanceof Token.Number number) {
            advance();
            return new Expression.NumericLiteral(number.value());
        }

        if (token instanceof Token.Identifier id) {
            advance();
            if (peek() instanceof Token.LParen) {
                return parseCall(id);
            }
            if (isExpShorthand(id)) {
                advance(); // skip ^
                return new Expression.FunctionCall("e^", parsePower());
            }
            return new Expression.Identifier(id.name());
        }

        if (token instanceof Token.LParen open) {
            advance();
            var inner = parseAdditive();
            expectClosing(open);
            return inner;
        }

        if (token instanceof Token.Eof) {
            throw new AnalysisException(new AnalysisError.UnexpectedEnd(token.offset(), "expression"));
        }
        throw unexpected(token, "expression");
    }

    private Expression parseCall(Token.Identifier id) {
        if (FunctionName.lookup(id.name()).isEmpty()) {
            throw new AnalysisException(new AnalysisError.UnknownFunction(id.offset(), id.name()));
        }
        var open = (Token.LParen) peek();
        advance();
        var argument = parseAdditive();
        expectClosing(open);
        return new Expression.FunctionCall(id.name(), argument);
    }

    private boolean isExpShorthand(Token.Identifier id) {
        return id.name().equalsIgnoreCase("e") && peek() instanceof Token.Caret;
    }

    private void expectClosing(Token.LParen open) {
        if (peek() instanceof Token.RParen) {
            advance();
            return;
        }
        if (isAtEnd()) {
            throw new AnalysisException(new AnalysisError.UnmatchedParenthesis(open.offset()));
        }
        throw unexpected(peek(), "')'");
    }

    /**
     * Juxtaposition such as 2n, 2(n+1), (n)(n+1), (n+1)2 or (n+1)n.
     */
    private boolean needsImplicitMultiply() {
        if (pos == 0) {
            return false;
        }
        var previous = tokens.get(pos - 1);
        var current = peek();

        boolean operandBefore = previous instanceof Token.Number
                                || previous instanceof Token.Identifier
                                || previous instanceof Token.RParen;
        if (operandBefore && (current instanceof Token.Identifier || current instanceof Token.LParen)) {
            return true;
        }
        return previous instanceof Token.RParen && current instanceof Token.Number;
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++ ;
        }
    }

    private AnalysisException unexpected(Token token, String expected) {
        return new AnalysisException(new AnalysisError.UnexpectedToken(token.offset(), tokenDescription(token), expected));
    }

    static String tokenDescription(Token token) {
        if (token instanceof Token.Number number) {
            return "number " + number.text();
        }
        if (token instanceof Token.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof Token.Plus) {
            return "'+'";
        }
        if (token instanceof Token.Minus) {
            return "'-'";
        }
        if (token instanceof Token.Star) {
            return "'*'";
        }
        if (token instanceof Token.Slash) {
            return "'/'";
        }
        if (token instanceof Token.Caret) {
            return "'^'";
        }
        if (token instanceof Token.LParen) {
            return "'('";
        }
        if (token instanceof Token.RParen) {
            return "')'";
        }
        return "end of input";
    }
}
