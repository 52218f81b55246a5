package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.error.ExpressionParseException;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for single-variable real expressions.
 *
 * <p>Grammar, lowest precedence first:
 *
 * <pre>
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/') unary)*
 * unary          := ('+' | '-') unary | power
 * power          := primary (('^' | '**') unary)?
 * primary        := number | identifier | identifier '(' additive (',' additive)? ')' | '(' additive ')'
 * </pre>
 *
 * <p>Power is right-associative and binds tighter than a leading minus, so {@code -x^2} is
 * {@code -(x^2)}. Decimal literals are parsed exactly; {@code a/b} stays an exact division.
 * Accepted names: the designated variable, {@code pi}/{@code π}, {@code e}, and the functions
 * {@code sin cos tan sqrt exp abs log} with the aliases {@code ln} and {@code Abs}.
 *
 * <p>Stateless and thread-safe; every call works on its own token cursor.
 */
public final class ExpressionParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");

    private final String variable;

    /** Parser for the variable {@code x}. */
    public ExpressionParser() {
        this("x");
    }

    public ExpressionParser(String variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        if (!IDENTIFIER.matcher(variable).matches()) {
            throw new IllegalArgumentException("variable must be a plain identifier, got: '" + variable + "'");
        }
        if ("pi".equals(variable) || "e".equals(variable) || isFunctionName(variable)) {
            throw new IllegalArgumentException("variable must not shadow a constant or function: '" + variable + "'");
        }
        this.variable = variable;
    }

    /** The designated free variable. */
    public String variable() {
        return variable;
    }

    /**
     * Parses an expression that must depend on the designated variable.
     *
     * @throws ExpressionParseException on syntax errors, unknown names, a foreign variable or a
     *     constant expression
     */
    public Expr parse(String text) {
        Expr expr = new Cursor(text, true).parseAll();
        if (!Exprs.containsVariable(expr)) {
            throw new ExpressionParseException(
                    "Expression must be a function of " + variable + ": '" + text.trim() + "'", text, -1);
        }
        return expr;
    }

    /**
     * Parses a constant value such as {@code 1.5}, {@code 3/2} or {@code pi/4}.
     *
     * @throws ExpressionParseException if the text is malformed or mentions the variable
     */
    public Expr parseValue(String text) {
        return new Cursor(text, false).parseAll();
    }

    private static boolean isFunctionName(String name) {
        return MathFunction.bySymbol(name).isPresent() || "log".equals(name) || "ln".equals(name) || "Abs".equals(name);
    }

    // --- Tokens ---

    private enum TokenType {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        CARET,
        LPAREN,
        RPAREN,
        COMMA,
        END
    }

    private record Token(TokenType type, String text, int position) {}

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || c == '.') {
                int start = i;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < source.length()
                        && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, i), start));
            } else if (c == '*' && i + 1 < source.length() && source.charAt(i + 1) == '*') {
                tokens.add(new Token(TokenType.CARET, "**", i));
                i += 2;
            } else {
                TokenType type = switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-', '−' -> TokenType.MINUS;
                    case '*', '×', '·' -> TokenType.STAR;
                    case '/', '÷' -> TokenType.SLASH;
                    case '^' -> TokenType.CARET;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case ',' -> TokenType.COMMA;
                    default -> throw new ExpressionParseException(
                            "Unexpected character '" + c + "' at position " + i, source, i);
                };
                tokens.add(new Token(type, String.valueOf(c), i));
                i++;
            }
        }
        tokens.add(new Token(TokenType.END, "", source.length()));
        return tokens;
    }

    // --- Parsing ---

    /** Token cursor for one parse call. */
    private final class Cursor {

        private final String source;
        private final boolean allowVariable;
        private final List<Token> tokens;
        private int index;

        Cursor(String source, boolean allowVariable) {
            if (source == null || source.isBlank()) {
                throw new ExpressionParseException(
                        allowVariable ? "Expression must not be empty" : "Value must not be empty", source, 0);
            }
            this.source = source;
            this.allowVariable = allowVariable;
            this.tokens = tokenize(source);
        }

        Expr parseAll() {
            Expr expr = additive();
            Token next = peek();
            if (next.type() != TokenType.END) {
                throw unexpected(next);
            }
            return expr;
        }

        private Expr additive() {
            Expr left = multiplicative();
            while (true) {
                if (accept(TokenType.PLUS)) {
                    left = new Expr.Add(left, multiplicative());
                } else if (accept(TokenType.MINUS)) {
                    left = new Expr.Sub(left, multiplicative());
                } else {
                    return left;
                }
            }
        }

        private Expr multiplicative() {
            Expr left = unary();
            while (true) {
                if (accept(TokenType.STAR)) {
                    left = new Expr.Mul(left, unary());
                } else if (accept(TokenType.SLASH)) {
                    left = new Expr.Div(left, unary());
                } else {
                    return left;
                }
            }
        }

        private Expr unary() {
            if (accept(TokenType.MINUS)) {
                return new Expr.Neg(unary());
            }
            if (accept(TokenType.PLUS)) {
                return unary();
            }
            return power();
        }

        private Expr power() {
            Expr base = primary();
            if (accept(TokenType.CARET)) {
                return new Expr.Pow(base, unary());
            }
            return base;
        }

        private Expr primary() {
            Token token = next();
            switch (token.type()) {
                case NUMBER:
                    return number(token);
                case IDENTIFIER:
                    return identifier(token);
                case LPAREN:
                    Expr inner = additive();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                default:
                    throw unexpected(token);
            }
        }

        private Expr number(Token token) {
            try {
                return new Expr.Num(Rational.parseDecimal(token.text()));
            } catch (NumberFormatException e) {
                throw new ExpressionParseException(
                        "Malformed number '" + token.text() + "' at position " + token.position(),
                        e,
                        source,
                        token.position());
            }
        }

        private Expr identifier(Token token) {
            String name = token.text();
            if (peek().type() == TokenType.LPAREN) {
                return call(token);
            }
            if (name.equals(variable)) {
                if (!allowVariable) {
                    throw new ExpressionParseException(
                            "A point value must not contain the variable " + variable, source, token.position());
                }
                return new Expr.Variable(name);
            }
            if ("pi".equals(name) || "π".equals(name)) {
                return new Expr.Const(NamedConstant.PI);
            }
            if ("e".equals(name)) {
                return new Expr.Const(NamedConstant.E);
            }
            if (isFunctionName(name)) {
                throw new ExpressionParseException(
                        "Function '" + name + "' requires a parenthesized argument", source, token.position());
            }
            if (name.length() == 1) {
                throw new ExpressionParseException(
                        "Unknown variable '" + name + "': only " + variable + " is allowed", source, token.position());
            }
            throw new ExpressionParseException(
                    "Unknown identifier '" + name + "' at position " + token.position(), source, token.position());
        }

        private Expr call(Token token) {
            String name = token.text();
            expect(TokenType.LPAREN, "'('");
            List<Expr> args = new ArrayList<>();
            args.add(additive());
            while (accept(TokenType.COMMA)) {
                args.add(additive());
            }
            expect(TokenType.RPAREN, "')'");

            if ("log".equals(name) || "ln".equals(name)) {
                int maxArgs = "ln".equals(name) ? 1 : 2;
                requireArity(token, args, maxArgs);
                return args.size() == 1 ? new Expr.Log(args.get(0), null) : logWithBase(token, args.get(0), args.get(1));
            }
            MathFunction function = "Abs".equals(name)
                    ? MathFunction.ABS
                    : MathFunction.bySymbol(name)
                            .orElseThrow(() -> new ExpressionParseException(
                                    "Unknown function '" + name + "' at position " + token.position(),
                                    source,
                                    token.position()));
            requireArity(token, args, 1);
            return new Expr.Call(function, args.get(0));
        }

        private Expr logWithBase(Token token, Expr argument, Expr base) {
            if (Exprs.containsVariable(base)) {
                throw new ExpressionParseException(
                        "Logarithm base must be a constant, got '" + base + "'", source, token.position());
            }
            double value;
            try {
                value = Evaluator.evaluateConstant(base);
            } catch (UndefinedEvaluationException e) {
                throw new ExpressionParseException(
                        "Logarithm base '" + base + "' is undefined: " + e.getMessage(), e, source, token.position());
            }
            if (!(value > 0) || value == 1.0) {
                throw new ExpressionParseException(
                        "Logarithm base must be positive and different from 1, got '" + base + "'",
                        source,
                        token.position());
            }
            return new Expr.Log(argument, base);
        }

        private void requireArity(Token token, List<Expr> args, int max) {
            if (args.size() > max) {
                throw new ExpressionParseException(
                        "Function '" + token.text() + "' takes " + (max == 1 ? "one argument" : "at most " + max + " arguments")
                                + ", got " + args.size(),
                        source,
                        token.position());
            }
        }

        // --- Cursor helpers ---

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.END) {
                index++;
            }
            return token;
        }

        private boolean accept(TokenType type) {
            if (peek().type() == type) {
                index++;
                return true;
            }
            return false;
        }

        private void expect(TokenType type, String description) {
            Token token = peek();
            if (token.type() != type) {
                throw new ExpressionParseException(
                        "Expected " + description + " at position " + token.position()
                                + (token.type() == TokenType.END ? " but the input ended" : " but found '" + token.text() + "'"),
                        source,
                        token.position());
            }
            index++;
        }

        private ExpressionParseException unexpected(Token token) {
            if (token.type() == TokenType.END) {
                return new ExpressionParseException("Unexpected end of input", source, token.position());
            }
            return new ExpressionParseException(
                    "Unexpected '" + token.text() + "' at position " + token.position(), source, token.position());
        }
    }
}
