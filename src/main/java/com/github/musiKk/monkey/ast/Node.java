package com.github.musiKk.monkey.ast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.musiKk.monkey.token.Token;
import com.github.musiKk.monkey.token.TokenType;

/**
 * Element of the syntax tree. The variant set is closed: every node is either a {@link Program}, a
 * {@link Statement} or an {@link Expression}, and both families only admit the records declared
 * here.
 */
public sealed interface Node permits Program, Node.Statement, Node.Expression {

    /**
     * Literal text of the token that introduced this node.
     */
    String tokenLiteral();

    /**
     * Canonical reconstruction of this node and its children. Infix, prefix and index expressions
     * are always parenthesized, so the text reflects the tree shape. Absent optional children
     * render as an empty slot.
     */
    @Override
    String toString();

    private static String join(List<? extends Node> nodes) {
        return nodes.stream().map(Node::toString).collect(Collectors.joining(", "));
    }

    private static String concat(List<? extends Node> nodes) {
        return nodes.stream().map(Node::toString).collect(Collectors.joining());
    }

    private static String orEmpty(Optional<? extends Node> node) {
        return node.map(Node::toString).orElse("");
    }

    public sealed interface Statement extends Node {
        Token token();
    }

    public record LetStatement(Token token, Identifier name, Optional<Expression> value) implements Statement {
        public LetStatement {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
        public LetStatement(Identifier name, Expression value) {
            this(Token.of(TokenType.LET), name, Optional.of(value));
        }
        public LetStatement(Identifier name) {
            this(Token.of(TokenType.LET), name, Optional.empty());
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return tokenLiteral() + " " + name + " = " + orEmpty(value) + ";";
        }
    }

    public record ReturnStatement(Token token, Optional<Expression> returnValue) implements Statement {
        public ReturnStatement {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(returnValue, "returnValue");
        }
        public ReturnStatement(Expression returnValue) {
            this(Token.of(TokenType.RETURN), Optional.of(returnValue));
        }
        public ReturnStatement() {
            this(Token.of(TokenType.RETURN), Optional.empty());
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return tokenLiteral() + " " + orEmpty(returnValue) + ";";
        }
    }

    /**
     * An expression in statement position. The token is the first token of the expression.
     */
    public record ExpressionStatement(Token token, Optional<Expression> expression) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(expression, "expression");
        }
        public ExpressionStatement(Token token, Expression expression) {
            this(token, Optional.of(expression));
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return orEmpty(expression);
        }
    }

    /**
     * Statements between braces. The braces themselves are not part of the rendering.
     */
    public record BlockStatement(Token token, List<Statement> statements) implements Statement {
        public BlockStatement {
            Objects.requireNonNull(token, "token");
            statements = List.copyOf(statements);
        }
        public BlockStatement(List<Statement> statements) {
            this(Token.of(TokenType.LBRACE), statements);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return concat(statements);
        }
    }

    public sealed interface Expression extends Node {
        Token token();
    }

    public record Identifier(Token token, String value) implements Expression {
        public Identifier {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(value, "value");
        }
        public Identifier(String value) {
            this(Token.ident(value), value);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return value;
        }
    }

    public record IntegerLiteral(Token token, long value) implements Expression {
        public IntegerLiteral {
            Objects.requireNonNull(token, "token");
        }
        public IntegerLiteral(long value) {
            this(Token.integer(value), value);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return token.literal();
        }
    }

    public record BooleanLiteral(Token token, boolean value) implements Expression {
        public BooleanLiteral {
            Objects.requireNonNull(token, "token");
        }
        public BooleanLiteral(boolean value) {
            this(Token.of(value ? TokenType.TRUE : TokenType.FALSE), value);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return token.literal();
        }
    }

    public record StringLiteral(Token token, String value) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(value, "value");
        }
        public StringLiteral(String value) {
            this(Token.string(value), value);
        }

        public String tokenLiteral() { return token.literal(); }

        // no quotes, the token literal is the unquoted text
        @Override
        public String toString() {
            return token.literal();
        }
    }

    public record PrefixExpression(Token token, String operator, Expression right) implements Expression {
        public PrefixExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return "(" + operator + right + ")";
        }
    }

    public record InfixExpression(Token token, Expression left, String operator, Expression right) implements Expression {
        public InfixExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    public record IfExpression(
            Token token,
            Expression condition,
            BlockStatement consequence,
            Optional<BlockStatement> alternative) implements Expression {
        public IfExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(consequence, "consequence");
            Objects.requireNonNull(alternative, "alternative");
        }
        public IfExpression(Expression condition, BlockStatement consequence) {
            this(Token.of(TokenType.IF), condition, consequence, Optional.empty());
        }
        public IfExpression(Expression condition, BlockStatement consequence, BlockStatement alternative) {
            this(Token.of(TokenType.IF), condition, consequence, Optional.of(alternative));
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            var out = new StringBuilder();
            out.append("if").append(condition).append(" ").append(consequence);
            alternative.ifPresent(a -> out.append("else ").append(a));
            return out.toString();
        }
    }

    public record FunctionLiteral(Token token, List<Identifier> parameters, BlockStatement body) implements Expression {
        public FunctionLiteral {
            Objects.requireNonNull(token, "token");
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(body, "body");
        }
        public FunctionLiteral(List<Identifier> parameters, BlockStatement body) {
            this(Token.of(TokenType.FUNCTION), parameters, body);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return tokenLiteral() + "(" + join(parameters) + ")" + body;
        }
    }

    /**
     * Invocation of {@code function}, which is an {@link Identifier} or a {@link FunctionLiteral}
     * as produced by the parser. The token is the opening parenthesis.
     */
    public record CallExpression(Token token, Expression function, List<Expression> arguments) implements Expression {
        public CallExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }
        public CallExpression(Expression function, List<Expression> arguments) {
            this(Token.of(TokenType.LPAREN), function, arguments);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return function + "(" + join(arguments) + ")";
        }
    }

    public record ArrayLiteral(Token token, List<Expression> elements) implements Expression {
        public ArrayLiteral {
            Objects.requireNonNull(token, "token");
            elements = List.copyOf(elements);
        }
        public ArrayLiteral(List<Expression> elements) {
            this(Token.of(TokenType.LBRACKET), elements);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return "[" + join(elements) + "]";
        }
    }

    public record IndexExpression(Token token, Expression left, Expression index) implements Expression {
        public IndexExpression {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(index, "index");
        }
        public IndexExpression(Expression left, Expression index) {
            this(Token.of(TokenType.LBRACKET), left, index);
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return "(" + left + "[" + index + "])";
        }
    }

    /**
     * Key/value literal. Pairs are kept as a list in source order, so rendering is deterministic
     * and duplicate keys are preserved as written.
     */
    public record HashLiteral(Token token, List<Pair> pairs) implements Expression {
        public HashLiteral {
            Objects.requireNonNull(token, "token");
            pairs = List.copyOf(pairs);
        }
        public HashLiteral(List<Pair> pairs) {
            this(Token.of(TokenType.LBRACE), pairs);
        }

        /**
         * Builds a hash literal from a map, keeping the map's iteration order.
         */
        public static HashLiteral of(Token token, Map<? extends Expression, ? extends Expression> pairs) {
            return new HashLiteral(token, pairs.entrySet().stream()
                    .map(e -> new Pair(e.getKey(), e.getValue()))
                    .toList());
        }

        /**
         * Key to value view in pair order. Later duplicates of a key win.
         */
        public Map<Expression, Expression> asMap() {
            Map<Expression, Expression> map = new LinkedHashMap<>();
            pairs.forEach(p -> map.put(p.key(), p.value()));
            return map;
        }

        public String tokenLiteral() { return token.literal(); }

        @Override
        public String toString() {
            return pairs.stream().map(Pair::toString).collect(Collectors.joining(", ", "{", "}"));
        }

        public record Pair(Expression key, Expression value) {
            public Pair {
                Objects.requireNonNull(key, "key");
                Objects.requireNonNull(value, "value");
            }

            @Override
            public String toString() {
                return key + ": " + value;
            }
        }
    }

}
