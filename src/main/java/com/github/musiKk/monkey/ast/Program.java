package com.github.musiKk.monkey.ast;

import java.util.List;
import java.util.stream.Collectors;

import com.github.musiKk.monkey.ast.Node.Statement;

/**
 * Root of a parsed unit: the top-level statements in source order.
 */
public record Program(List<Statement> statements) implements Node {

    public Program {
        statements = List.copyOf(statements);
    }

    public Program(Statement... statements) {
        this(List.of(statements));
    }

    public String tokenLiteral() {
        return statements.isEmpty() ? "" : statements.get(0).tokenLiteral();
    }

    @Override
    public String toString() {
        return statements.stream().map(Statement::toString).collect(Collectors.joining());
    }
}
