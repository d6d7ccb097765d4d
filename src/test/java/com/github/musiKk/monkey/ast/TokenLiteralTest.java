package com.github.musiKk.monkey.ast;

import static com.github.musiKk.monkey.ast.NodeStringTest.infix;
import static com.github.musiKk.monkey.ast.NodeStringTest.operator;
import static com.github.musiKk.monkey.ast.NodeStringTest.prefix;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.monkey.ast.Node.ArrayLiteral;
import com.github.musiKk.monkey.ast.Node.BlockStatement;
import com.github.musiKk.monkey.ast.Node.BooleanLiteral;
import com.github.musiKk.monkey.ast.Node.CallExpression;
import com.github.musiKk.monkey.ast.Node.ExpressionStatement;
import com.github.musiKk.monkey.ast.Node.FunctionLiteral;
import com.github.musiKk.monkey.ast.Node.HashLiteral;
import com.github.musiKk.monkey.ast.Node.Identifier;
import com.github.musiKk.monkey.ast.Node.IfExpression;
import com.github.musiKk.monkey.ast.Node.IndexExpression;
import com.github.musiKk.monkey.ast.Node.IntegerLiteral;
import com.github.musiKk.monkey.ast.Node.LetStatement;
import com.github.musiKk.monkey.ast.Node.ReturnStatement;
import com.github.musiKk.monkey.ast.Node.StringLiteral;
import com.github.musiKk.monkey.token.Token;
import com.github.musiKk.monkey.token.TokenType;

public class TokenLiteralTest {

    @ParameterizedTest
    @MethodSource("nodes")
    public void testTokenLiteral(Node node, String expected) {
        assertEquals(expected, node.tokenLiteral());
    }

    @Test
    public void testEmptyProgram() {
        assertEquals("", new Program().tokenLiteral());
        assertEquals("", new Program(List.of()).tokenLiteral());
    }

    @Test
    public void testProgramDelegatesToFirstStatement() {
        var program = new Program(
                new LetStatement(new Identifier("x"), new IntegerLiteral(5)),
                new ReturnStatement(new Identifier("x")));
        assertEquals("let", program.tokenLiteral());
    }

    @Test
    public void testTokenLiteralIgnoresChildren() {
        var left = new IfExpression(new BooleanLiteral(true), new BlockStatement(List.of()));
        var right = new IfExpression(
                infix(new IntegerLiteral(1), "<", new IntegerLiteral(2)),
                new BlockStatement(List.of(new ReturnStatement())),
                new BlockStatement(List.of()));
        assertEquals(left.tokenLiteral(), right.tokenLiteral());
    }

    private static Object[][] nodes() {
        var one = new IntegerLiteral(1);
        return new Object[][] {
            { new LetStatement(new Identifier("x")), "let" },
            { new ReturnStatement(), "return" },
            { new ExpressionStatement(Token.ident("foo"), new Identifier("foo")), "foo" },
            { new ExpressionStatement(Token.of(TokenType.SEMICOLON), Optional.empty()), ";" },
            { new BlockStatement(List.of()), "{" },
            { new Identifier("foobar"), "foobar" },
            { new IntegerLiteral(new Token(TokenType.INT, "007"), 7), "007" },
            { new BooleanLiteral(false), "false" },
            { new StringLiteral("hello"), "hello" },
            { prefix("!", new BooleanLiteral(true)), "!" },
            { infix(one, "==", new IntegerLiteral(1)), "==" },
            { new IfExpression(one, new BlockStatement(List.of())), "if" },
            { new FunctionLiteral(List.of(), new BlockStatement(List.of())), "fn" },
            { new CallExpression(operator("("), new Identifier("f"), List.of()), "(" },
            { new ArrayLiteral(List.of(one)), "[" },
            { new IndexExpression(new Identifier("a"), one), "[" },
            { new HashLiteral(List.of()), "{" }
        };
    }

}
