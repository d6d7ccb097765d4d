package com.github.musiKk.monkey.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

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
import com.github.musiKk.monkey.ast.Node.InfixExpression;
import com.github.musiKk.monkey.ast.Node.IntegerLiteral;
import com.github.musiKk.monkey.ast.Node.LetStatement;
import com.github.musiKk.monkey.ast.Node.PrefixExpression;
import com.github.musiKk.monkey.ast.Node.ReturnStatement;
import com.github.musiKk.monkey.ast.Node.StringLiteral;

public final class Nodes {

    private Nodes() {}

    /**
     * Immediate children of {@code node} in rendering order. Absent optional children are left
     * out; hash pairs contribute key then value.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        if (node instanceof Program p) {
            children.addAll(p.statements());
        } else if (node instanceof LetStatement ls) {
            children.add(ls.name());
            ls.value().ifPresent(children::add);
        } else if (node instanceof ReturnStatement rs) {
            rs.returnValue().ifPresent(children::add);
        } else if (node instanceof ExpressionStatement es) {
            es.expression().ifPresent(children::add);
        } else if (node instanceof BlockStatement bs) {
            children.addAll(bs.statements());
        } else if (node instanceof Identifier
                || node instanceof IntegerLiteral
                || node instanceof BooleanLiteral
                || node instanceof StringLiteral) {
            // leaves
        } else if (node instanceof PrefixExpression pe) {
            children.add(pe.right());
        } else if (node instanceof InfixExpression ie) {
            children.add(ie.left());
            children.add(ie.right());
        } else if (node instanceof IfExpression ie) {
            children.add(ie.condition());
            children.add(ie.consequence());
            ie.alternative().ifPresent(children::add);
        } else if (node instanceof FunctionLiteral fl) {
            children.addAll(fl.parameters());
            children.add(fl.body());
        } else if (node instanceof CallExpression ce) {
            children.add(ce.function());
            children.addAll(ce.arguments());
        } else if (node instanceof ArrayLiteral al) {
            children.addAll(al.elements());
        } else if (node instanceof IndexExpression ie) {
            children.add(ie.left());
            children.add(ie.index());
        } else if (node instanceof HashLiteral hl) {
            hl.pairs().forEach(pair -> {
                children.add(pair.key());
                children.add(pair.value());
            });
        } else {
            throw new IllegalStateException("unknown node " + node.getClass().getName());
        }
        return children;
    }

    /**
     * Visits {@code node} and all of its descendants, parents before children.
     */
    public static void walk(Node node, Consumer<? super Node> visitor) {
        visitor.accept(node);
        for (var child : children(node)) {
            walk(child, visitor);
        }
    }

    public static int count(Node node) {
        var c = new Object() {
            int count;
        };
        walk(node, n -> c.count++);
        return c.count;
    }
}
