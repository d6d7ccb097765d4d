package com.github.musiKk.monkey.ast;

import com.github.musiKk.monkey.ast.Node.BooleanLiteral;
import com.github.musiKk.monkey.ast.Node.HashLiteral;
import com.github.musiKk.monkey.ast.Node.Identifier;
import com.github.musiKk.monkey.ast.Node.InfixExpression;
import com.github.musiKk.monkey.ast.Node.IntegerLiteral;
import com.github.musiKk.monkey.ast.Node.PrefixExpression;
import com.github.musiKk.monkey.ast.Node.StringLiteral;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Indented dump of a tree, one node per line, for tracing parser output.
 *
 * <pre>
 * Program
 *   LetStatement
 *     Identifier [x]
 *     IntegerLiteral [5]
 * </pre>
 */
@RequiredArgsConstructor
public class AstPrinter {

    @Accessors(fluent = true)
    @Getter
    private final String indent;

    public AstPrinter() {
        this("  ");
    }

    public String print(Node node) {
        var out = new StringBuilder();
        print(node, 0, out);
        return out.toString();
    }

    private void print(Node node, int depth, StringBuilder out) {
        out.append(indent.repeat(depth)).append(label(node)).append('\n');
        for (var child : Nodes.children(node)) {
            print(child, depth + 1, out);
        }
    }

    static String label(Node node) {
        var name = node.getClass().getSimpleName();
        if (node instanceof Identifier i) {
            return name + " [" + i.value() + "]";
        } else if (node instanceof IntegerLiteral il) {
            return name + " [" + il.value() + "]";
        } else if (node instanceof BooleanLiteral bl) {
            return name + " [" + bl.value() + "]";
        } else if (node instanceof StringLiteral sl) {
            return name + " [" + sl.value() + "]";
        } else if (node instanceof PrefixExpression pe) {
            return name + " [" + pe.operator() + "]";
        } else if (node instanceof InfixExpression ie) {
            return name + " [" + ie.operator() + "]";
        } else if (node instanceof HashLiteral hl) {
            return name + " [" + hl.pairs().size() + " pairs]";
        }
        return name;
    }
}
