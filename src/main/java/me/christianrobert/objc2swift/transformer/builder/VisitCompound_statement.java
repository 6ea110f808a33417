package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

/**
 * Static helper for visiting method bodies.
 *
 * <p>Statements are not translated expression by expression. Each block item becomes one line
 * holding its source text without the terminating semicolon; nested blocks keep their header:</p>
 *
 * <pre>
 * if (count > 0) {          if (count > 0) {
 *     [self reload];    -&gt;      [self reload]
 * }                         }
 * </pre>
 *
 * <p>A bare nested block becomes {@code do { ... }}.</p>
 */
public class VisitCompound_statement {

    public static String v(ObjCParser.Compound_statementContext ctx, SwiftCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        for (ObjCParser.Block_itemContext item : ctx.block_item()) {
            String line = b.visit(item);
            if (!line.isEmpty()) {
                result.append(line).append("\n");
            }
        }
        return result.toString();
    }

    public static String v(ObjCParser.Block_itemContext ctx, SwiftCodeBuilder b) {
        String indent = b.indent(ctx);
        ObjCParser.Statement_headContext head = ctx.statement_head();

        if (ctx.compound_statement() == null) {
            if (head == null) {
                return ""; // Empty statement
            }
            return indent + SwiftCodeBuilder.sourceText(head).trim();
        }

        String opening = head != null ? SwiftCodeBuilder.sourceText(head).trim() + " {" : "do {";
        return indent + opening + "\n" + b.visit(ctx.compound_statement()) + indent + "}";
    }
}
