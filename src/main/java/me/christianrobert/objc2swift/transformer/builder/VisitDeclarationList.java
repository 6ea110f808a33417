package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Static helper for member lists of containers.
 * Every member producing output becomes one block followed by a newline.
 */
public class VisitDeclarationList {

    public static String v(ObjCParser.Interface_declaration_listContext ctx, SwiftCodeBuilder b) {
        return members(ctx, b);
    }

    public static String v(ObjCParser.Implementation_definition_listContext ctx, SwiftCodeBuilder b) {
        return members(ctx, b);
    }

    private static String members(ParserRuleContext ctx, SwiftCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof ObjCParser.Protocol_section_markerContext) {
                continue; // Handled through the optional flag of each member
            }
            String member = b.visit(child);
            if (!member.isBlank()) {
                result.append(member).append("\n");
            }
        }
        return result.toString();
    }
}
