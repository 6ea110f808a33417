package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for visiting property declarations.
 *
 * <h3>Objective-C:</h3>
 * <pre>
 * &#64;property (nonatomic, weak) id delegate;
 * &#64;property (readonly) NSInteger count;
 * </pre>
 *
 * <h3>Swift:</h3>
 * <pre>
 * weak var delegate: AnyObject
 * private(set) var count: Int
 * </pre>
 *
 * <p>A declaration naming several properties yields one {@code var} line per name. A block-typed
 * property keeps its block type as source text.</p>
 *
 * <p>Inside a protocol the accessors are spelled out ({@code { get }} or {@code { get set }}).</p>
 */
public class VisitProperty_declaration {

    public static String v(ObjCParser.Property_declarationContext ctx, SwiftCodeBuilder b) {
        boolean weak = hasAttribute(ctx, "weak");
        boolean readonly = hasAttribute(ctx, "readonly");
        boolean inProtocol = ctx.getParent() != null
                && ctx.getParent().getParent() instanceof ObjCParser.Protocol_declarationContext;

        StringBuilder prefix = new StringBuilder(b.indent(ctx));
        if (inProtocol && isInOptionalSection(ctx)) {
            prefix.append("optional ");
        }
        if (weak) {
            prefix.append("weak ");
        }
        if (readonly && !inProtocol) {
            prefix.append("private(set) ");
        }
        String accessors = inProtocol ? (readonly ? " { get }" : " { get set }") : "";

        // void (^handler)(void): the name sits inside the block type
        if (ctx.block_type() != null) {
            TerminalNode name = ctx.block_type().IDENTIFIER();
            return prefix + "var " + (name != null ? name.getText() : "") + ": "
                    + b.visit(ctx.block_type()) + accessors;
        }

        String type = ctx.type_specifier() != null ? b.visit(ctx.type_specifier()) : "";
        if (type.isEmpty()) {
            type = "AnyObject";
        }

        // NSString *first, *last: one var per name
        List<String> lines = new ArrayList<>();
        for (ObjCParser.Property_declaratorContext declarator : ctx.property_declarator()) {
            if (declarator.IDENTIFIER() == null) {
                continue;
            }
            lines.add(prefix + "var " + declarator.IDENTIFIER().getText() + ": " + type + accessors);
        }
        return String.join("\n", lines);
    }

    private static boolean hasAttribute(ObjCParser.Property_declarationContext ctx, String name) {
        if (ctx.property_attributes_declaration() == null) {
            return false;
        }
        for (ObjCParser.Property_attributeContext attribute : ctx.property_attributes_declaration().property_attribute()) {
            if (name.equals(attribute.getStart().getText())) {
                return true;
            }
        }
        return false;
    }

    // Protocol sections are siblings in the member list, the last marker before the property counts
    private static boolean isInOptionalSection(ObjCParser.Property_declarationContext ctx) {
        ParserRuleContext list = ctx.getParent();
        boolean optional = false;
        for (int i = 0; i < list.getChildCount() && list.getChild(i) != ctx; i++) {
            if (list.getChild(i) instanceof ObjCParser.Protocol_section_markerContext) {
                optional = ((ObjCParser.Protocol_section_markerContext) list.getChild(i)).AT_OPTIONAL() != null;
            }
        }
        return optional;
    }
}
