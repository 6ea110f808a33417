package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Static helper for visiting category interfaces and class extensions.
 *
 * <p>Both become a Swift {@code extension}. A named category absorbs its category
 * implementation the same way a class interface absorbs the class implementation. A class
 * extension ({@code @interface Foo ()}) only inlines the definitions it declares; the rest of
 * the class implementation belongs to the class block.</p>
 */
public class VisitCategory_interface {

    public static String v(ObjCParser.Category_interfaceContext ctx, SwiftCodeBuilder b) {
        String header = "extension " + ctx.class_name().getText()
                + TypeHeaderBuilder.inheritance(null, ctx.protocol_reference_list());

        StringBuilder members = new StringBuilder(b.visit(ctx.interface_declaration_list()));

        ParserRuleContext implementation = b.getIndices().getCorrespondingImplementation(ctx);
        if (implementation instanceof ObjCParser.Category_implementationContext) {
            ObjCParser.Category_implementationContext categoryImplementation =
                    (ObjCParser.Category_implementationContext) implementation;
            members.append(b.visit(categoryImplementation.implementation_definition_list()));
            b.getContext().markAbsorbed(categoryImplementation);
        }

        return TypeHeaderBuilder.block(header, members.toString(), ctx, b);
    }
}
