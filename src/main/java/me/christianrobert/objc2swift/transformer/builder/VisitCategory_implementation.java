package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

/**
 * Static helper for visiting category implementations without a category interface.
 */
public class VisitCategory_implementation {

    public static String v(ObjCParser.Category_implementationContext ctx, SwiftCodeBuilder b) {
        if (b.getIndices().hasCorrespondingInterface(ctx) || b.getContext().isAbsorbed(ctx)) {
            return "";
        }

        String header = "extension " + ctx.class_name().getText();
        return TypeHeaderBuilder.block(header, b.visit(ctx.implementation_definition_list()), ctx, b);
    }
}
