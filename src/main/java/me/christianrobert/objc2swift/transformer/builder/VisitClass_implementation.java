package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

/**
 * Static helper for visiting class implementations.
 * An implementation with an interface in the same unit is emitted inside the interface's class
 * block; only implementations without interface produce their own class.
 */
public class VisitClass_implementation {

    public static String v(ObjCParser.Class_implementationContext ctx, SwiftCodeBuilder b) {
        if (b.getIndices().hasCorrespondingInterface(ctx) || b.getContext().isAbsorbed(ctx)) {
            return "";
        }

        String header = "class " + ctx.class_name().getText()
                + TypeHeaderBuilder.inheritance(ctx.superclass_name(), null);
        return TypeHeaderBuilder.block(header, b.visit(ctx.implementation_definition_list()), ctx, b);
    }
}
