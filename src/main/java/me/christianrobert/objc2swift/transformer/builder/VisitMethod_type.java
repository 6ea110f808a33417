package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.core.tools.TypeConverter;

/**
 * Static helper for visiting a parenthesized method or parameter type.
 *
 * <p>Returns the Swift type text, or an empty string for {@code void} (no return value).</p>
 */
public class VisitMethod_type {

    public static String v(ObjCParser.Method_typeContext ctx, SwiftCodeBuilder b) {
        String type;
        if (ctx.type_name() != null && ctx.type_name().getChildCount() > 0) {
            type = b.visit(ctx.type_name());
        } else {
            type = TypeConverter.DEFAULT_TYPE;
        }

        return "void".equals(type) ? "" : type;
    }
}
