package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

/**
 * Static helper for visiting method definitions (implementations).
 *
 * <h3>Objective-C:</h3>
 * <pre>
 * - (NSString *)greet:(NSString *)name {
 *     return name;
 * }
 * </pre>
 *
 * <h3>Swift:</h3>
 * <pre>
 * func greet(name: NSString) -> NSString {
 *     return name
 * }
 * </pre>
 *
 * <p>Definitions already emitted at their declaration's site produce no output.</p>
 */
public class VisitMethod_definition {

    public static String v(ObjCParser.Instance_method_definitionContext ctx, SwiftCodeBuilder b) {
        ObjCParser.Method_definitionContext definition = ctx.method_definition();
        if (definition == null || b.getContext().isEmitted(definition)) {
            return ""; // Already printed
        }
        return SwiftCodeBuilder.stripTrailingSpace(b.indent(ctx) + b.visit(definition));
    }

    public static String v(ObjCParser.Class_method_definitionContext ctx, SwiftCodeBuilder b) {
        ObjCParser.Method_definitionContext definition = ctx.method_definition();
        if (definition == null || b.getContext().isEmitted(definition)) {
            return ""; // Already printed
        }
        return SwiftCodeBuilder.stripTrailingSpace(b.indent(ctx) + "class " + b.visit(definition));
    }

    public static String v(ObjCParser.Method_definitionContext ctx, SwiftCodeBuilder b) {
        b.getContext().markEmitted(ctx);

        String header = MethodHeaderBuilder.build(ctx.method_selector(), ctx.method_type(), b);
        return header + " {\n" + b.visit(ctx.compound_statement()) + b.indent(ctx) + "}";
    }
}
