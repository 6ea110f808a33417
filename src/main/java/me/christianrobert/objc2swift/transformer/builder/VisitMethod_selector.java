package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

import java.util.List;

/**
 * Static helper for visiting method selectors and their keyword declarators.
 *
 * <h3>Objective-C:</h3>
 * <pre>
 * - (void)reload;
 * - (void)moveTo:(int)x withY:(double)y;
 * </pre>
 *
 * <h3>Swift:</h3>
 * <pre>
 * reload()
 * moveTo(x: Int32, withY y: Double)
 * </pre>
 *
 * <p>The first keyword names the method. Its parameter never carries an external label;
 * every later parameter keeps its keyword as external label unless it is the same as the
 * internal name.</p>
 */
public class VisitMethod_selector {

    public static String v(ObjCParser.Method_selectorContext ctx, SwiftCodeBuilder b) {
        // No parameters
        if (ctx.selector() != null) {
            return b.visit(ctx.selector()) + "()";
        }

        List<ObjCParser.Keyword_declaratorContext> keywords = ctx.keyword_declarator();
        if (keywords.isEmpty()) {
            throw new IllegalStateException("Method selector not found in AST: " + ctx.getText());
        }

        // Method name
        ObjCParser.Keyword_declaratorContext head = keywords.get(0);
        String name = head.selector() != null ? b.visit(head.selector()) : "";

        StringBuilder params = new StringBuilder(v(head, b, true));
        for (int i = 1; i < keywords.size(); i++) {
            params.append(", ").append(v(keywords.get(i), b, false));
        }

        return name + "(" + params + ")";
    }

    /**
     * Translates one keyword declarator into a Swift parameter.
     *
     * @param ctx Keyword declarator parse tree context
     * @param b SwiftCodeBuilder instance
     * @param isHead true for the first parameter (which has no external label)
     * @return Parameter text, e.g. "withY y: Double"
     */
    public static String v(ObjCParser.Keyword_declaratorContext ctx, SwiftCodeBuilder b, boolean isHead) {
        // Internal name
        String paramName = ctx.IDENTIFIER() != null ? ctx.IDENTIFIER().getText() : "";

        // Method name (head) or external name
        String selector = ctx.selector() != null ? b.visit(ctx.selector()) : "";

        // First candidate type with a non-empty translation
        String paramType = "";
        for (ObjCParser.Method_typeContext typeCtx : ctx.method_type()) {
            String translated = b.visit(typeCtx);
            if (!translated.isEmpty()) {
                paramType = translated;
                break;
            }
        }

        if (selector.isEmpty() || isHead || selector.equals(paramName)) {
            return paramName + ": " + paramType;
        }
        return selector + " " + paramName + ": " + paramType;
    }
}
