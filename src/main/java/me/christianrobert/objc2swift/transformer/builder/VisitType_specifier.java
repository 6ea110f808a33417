package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.core.tools.TypeConverter;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Static helper for visiting type specifiers and pointers.
 *
 * <h3>Objective-C Structure (from grammar):</h3>
 * <pre>
 * type_specifier: (primitive keyword | qualifier | class_name | generic_arguments)+ pointer?
 * pointer: '*' qualifier* pointer?
 * block_type: type_specifier? '(' '^' qualifier* IDENTIFIER? ')' '(' ... ')'
 * </pre>
 *
 * <p>Each child is translated on its own and the results are concatenated in source order:</p>
 * <ul>
 *   <li>Keyword tokens: {@link TypeConverter#toSwiftPrimitive(String)} (int → Int32, id → AnyObject)</li>
 *   <li>Class names: {@link TypeConverter#toSwiftClassName(String)} (BOOL → Bool, NSArray → [AnyObject])</li>
 *   <li>Pointers: dropped, Swift class types are references already ({@code NSString *} → NSString)</li>
 *   <li>Anything else (generic arguments): literal text</li>
 * </ul>
 */
public class VisitType_specifier {

    public static String v(ObjCParser.Type_specifierContext ctx, SwiftCodeBuilder b) {
        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);

            if (child instanceof TerminalNode) {
                sb.append(TypeConverter.toSwiftPrimitive(child.getText()));
            } else if (child instanceof ObjCParser.Class_nameContext) {
                sb.append(TypeConverter.toSwiftClassName(child.getText()));
            } else if (child instanceof ObjCParser.PointerContext) {
                sb.append(b.visit(child));
            } else {
                sb.append(child.getText());
            }
        }

        return sb.toString();
    }

    /**
     * Block types have no table entry and pass through as source text. The block's own name
     * (present in property declarations) and its qualifiers are left out.
     * {@code void (^handler)(NSError *error)} → {@code void (^)(NSError *error)}
     */
    public static String v(ObjCParser.Block_typeContext ctx, SwiftCodeBuilder b) {
        StringBuilder sb = new StringBuilder();
        if (ctx.type_specifier() != null) {
            sb.append(SwiftCodeBuilder.sourceText(ctx.type_specifier()).trim()).append(' ');
        }
        sb.append("(^)");
        if (ctx.paren_group() != null) {
            sb.append(SwiftCodeBuilder.sourceText(ctx.paren_group()).trim());
        }
        return sb.toString();
    }

    /**
     * Translates a pointer constructor. The sigil and its qualifiers (const, nullability) have
     * no Swift spelling, so a pointer contributes only what a nested pointer contributes: nothing.
     * {@code T *} and {@code T} therefore translate identically.
     */
    public static String v(ObjCParser.PointerContext ctx, SwiftCodeBuilder b) {
        if (ctx.pointer() != null) {
            return b.visit(ctx.pointer());
        }
        return "";
    }
}
