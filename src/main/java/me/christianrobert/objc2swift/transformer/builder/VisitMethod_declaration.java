package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.transformer.context.OwnerKind;

import java.util.Optional;

/**
 * Static helper for visiting method declarations (interfaces, categories, protocols).
 *
 * <p>A declaration whose definition can be resolved is replaced by the full definition, so the
 * method body appears where the interface declares it. The definition is then recorded as
 * emitted and produces no output when the walk reaches the implementation.</p>
 *
 * <p>Without a definition, only the signature is emitted:</p>
 * <pre>
 * protocol:          func reload()
 * interface:         func reload() {
 *                    }
 * </pre>
 */
public class VisitMethod_declaration {

    public static String v(ObjCParser.Instance_method_declarationContext ctx, SwiftCodeBuilder b) {
        if (ctx.method_declaration() == null) {
            return "";
        }
        String translated = b.visit(ctx.method_declaration());
        if (translated.isEmpty()) {
            return "";
        }
        return SwiftCodeBuilder.stripTrailingSpace(
                b.indent(ctx) + optional(ctx.method_declaration(), b) + translated);
    }

    public static String v(ObjCParser.Class_method_declarationContext ctx, SwiftCodeBuilder b) {
        if (ctx.method_declaration() == null) {
            return "";
        }
        String translated = b.visit(ctx.method_declaration());
        if (translated.isEmpty()) {
            return "";
        }
        return SwiftCodeBuilder.stripTrailingSpace(
                b.indent(ctx) + optional(ctx.method_declaration(), b) + "class " + translated);
    }

    public static String v(ObjCParser.Method_declarationContext ctx, SwiftCodeBuilder b) {
        Optional<ObjCParser.Method_definitionContext> definition =
                DefinitionResolver.findCorrespondingDefinition(ctx, b);

        if (definition.isPresent()) {
            if (b.getContext().isEmitted(definition.get())) {
                return ""; // Already inlined by another declaration (e.g., interface and extension)
            }
            return b.visit(definition.get());
        }

        // Has no definition
        String header = MethodHeaderBuilder.build(ctx.method_selector(), ctx.method_type(), b);

        if (DefinitionResolver.ownerKind(ctx, b) == OwnerKind.PROTOCOL) {
            return header;
        }
        return header + " {\n" + b.indent(ctx) + "}";
    }

    private static String optional(ObjCParser.Method_declarationContext ctx, SwiftCodeBuilder b) {
        return DefinitionResolver.isOptional(ctx, b) ? "optional " : "";
    }
}
