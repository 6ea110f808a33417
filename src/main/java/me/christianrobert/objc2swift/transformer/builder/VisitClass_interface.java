package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Static helper for visiting class interfaces.
 *
 * <p>The interface and its implementation become a single Swift class. Declared methods are
 * emitted in declaration order (inlining their definitions); the implementation's remaining
 * definitions follow. The implementation itself then emits nothing.</p>
 *
 * <pre>
 * &#64;interface Person : NSObject &lt;NSCopying&gt;     class Person : NSObject, NSCopying {
 * - (void)greet;                            -&gt;      func greet() {
 * &#64;end                                                ...
 *                                                   }
 *                                               }
 * </pre>
 */
public class VisitClass_interface {

    public static String v(ObjCParser.Class_interfaceContext ctx, SwiftCodeBuilder b) {
        String header = "class " + ctx.class_name().getText()
                + TypeHeaderBuilder.genericParameters(ctx.generic_parameters())
                + TypeHeaderBuilder.inheritance(ctx.superclass_name(), ctx.protocol_reference_list());

        StringBuilder members = new StringBuilder(b.visit(ctx.interface_declaration_list()));

        ParserRuleContext implementation = b.getIndices().getCorrespondingImplementation(ctx);
        if (implementation instanceof ObjCParser.Class_implementationContext) {
            ObjCParser.Class_implementationContext classImplementation =
                    (ObjCParser.Class_implementationContext) implementation;
            members.append(b.visit(classImplementation.implementation_definition_list()));
            b.getContext().markAbsorbed(classImplementation);
        }

        return TypeHeaderBuilder.block(header, members.toString(), ctx, b);
    }
}
