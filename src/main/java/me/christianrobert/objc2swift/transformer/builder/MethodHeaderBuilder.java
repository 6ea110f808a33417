package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.core.tools.TypeConverter;

/**
 * Builds the Swift {@code func} line shared by declarations and definitions.
 *
 * <pre>
 * no return type        → func name() -> AnyObject
 * (IBAction)            → @IBAction func name(sender: AnyObject)
 * (void)                → func name()
 * (NSString *)          → func name() -> NSString
 * </pre>
 *
 * <p>The {@code class } prefix of class methods is added by the caller.</p>
 */
public class MethodHeaderBuilder {

    public static String build(ObjCParser.Method_selectorContext selectorCtx,
                               ObjCParser.Method_typeContext typeCtx,
                               SwiftCodeBuilder b) {
        String selector = b.visit(selectorCtx);

        // Implicit id return
        if (typeCtx == null) {
            return "func " + selector + " -> " + TypeConverter.DEFAULT_TYPE;
        }

        String returnType = b.visit(typeCtx);

        if ("IBAction".equals(returnType)) {
            return "@IBAction func " + selector;
        }
        if (returnType.isEmpty()) {
            return "func " + selector; // void
        }
        return "func " + selector + " -> " + returnType;
    }
}
