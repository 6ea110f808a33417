package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

/**
 * Static helper for visiting protocol declarations.
 *
 * <h3>Objective-C:</h3>
 * <pre>
 * &#64;protocol Loader &lt;NSObject&gt;
 * - (void)load;
 * &#64;optional
 * - (BOOL)canCancel;
 * &#64;end
 * </pre>
 *
 * <h3>Swift:</h3>
 * <pre>
 * &#64;objc protocol Loader : NSObject {
 *     func load()
 *     optional func canCancel() -&gt; Bool
 * }
 * </pre>
 *
 * <p>Swift only allows optional requirements in {@code @objc} protocols.</p>
 */
public class VisitProtocol_declaration {

    public static String v(ObjCParser.Protocol_declarationContext ctx, SwiftCodeBuilder b) {
        String header = (hasOptionalSection(ctx) ? "@objc " : "")
                + "protocol " + ctx.protocol_name().getText()
                + TypeHeaderBuilder.inheritance(null, ctx.protocol_reference_list());

        return TypeHeaderBuilder.block(header, b.visit(ctx.interface_declaration_list()), ctx, b);
    }

    private static boolean hasOptionalSection(ObjCParser.Protocol_declarationContext ctx) {
        if (ctx.interface_declaration_list() == null) {
            return false;
        }
        for (ObjCParser.Protocol_section_markerContext marker : ctx.interface_declaration_list().protocol_section_marker()) {
            if (marker.AT_OPTIONAL() != null) {
                return true;
            }
        }
        return false;
    }
}
