package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the opening and closing lines of Swift type blocks (class, extension, protocol).
 */
public class TypeHeaderBuilder {

    /**
     * Builds the inheritance clause: superclass first, then adopted protocols.
     *
     * @param superclass Superclass name node, may be null
     * @param protocols Protocol reference list, may be null
     * @return " : Super, P1, P2" or empty when nothing is inherited
     */
    public static String inheritance(ObjCParser.Superclass_nameContext superclass,
                                     ObjCParser.Protocol_reference_listContext protocols) {
        List<String> names = new ArrayList<>();
        if (superclass != null) {
            names.add(superclass.getText());
        }
        if (protocols != null && protocols.protocol_list() != null) {
            for (ObjCParser.Protocol_nameContext protocol : protocols.protocol_list().protocol_name()) {
                names.add(protocol.getText());
            }
        }
        if (names.isEmpty()) {
            return "";
        }
        return " : " + String.join(", ", names);
    }

    /**
     * Builds the generic parameter clause of a class. Variance keywords such as
     * {@code __covariant} and bounds are dropped, only the parameter names remain.
     *
     * @param parameters Generic parameter list, may be null
     * @return "&lt;T, U&gt;" or empty
     */
    public static String genericParameters(ObjCParser.Generic_parametersContext parameters) {
        if (parameters == null) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (ObjCParser.Generic_parameterContext parameter : parameters.generic_parameter()) {
            List<TerminalNode> identifiers = parameter.IDENTIFIER();
            if (!identifiers.isEmpty()) {
                names.add(identifiers.get(identifiers.size() - 1).getText());
            }
        }
        if (names.isEmpty()) {
            return "";
        }
        return "<" + String.join(", ", names) + ">";
    }

    /**
     * Wraps translated members into a block.
     *
     * @param header Declaration line without the opening brace (e.g., "class Foo : NSObject")
     * @param members Translated members, each ending with a newline
     * @param ctx Container node (for the closing brace's indentation)
     */
    public static String block(String header, String members, ParserRuleContext ctx, SwiftCodeBuilder b) {
        return b.indent(ctx) + header + " {\n" + members + b.indent(ctx) + "}";
    }
}
