package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the root rule.
 * Top-level declarations producing output are separated by one blank line.
 */
public class VisitTranslation_unit {

    public static String v(ObjCParser.Translation_unitContext ctx, SwiftCodeBuilder b) {
        List<String> blocks = new ArrayList<>();
        for (ObjCParser.External_declarationContext external : ctx.external_declaration()) {
            String block = b.visit(external);
            if (!block.isBlank()) {
                blocks.add(block);
            }
        }

        if (blocks.isEmpty()) {
            return "";
        }
        return String.join("\n\n", blocks) + "\n";
    }
}
