package me.christianrobert.objc2swift.transformer.util;

import me.christianrobert.objc2swift.antlr.ObjCLexer;
import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.transformer.context.TransformationIndices;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Formats ANTLR parse trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and understanding how Objective-C is parsed by the grammar.</p>
 *
 * <p>Example output (without indices):</p>
 * <pre>
 * instance_method_declaration
 *   "-" (MINUS)
 *   method_declaration
 *     method_type
 *       "(" (LPAREN)
 *       type_name [void]
 *         type_specifier [void]
 *           "void" (VOID)
 *       ")" (RPAREN)
 *     method_selector [reload]
 *       selector [reload]
 *         "reload" (IDENTIFIER)
 *     ";" (SEMI)
 * </pre>
 *
 * <p>With indices, method declarations are annotated with their owner, e.g.
 * {@code [OWNER: PROTOCOL, INSTANCE reload, optional]}.</p>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a parse tree into human-readable text.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    return format(tree, null);
  }

  /**
   * Formats a parse tree with declaration annotations.
   *
   * @param tree Root of the parse tree
   * @param indices Indices built for this tree, may be null
   * @return Formatted string representation with owner annotations
   */
  public static String format(ParseTree tree, TransformationIndices indices) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb, indices);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb, TransformationIndices indices) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    if (tree instanceof TerminalNode) {
      TerminalNode terminal = (TerminalNode) tree;

      sb.append("\"").append(escapeAndTruncate(terminal.getText())).append("\"");
      sb.append(" (").append(getTokenName(terminal)).append(")");
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // Text snippet for small nodes
      if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }

      if (indices != null && ctx instanceof ObjCParser.Method_declarationContext) {
        TransformationIndices.DeclarationInfo info =
            indices.getDeclaration((ObjCParser.Method_declarationContext) ctx);
        if (info != null) {
          sb.append(" [OWNER: ").append(info.getOwnerKind())
            .append(", ").append(info.getMethodKind()).append(" ").append(info.getSelector());
          if (info.isOptional()) {
            sb.append(", optional");
          }
          sb.append("]");
        }
      }

      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb, indices);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  /**
   * Gets the grammar rule name of a parser rule context.
   */
  private static String getRuleName(ParserRuleContext ctx) {
    int ruleIndex = ctx.getRuleIndex();
    if (ruleIndex >= 0 && ruleIndex < ObjCParser.ruleNames.length) {
      return ObjCParser.ruleNames[ruleIndex];
    }
    return ctx.getClass().getSimpleName();
  }

  /**
   * Gets the lexer's symbolic token name (e.g., IDENTIFIER, SEMI).
   */
  private static String getTokenName(TerminalNode terminal) {
    int type = terminal.getSymbol().getType();
    if (type == Token.EOF) {
      return "EOF";
    }
    String name = ObjCLexer.VOCABULARY.getSymbolicName(type);
    return name != null ? name : String.valueOf(type);
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
