package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCBaseVisitor;
import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.transformer.context.TransformationContext;
import me.christianrobert.objc2swift.transformer.context.TransformationIndices;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Visitor that turns an Objective-C parse tree into Swift source text.
 *
 * <p>Each rule delegates to a static {@code VisitXxx.v(ctx, this)} helper; this class only holds
 * the run's {@link TransformationContext} and the indentation service.</p>
 *
 * <p>One builder per transformation run. The context carries the de-duplication state, so a
 * builder must not be reused for another tree.</p>
 */
public class SwiftCodeBuilder extends ObjCBaseVisitor<String> {

    // no logging is desired, this would create an overkill of logs

    private final TransformationContext context;

    /**
     * Creates a SwiftCodeBuilder with transformation context.
     *
     * @param context Transformation context holding indices and de-duplication state
     */
    public SwiftCodeBuilder(TransformationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Transformation context cannot be null");
        }
        this.context = context;
    }

    /**
     * Creates a SwiftCodeBuilder without any cross-reference information.
     * Declarations never resolve to definitions; useful for translating isolated snippets.
     */
    public SwiftCodeBuilder() {
        this(new TransformationContext(TransformationIndices.empty()));
    }

    public TransformationContext getContext() {
        return context;
    }

    public TransformationIndices getIndices() {
        return context.getIndices();
    }

    // ========== Indentation ==========

    /**
     * Returns the whitespace prefix for a node's nesting depth.
     * Depth counts the enclosing containers (class/category/protocol blocks and compound statements).
     *
     * @param ctx Node to indent
     * @return Indentation prefix (empty at top level)
     */
    public String indent(ParserRuleContext ctx) {
        int depth = 0;
        for (ParserRuleContext p = ctx.getParent(); p != null; p = p.getParent()) {
            if (isIndentingContainer(p)) {
                depth++;
            }
        }
        return context.getIndentUnit().repeat(depth);
    }

    private static boolean isIndentingContainer(ParserRuleContext ctx) {
        return ctx instanceof ObjCParser.Class_interfaceContext
                || ctx instanceof ObjCParser.Category_interfaceContext
                || ctx instanceof ObjCParser.Class_implementationContext
                || ctx instanceof ObjCParser.Category_implementationContext
                || ctx instanceof ObjCParser.Protocol_declarationContext
                || ctx instanceof ObjCParser.Compound_statementContext;
    }

    /**
     * Removes one trailing space (left behind by empty prefixes).
     */
    static String stripTrailingSpace(String text) {
        return text.endsWith(" ") ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Returns the original source text of a node, including hidden-channel whitespace.
     */
    static String sourceText(ParserRuleContext ctx) {
        if (ctx.getStart() == null || ctx.getStop() == null
                || ctx.getStop().getStopIndex() < ctx.getStart().getStartIndex()) {
            return "";
        }
        return ctx.getStart().getInputStream()
                .getText(Interval.of(ctx.getStart().getStartIndex(), ctx.getStop().getStopIndex()));
    }

    // ========== Default behavior ==========

    @Override
    protected String defaultResult() {
        return "";
    }

    @Override
    protected String aggregateResult(String aggregate, String nextResult) {
        if (nextResult == null) {
            return aggregate;
        }
        return aggregate + nextResult;
    }

    @Override
    public String visit(ParseTree tree) {
        if (tree == null) {
            return "";
        }
        return super.visit(tree);
    }

    // ========== Translation unit and containers ==========

    @Override
    public String visitTranslation_unit(ObjCParser.Translation_unitContext ctx) {
        return VisitTranslation_unit.v(ctx, this);
    }

    @Override
    public String visitClass_interface(ObjCParser.Class_interfaceContext ctx) {
        return VisitClass_interface.v(ctx, this);
    }

    @Override
    public String visitCategory_interface(ObjCParser.Category_interfaceContext ctx) {
        return VisitCategory_interface.v(ctx, this);
    }

    @Override
    public String visitClass_implementation(ObjCParser.Class_implementationContext ctx) {
        return VisitClass_implementation.v(ctx, this);
    }

    @Override
    public String visitCategory_implementation(ObjCParser.Category_implementationContext ctx) {
        return VisitCategory_implementation.v(ctx, this);
    }

    @Override
    public String visitProtocol_declaration(ObjCParser.Protocol_declarationContext ctx) {
        return VisitProtocol_declaration.v(ctx, this);
    }

    @Override
    public String visitProtocol_declaration_list(ObjCParser.Protocol_declaration_listContext ctx) {
        return ""; // Forward declaration
    }

    @Override
    public String visitClass_declaration_list(ObjCParser.Class_declaration_listContext ctx) {
        return ""; // Forward declaration
    }

    @Override
    public String visitForeign_declaration(ObjCParser.Foreign_declarationContext ctx) {
        return ""; // Plain C is not translated
    }

    @Override
    public String visitInstance_variables(ObjCParser.Instance_variablesContext ctx) {
        return "";
    }

    @Override
    public String visitInterface_declaration_list(ObjCParser.Interface_declaration_listContext ctx) {
        return VisitDeclarationList.v(ctx, this);
    }

    @Override
    public String visitImplementation_definition_list(ObjCParser.Implementation_definition_listContext ctx) {
        return VisitDeclarationList.v(ctx, this);
    }

    @Override
    public String visitProperty_declaration(ObjCParser.Property_declarationContext ctx) {
        return VisitProperty_declaration.v(ctx, this);
    }

    @Override
    public String visitProperty_implementation(ObjCParser.Property_implementationContext ctx) {
        return ""; // @synthesize / @dynamic have no Swift counterpart
    }

    // ========== Methods ==========

    @Override
    public String visitInstance_method_declaration(ObjCParser.Instance_method_declarationContext ctx) {
        return VisitMethod_declaration.v(ctx, this);
    }

    @Override
    public String visitClass_method_declaration(ObjCParser.Class_method_declarationContext ctx) {
        return VisitMethod_declaration.v(ctx, this);
    }

    @Override
    public String visitMethod_declaration(ObjCParser.Method_declarationContext ctx) {
        return VisitMethod_declaration.v(ctx, this);
    }

    @Override
    public String visitInstance_method_definition(ObjCParser.Instance_method_definitionContext ctx) {
        return VisitMethod_definition.v(ctx, this);
    }

    @Override
    public String visitClass_method_definition(ObjCParser.Class_method_definitionContext ctx) {
        return VisitMethod_definition.v(ctx, this);
    }

    @Override
    public String visitMethod_definition(ObjCParser.Method_definitionContext ctx) {
        return VisitMethod_definition.v(ctx, this);
    }

    @Override
    public String visitMethod_selector(ObjCParser.Method_selectorContext ctx) {
        return VisitMethod_selector.v(ctx, this);
    }

    @Override
    public String visitKeyword_declarator(ObjCParser.Keyword_declaratorContext ctx) {
        return VisitMethod_selector.v(ctx, this, false);
    }

    @Override
    public String visitSelector(ObjCParser.SelectorContext ctx) {
        return ctx.getText();
    }

    // ========== Types ==========

    @Override
    public String visitMethod_type(ObjCParser.Method_typeContext ctx) {
        return VisitMethod_type.v(ctx, this);
    }

    @Override
    public String visitType_name(ObjCParser.Type_nameContext ctx) {
        return visit(ctx.block_type() != null ? ctx.block_type() : ctx.type_specifier());
    }

    @Override
    public String visitBlock_type(ObjCParser.Block_typeContext ctx) {
        return VisitType_specifier.v(ctx, this);
    }

    @Override
    public String visitType_specifier(ObjCParser.Type_specifierContext ctx) {
        return VisitType_specifier.v(ctx, this);
    }

    @Override
    public String visitPointer(ObjCParser.PointerContext ctx) {
        return VisitType_specifier.v(ctx, this);
    }

    // ========== Statements ==========

    @Override
    public String visitCompound_statement(ObjCParser.Compound_statementContext ctx) {
        return VisitCompound_statement.v(ctx, this);
    }

    @Override
    public String visitBlock_item(ObjCParser.Block_itemContext ctx) {
        return VisitCompound_statement.v(ctx, this);
    }
}
