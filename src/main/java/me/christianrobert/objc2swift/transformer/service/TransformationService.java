package me.christianrobert.objc2swift.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.config.service.ConfigService;
import me.christianrobert.objc2swift.transformer.builder.SwiftCodeBuilder;
import me.christianrobert.objc2swift.transformer.context.DefinitionIndexBuilder;
import me.christianrobert.objc2swift.transformer.context.TransformationContext;
import me.christianrobert.objc2swift.transformer.context.TransformationException;
import me.christianrobert.objc2swift.transformer.context.TransformationIndices;
import me.christianrobert.objc2swift.transformer.context.TransformationResult;
import me.christianrobert.objc2swift.transformer.parser.AntlrParser;
import me.christianrobert.objc2swift.transformer.parser.ParseResult;
import me.christianrobert.objc2swift.transformer.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transformation service for Objective-C to Swift.
 *
 * <p>Architecture:
 * <pre>
 * ObjC Source → ANTLR Parse → DefinitionIndexBuilder → SwiftCodeBuilder → Swift Source
 *                    ↓                 ↓                       ↓               ↓
 *               ObjCParser     TransformationIndices     Static Visitors      String
 * </pre>
 *
 * <p>Every call builds its own parse tree, indices and {@link TransformationContext}, so the
 * service holds no state between calls and concurrent requests are independent.
 */
@ApplicationScoped
public class TransformationService {

    private static final Logger log = LoggerFactory.getLogger(TransformationService.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    /**
     * Transforms an Objective-C source file to Swift.
     * AST output follows the {@code transformer.include-ast} configuration.
     *
     * @param objcSource Objective-C source (header and/or implementation)
     * @return TransformationResult containing either Swift source or error details
     */
    public TransformationResult transformSource(String objcSource) {
        Boolean includeAst = configService != null ? configService.getConfigValueAsBoolean(ConfigService.INCLUDE_AST) : null;
        return transformSource(objcSource, includeAst != null && includeAst);
    }

    /**
     * Transforms an Objective-C source file to Swift with optional AST tree output.
     *
     * @param objcSource Objective-C source (header and/or implementation)
     * @param includeAst Whether to include AST tree in result (for debugging)
     * @return TransformationResult containing Swift source and optionally the AST tree
     */
    public TransformationResult transformSource(String objcSource, boolean includeAst) {
        if (objcSource == null || objcSource.trim().isEmpty()) {
            return TransformationResult.failure(objcSource, "Objective-C source cannot be null or empty");
        }

        log.debug("Transforming Objective-C source ({} characters)", objcSource.length());
        log.trace("Objective-C source: {}", objcSource);

        try {
            // STEP 1: Parse Objective-C using ANTLR
            log.debug("Step 1: Parsing Objective-C source");
            ParseResult parseResult = parser.parseTranslationUnit(objcSource);

            if (parseResult.hasErrors()) {
                String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
                log.warn("Parse failed: {}", errorMsg);
                return TransformationResult.failure(objcSource, errorMsg);
            }

            ObjCParser.Translation_unitContext tree = parseResult.getTree();

            // STEP 2: Build declaration/definition indices
            log.debug("Step 2: Building definition indices");
            TransformationIndices indices = DefinitionIndexBuilder.build(tree);

            String astTree = null;
            if (includeAst) {
                log.debug("Generating AST tree representation");
                astTree = AstTreeFormatter.format(tree, indices);
            }

            // STEP 3: Create run-scoped context
            String indentUnit = " ".repeat(resolveIndentWidth());
            log.debug("Step 3: Creating transformation context (indent width {})", indentUnit.length());
            TransformationContext context = new TransformationContext(indices, indentUnit);

            // STEP 4: Transform parse tree to Swift
            log.debug("Step 4: Transforming to Swift");
            SwiftCodeBuilder builder = new SwiftCodeBuilder(context);
            String swiftSource = builder.visit(tree);

            log.info("Successfully transformed Objective-C source: {} definitions emitted",
                    context.getEmittedDefinitionCount());
            log.debug("Swift source: {}", swiftSource);

            if (includeAst) {
                return TransformationResult.successWithAst(objcSource, swiftSource, astTree);
            }
            return TransformationResult.success(objcSource, swiftSource);

        } catch (TransformationException e) {
            log.error("Transformation failed: {}", e.getDetailedMessage(), e);
            return TransformationResult.failure(objcSource, e);

        } catch (Exception e) {
            log.error("Unexpected error during transformation", e);
            String errorMsg = "Unexpected error: " + e.getMessage();
            return TransformationResult.failure(objcSource, errorMsg);
        }
    }

    private int resolveIndentWidth() {
        Integer width = configService != null ? configService.getConfigValueAsInteger(ConfigService.INDENT_WIDTH) : null;
        if (width == null || width < 0) {
            return TransformationContext.DEFAULT_INDENT_UNIT.length();
        }
        return width;
    }
}
