package me.christianrobert.objc2swift.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.objc2swift.antlr.ObjCLexer;
import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.transformer.context.TransformationException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionContextCache;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the ANTLR ObjCParser.
 * Handles parser instantiation, error collection, and provides type-safe parsing methods.
 *
 * Uses two-stage parsing strategy:
 * 1. Try SLL(*) mode first (fast, low memory)
 * 2. Fall back to LL(*) mode if SLL fails (slower, handles all cases, reports errors)
 *
 * Clears ANTLR's static caches after each parse. The DFA and PredictionContextCache are shared
 * across all parser instances and otherwise grow with every translated file.
 *
 * This is the only class that directly instantiates ANTLR parsers.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);
    private static final boolean USE_TWO_STAGE_PARSING = true; // Can be toggled for testing

    /**
     * Clears the PredictionContextCache to prevent memory accumulation.
     * Uses reflection because PredictionContextCache doesn't expose a public clear() method.
     *
     * @param cache The prediction context cache to clear
     */
    private void clearPredictionContextCache(PredictionContextCache cache) {
        if (cache == null) {
            return;
        }

        try {
            Field cacheField = PredictionContextCache.class.getDeclaredField("cache");
            cacheField.setAccessible(true);
            Map<?, ?> internalCache = (Map<?, ?>) cacheField.get(cache);

            if (internalCache != null) {
                int sizeBefore = internalCache.size();
                internalCache.clear();
                log.trace("Cleared PredictionContextCache ({} entries removed)", sizeBefore);
            }
        } catch (NoSuchFieldException | IllegalAccessException e) {
            log.warn("Failed to clear PredictionContextCache via reflection (ANTLR API may have changed): {}",
                    e.getMessage());
        }
    }

    /**
     * Two-stage parsing strategy: Try SLL(*) first (fast), fall back to LL(*) if needed.
     * Syntax errors are only collected in the LL(*) pass; a successful SLL(*) parse is error free.
     *
     * @param source Source code to parse
     * @return ParseResult containing parse tree and errors
     */
    private ParseResult parseTwoStage(String source) {

        CharStream input = CharStreams.fromString(source);
        ObjCLexer lexer = new ObjCLexer(input);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        List<String> errors = new ArrayList<>();
        ObjCParser.Translation_unitContext tree;
        ObjCParser parser = null;

        try {
            if (USE_TWO_STAGE_PARSING) {
                // Stage 1: SLL(*) mode (fast path)
                parser = new ObjCParser(tokens);
                parser.getInterpreter().clearDFA();
                parser.removeErrorListeners();
                parser.setErrorHandler(new BailErrorStrategy());
                parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

                try {
                    log.trace("Attempting SLL(*) parse");
                    tree = parser.translation_unit();
                    log.trace("SLL(*) parse succeeded");

                } catch (Exception sllException) {
                    log.trace("SLL(*) parse failed at token {}, falling back to LL(*)", tokens.index());

                    // Stage 2: LL(*) mode with full error recovery (slow path)
                    tokens.seek(0);
                    parser.reset();
                    parser.removeErrorListeners();
                    parser.setErrorHandler(new DefaultErrorStrategy());
                    parser.getInterpreter().setPredictionMode(PredictionMode.LL);
                    parser.addErrorListener(new CollectingErrorListener(errors));

                    tree = parser.translation_unit();
                    log.debug("LL(*) parse completed with {} syntax errors", errors.size());
                }

            } else {
                parser = new ObjCParser(tokens);
                parser.getInterpreter().clearDFA();
                parser.removeErrorListeners();
                parser.addErrorListener(new CollectingErrorListener(errors));

                tree = parser.translation_unit();
            }

            return new ParseResult(tree, errors, source);

        } finally {
            if (parser != null) {
                parser.getInterpreter().clearDFA();
                clearPredictionContextCache(parser.getInterpreter().getSharedContextCache());
                log.trace("Cleared DFA and PredictionContext caches");
            }
        }
    }

    /**
     * Parses a complete Objective-C source file (header or implementation).
     *
     * @param source Objective-C source code
     * @return ParseResult containing the parse tree and any errors
     */
    public ParseResult parseTranslationUnit(String source) {
        if (source == null || source.trim().isEmpty()) {
            throw new TransformationException("Objective-C source cannot be null or empty");
        }

        log.debug("Parsing translation unit: {}", source.substring(0, Math.min(100, source.length())));

        try {
            return parseTwoStage(source);
        } catch (Exception e) {
            log.error("Failed to parse Objective-C source", e);
            throw new TransformationException("Failed to parse Objective-C source: " + e.getMessage(),
                    source, "ANTLR parsing", e);
        }
    }

    /**
     * Collects syntax errors as "Line l:c - message".
     */
    private static class CollectingErrorListener extends BaseErrorListener {
        private final List<String> errors;

        CollectingErrorListener(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
            errors.add(error);
            log.warn("Parse error: {}", error);
        }
    }
}
