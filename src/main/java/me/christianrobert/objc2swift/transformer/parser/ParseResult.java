package me.christianrobert.objc2swift.transformer.parser;

import me.christianrobert.objc2swift.antlr.ObjCParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing one Objective-C source file: the translation unit and the syntax errors
 * collected by the LL(*) pass ("Line l:c - message").
 *
 * <p>With errors present the tree is still the recovered tree and must not be transformed.</p>
 */
public class ParseResult {

    private final ObjCParser.Translation_unitContext tree;
    private final List<String> errors;
    private final String originalSource;

    public ParseResult(ObjCParser.Translation_unitContext tree, List<String> errors, String originalSource) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.originalSource = originalSource;
    }

    public ObjCParser.Translation_unitContext getTree() {
        return tree;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getOriginalSource() {
        return originalSource;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Joins all syntax errors, one per line.
     *
     * @return Error text or null when parsing succeeded
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{errors=" + errors + "}";
    }
}
