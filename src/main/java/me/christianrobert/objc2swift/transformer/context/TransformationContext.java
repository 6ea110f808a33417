package me.christianrobert.objc2swift.transformer.context;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Context for one transformation run.
 *
 * <p><strong>Immutable part</strong> (set at creation):</p>
 * <ul>
 *   <li>{@link #indices} - Pre-built declaration/definition indices for the parse tree</li>
 *   <li>{@link #indentUnit} - Whitespace emitted per nesting level</li>
 * </ul>
 *
 * <p><strong>Mutable part</strong> (de-duplication state, grows during the walk):</p>
 * <ul>
 *   <li>{@link #emittedDefinitions} - Method definitions already written to the output,
 *       either in place or inlined at their declaration's site</li>
 *   <li>{@link #absorbedImplementations} - Implementations already emitted inside their
 *       interface's class/extension block</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong> each transformation creates a fresh context; it is never
 * shared between runs or threads. Both sets compare parse tree nodes by identity.</p>
 *
 * @see TransformationIndices
 */
public class TransformationContext {

    public static final String DEFAULT_INDENT_UNIT = "    ";

    private final TransformationIndices indices;
    private final String indentUnit;

    private final Set<ObjCParser.Method_definitionContext> emittedDefinitions =
            Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<ParserRuleContext> absorbedImplementations =
            Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Creates a context with explicit indentation.
     *
     * @param indices Indices built for the tree being transformed
     * @param indentUnit Whitespace per nesting level (e.g., four spaces)
     */
    public TransformationContext(TransformationIndices indices, String indentUnit) {
        if (indices == null) {
            throw new IllegalArgumentException("Transformation indices cannot be null");
        }
        this.indices = indices;
        this.indentUnit = indentUnit != null ? indentUnit : DEFAULT_INDENT_UNIT;
    }

    /**
     * Creates a context with the default four-space indentation.
     */
    public TransformationContext(TransformationIndices indices) {
        this(indices, DEFAULT_INDENT_UNIT);
    }

    public TransformationIndices getIndices() {
        return indices;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    // ========== De-duplication ==========

    /**
     * Checks whether a method definition has already been emitted in this run.
     */
    public boolean isEmitted(ObjCParser.Method_definitionContext definition) {
        return emittedDefinitions.contains(definition);
    }

    /**
     * Records that a method definition has been emitted.
     */
    public void markEmitted(ObjCParser.Method_definitionContext definition) {
        emittedDefinitions.add(definition);
    }

    public int getEmittedDefinitionCount() {
        return emittedDefinitions.size();
    }

    /**
     * Checks whether an implementation was already emitted inside its interface's block.
     */
    public boolean isAbsorbed(ParserRuleContext implementation) {
        return absorbedImplementations.contains(implementation);
    }

    /**
     * Records that an implementation's remaining definitions were emitted with its interface.
     */
    public void markAbsorbed(ParserRuleContext implementation) {
        absorbedImplementations.add(implementation);
    }
}
