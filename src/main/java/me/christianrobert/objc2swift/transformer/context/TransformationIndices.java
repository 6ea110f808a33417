package me.christianrobert.objc2swift.transformer.context;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pre-built lookup indices over one parse tree for O(1) queries during transformation.
 *
 * <p>The Objective-C parse tree does not link a method declaration (in an interface) to its
 * definition (in an implementation). These indices are built once per transformation run and
 * provide:
 * <ul>
 *   <li>Per declaration: owner kind, method kind, selector text, optional flag and the
 *       corresponding implementation (if any)</li>
 *   <li>Definitions keyed by (implementation, method kind, selector text)</li>
 *   <li>Interface to implementation correspondence (for absorbing implementations into the
 *       emitted class/extension block)</li>
 * </ul>
 *
 * <p>Parse tree nodes are keyed by identity. The indices are immutable once built.
 *
 * <p>Built by {@link DefinitionIndexBuilder}.
 */
public class TransformationIndices {

    // Method_declarationContext → declaration facts
    private final Map<ObjCParser.Method_declarationContext, DeclarationInfo> declarations;

    // (implementation, kind, selector) → first matching Method_definitionContext
    private final Map<DefinitionKey, ObjCParser.Method_definitionContext> definitions;

    // class_interface/category_interface → class_implementation/category_implementation
    private final Map<ParserRuleContext, ParserRuleContext> correspondingImplementations;

    public TransformationIndices(
            Map<ObjCParser.Method_declarationContext, DeclarationInfo> declarations,
            Map<DefinitionKey, ObjCParser.Method_definitionContext> definitions,
            Map<ParserRuleContext, ParserRuleContext> correspondingImplementations) {

        this.declarations = Collections.unmodifiableMap(new IdentityHashMap<>(declarations));
        this.definitions = Collections.unmodifiableMap(new HashMap<>(definitions));
        this.correspondingImplementations =
                Collections.unmodifiableMap(new IdentityHashMap<>(correspondingImplementations));
    }

    /**
     * Creates empty indices (nothing resolves).
     */
    public static TransformationIndices empty() {
        return new TransformationIndices(new IdentityHashMap<>(), new HashMap<>(), new IdentityHashMap<>());
    }

    /**
     * Gets the indexed facts of a method declaration.
     *
     * @param declaration Method declaration node
     * @return DeclarationInfo or null if the node was not indexed
     */
    public DeclarationInfo getDeclaration(ObjCParser.Method_declarationContext declaration) {
        if (declaration == null) {
            return null;
        }
        return declarations.get(declaration);
    }

    /**
     * Looks up the first definition with the given selector in an implementation.
     *
     * @param implementation class_implementation or category_implementation node
     * @param kind Instance or class method list to search
     * @param selector Selector text (e.g., "initWithName:age:")
     * @return Method definition or null if not found
     */
    public ObjCParser.Method_definitionContext findDefinition(ParserRuleContext implementation,
                                                             MethodKind kind, String selector) {
        if (implementation == null || kind == null || selector == null) {
            return null;
        }
        return definitions.get(new DefinitionKey(implementation, kind, selector));
    }

    /**
     * Gets the implementation matching an interface or category interface.
     *
     * @param interfaceContext class_interface or category_interface node
     * @return Implementation node or null if the interface has none
     */
    public ParserRuleContext getCorrespondingImplementation(ParserRuleContext interfaceContext) {
        if (interfaceContext == null) {
            return null;
        }
        return correspondingImplementations.get(interfaceContext);
    }

    /**
     * Checks whether an implementation is emitted as part of its interface's block.
     */
    public boolean hasCorrespondingInterface(ParserRuleContext implementation) {
        return correspondingImplementations.containsValue(implementation);
    }

    public int getDeclarationCount() {
        return declarations.size();
    }

    public int getDefinitionCount() {
        return definitions.size();
    }

    /**
     * Facts about one method declaration, computed once at index build time.
     */
    public static class DeclarationInfo {
        private final OwnerKind ownerKind;
        private final MethodKind methodKind;
        private final String selector;
        private final boolean optional;
        private final ParserRuleContext implementation;

        public DeclarationInfo(OwnerKind ownerKind, MethodKind methodKind, String selector,
                               boolean optional, ParserRuleContext implementation) {
            this.ownerKind = ownerKind;
            this.methodKind = methodKind;
            this.selector = selector;
            this.optional = optional;
            this.implementation = implementation;
        }

        public OwnerKind getOwnerKind() {
            return ownerKind;
        }

        public MethodKind getMethodKind() {
            return methodKind;
        }

        public String getSelector() {
            return selector;
        }

        /**
         * True for protocol members declared in an {@code @optional} section.
         */
        public boolean isOptional() {
            return optional;
        }

        /**
         * Corresponding implementation of the owning interface (null for protocols and
         * interfaces without implementation).
         */
        public ParserRuleContext getImplementation() {
            return implementation;
        }

        @Override
        public String toString() {
            return "DeclarationInfo{owner=" + ownerKind + ", kind=" + methodKind +
                   ", selector='" + selector + "'" + (optional ? ", optional" : "") + "}";
        }
    }

    /**
     * Definition lookup key. The implementation node is compared by identity.
     */
    public static class DefinitionKey {
        private final ParserRuleContext implementation;
        private final MethodKind kind;
        private final String selector;

        public DefinitionKey(ParserRuleContext implementation, MethodKind kind, String selector) {
            this.implementation = implementation;
            this.kind = kind;
            this.selector = selector;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DefinitionKey)) {
                return false;
            }
            DefinitionKey other = (DefinitionKey) o;
            return implementation == other.implementation
                    && kind == other.kind
                    && selector.equals(other.selector);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(implementation), kind, selector);
        }

        @Override
        public String toString() {
            return "DefinitionKey{kind=" + kind + ", selector='" + selector + "'}";
        }
    }
}
