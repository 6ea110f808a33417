package me.christianrobert.objc2swift.transformer.context;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Builds {@link TransformationIndices} from a parsed translation unit.
 *
 * <p>Objective-C splits a class into an interface (declarations) and an implementation
 * (definitions) that are not linked in the parse tree. This builder walks the tree once and
 * records, for every method declaration, where it lives and which implementation holds its
 * definition, so that resolution during code generation is a map lookup instead of a scan.
 *
 * <p>Usage:
 * <pre>
 * ParseResult parseResult = parser.parseTranslationUnit(source);
 * TransformationIndices indices = DefinitionIndexBuilder.build(parseResult.getTree());
 * </pre>
 *
 * <p>Matching rules:
 * <ul>
 *   <li>class interface → class implementation with the same class name</li>
 *   <li>category interface → category implementation with the same class and category name</li>
 *   <li>class extension ({@code @interface Foo ()}) → class implementation of Foo</li>
 *   <li>protocol → never has an implementation</li>
 * </ul>
 *
 * <p>When an implementation defines the same selector twice, the first definition wins.
 */
public class DefinitionIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(DefinitionIndexBuilder.class);

    /**
     * Builds transformation indices for one parse tree.
     * Called once at start of each transformation run.
     *
     * @param translationUnit Root of the parse tree
     * @return Immutable TransformationIndices ready for lookups
     */
    public static TransformationIndices build(ObjCParser.Translation_unitContext translationUnit) {
        if (translationUnit == null) {
            throw new IllegalArgumentException("Translation unit cannot be null");
        }

        Map<String, ObjCParser.Class_implementationContext> classImplementations = new HashMap<>();
        Map<String, ObjCParser.Category_implementationContext> categoryImplementations = new HashMap<>();
        Map<TransformationIndices.DefinitionKey, ObjCParser.Method_definitionContext> definitions = new HashMap<>();

        // Pass 1: implementations and their definitions
        for (ObjCParser.External_declarationContext external : translationUnit.external_declaration()) {
            if (external.class_implementation() != null) {
                ObjCParser.Class_implementationContext impl = external.class_implementation();
                String className = impl.class_name().getText();
                if (classImplementations.putIfAbsent(className, impl) != null) {
                    log.warn("Duplicate @implementation {}; keeping the first one", className);
                }
                indexDefinitions(impl, impl.implementation_definition_list(), definitions);

            } else if (external.category_implementation() != null) {
                ObjCParser.Category_implementationContext impl = external.category_implementation();
                String key = categoryKey(impl.class_name().getText(), impl.category_name().getText());
                if (categoryImplementations.putIfAbsent(key, impl) != null) {
                    log.warn("Duplicate @implementation {}; keeping the first one", key);
                }
                indexDefinitions(impl, impl.implementation_definition_list(), definitions);
            }
        }

        // Pass 2: interfaces and protocols with their declarations
        Map<ObjCParser.Method_declarationContext, TransformationIndices.DeclarationInfo> declarations =
                new IdentityHashMap<>();
        Map<ParserRuleContext, ParserRuleContext> correspondingImplementations = new IdentityHashMap<>();

        for (ObjCParser.External_declarationContext external : translationUnit.external_declaration()) {
            if (external.class_interface() != null) {
                ObjCParser.Class_interfaceContext iface = external.class_interface();
                ParserRuleContext impl = classImplementations.get(iface.class_name().getText());
                if (impl != null) {
                    correspondingImplementations.put(iface, impl);
                }
                indexDeclarations(iface.interface_declaration_list(), OwnerKind.CLASS_INTERFACE, impl, declarations);

            } else if (external.category_interface() != null) {
                ObjCParser.Category_interfaceContext iface = external.category_interface();
                String className = iface.class_name().getText();
                ParserRuleContext impl;
                if (iface.category_name() == null) {
                    // Class extension: methods are implemented in the main @implementation,
                    // which is absorbed by the class interface, not by the extension
                    impl = classImplementations.get(className);
                } else {
                    impl = categoryImplementations.get(categoryKey(className, iface.category_name().getText()));
                    if (impl != null) {
                        correspondingImplementations.put(iface, impl);
                    }
                }
                indexDeclarations(iface.interface_declaration_list(), OwnerKind.CATEGORY_INTERFACE, impl, declarations);

            } else if (external.protocol_declaration() != null) {
                indexDeclarations(external.protocol_declaration().interface_declaration_list(),
                        OwnerKind.PROTOCOL, null, declarations);
            }
        }

        log.debug("Indices built: {} declarations, {} definitions, {} interface/implementation pairs",
                declarations.size(), definitions.size(), correspondingImplementations.size());

        return new TransformationIndices(declarations, definitions, correspondingImplementations);
    }

    /**
     * Returns the selector text of a method selector: the unary name, or every keyword part
     * followed by a colon (e.g., "initWithName:age:").
     *
     * @param ctx Method selector node
     * @return Selector text
     * @throws IllegalStateException if the selector has neither form
     */
    public static String selectorText(ObjCParser.Method_selectorContext ctx) {
        if (ctx.selector() != null) {
            return ctx.selector().getText();
        }
        if (ctx.keyword_declarator().isEmpty()) {
            throw new IllegalStateException("Method selector has neither selector nor keyword declarators: " + ctx.getText());
        }

        StringBuilder sb = new StringBuilder();
        for (ObjCParser.Keyword_declaratorContext keyword : ctx.keyword_declarator()) {
            if (keyword.selector() != null) {
                sb.append(keyword.selector().getText());
            }
            sb.append(':');
        }
        return sb.toString();
    }

    private static void indexDefinitions(
            ParserRuleContext implementation,
            ObjCParser.Implementation_definition_listContext list,
            Map<TransformationIndices.DefinitionKey, ObjCParser.Method_definitionContext> definitions) {

        if (list == null) {
            return;
        }

        for (int i = 0; i < list.getChildCount(); i++) {
            ParseTree child = list.getChild(i);
            ObjCParser.Method_definitionContext definition;
            MethodKind kind;

            if (child instanceof ObjCParser.Instance_method_definitionContext) {
                definition = ((ObjCParser.Instance_method_definitionContext) child).method_definition();
                kind = MethodKind.INSTANCE;
            } else if (child instanceof ObjCParser.Class_method_definitionContext) {
                definition = ((ObjCParser.Class_method_definitionContext) child).method_definition();
                kind = MethodKind.CLASS;
            } else {
                continue; // @synthesize / @dynamic
            }

            String selector = selectorText(definition.method_selector());
            TransformationIndices.DefinitionKey key =
                    new TransformationIndices.DefinitionKey(implementation, kind, selector);

            if (definitions.putIfAbsent(key, definition) != null) {
                // First match wins; a second definition with the same selector is never inlined
                log.warn("Duplicate {} method definition '{}' at line {}; the first definition wins",
                        kind.name().toLowerCase(), selector, definition.getStart().getLine());
            }
        }
    }

    private static void indexDeclarations(
            ObjCParser.Interface_declaration_listContext list,
            OwnerKind ownerKind,
            ParserRuleContext implementation,
            Map<ObjCParser.Method_declarationContext, TransformationIndices.DeclarationInfo> declarations) {

        if (list == null) {
            return;
        }

        boolean optionalSection = false;

        for (int i = 0; i < list.getChildCount(); i++) {
            ParseTree child = list.getChild(i);
            ObjCParser.Method_declarationContext declaration;
            MethodKind kind;

            if (child instanceof ObjCParser.Protocol_section_markerContext) {
                optionalSection = ((ObjCParser.Protocol_section_markerContext) child).AT_OPTIONAL() != null;
                continue;
            } else if (child instanceof ObjCParser.Instance_method_declarationContext) {
                declaration = ((ObjCParser.Instance_method_declarationContext) child).method_declaration();
                kind = MethodKind.INSTANCE;
            } else if (child instanceof ObjCParser.Class_method_declarationContext) {
                declaration = ((ObjCParser.Class_method_declarationContext) child).method_declaration();
                kind = MethodKind.CLASS;
            } else {
                continue; // @property
            }

            boolean optional = ownerKind == OwnerKind.PROTOCOL && optionalSection;
            declarations.put(declaration, new TransformationIndices.DeclarationInfo(
                    ownerKind, kind, selectorText(declaration.method_selector()), optional, implementation));
        }
    }

    private static String categoryKey(String className, String categoryName) {
        return className + "(" + categoryName + ")";
    }
}
