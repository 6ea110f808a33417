package me.christianrobert.objc2swift.transformer.builder;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.transformer.context.OwnerKind;
import me.christianrobert.objc2swift.transformer.context.TransformationIndices;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Optional;

/**
 * Links a method declaration to the definition that implements it.
 *
 * <p>Lookups go through the pre-built {@link TransformationIndices}:</p>
 * <ul>
 *   <li>Class interface: definition in the class implementation</li>
 *   <li>Category interface / class extension: definition in the matching implementation</li>
 *   <li>Protocol (or any other owner): never resolves, no implementation is consulted</li>
 * </ul>
 */
public class DefinitionResolver {

    /**
     * Finds the method definition that corresponds to a declaration.
     *
     * @param declaration Method declaration node
     * @param b SwiftCodeBuilder instance (provides access to the indices)
     * @return Matching definition, or empty when the owner is a protocol, the owner has no
     *         implementation, or the implementation lacks the selector
     */
    public static Optional<ObjCParser.Method_definitionContext> findCorrespondingDefinition(
            ObjCParser.Method_declarationContext declaration, SwiftCodeBuilder b) {

        TransformationIndices.DeclarationInfo info = b.getIndices().getDeclaration(declaration);
        if (info == null) {
            return Optional.empty();
        }

        switch (info.getOwnerKind()) {
            case CLASS_INTERFACE:
            case CATEGORY_INTERFACE:
                break;
            default:
                return Optional.empty();
        }

        return Optional.ofNullable(b.getIndices().findDefinition(
                info.getImplementation(), info.getMethodKind(), info.getSelector()));
    }

    /**
     * Returns the structural owner of a declaration.
     * Uses the indexed owner kind; declarations outside the index (snippets translated without
     * indices) are classified by walking up the parent chain.
     */
    public static OwnerKind ownerKind(ObjCParser.Method_declarationContext declaration, SwiftCodeBuilder b) {
        TransformationIndices.DeclarationInfo info = b.getIndices().getDeclaration(declaration);
        if (info != null) {
            return info.getOwnerKind();
        }

        for (ParserRuleContext p = declaration.getParent(); p != null; p = p.getParent()) {
            if (p instanceof ObjCParser.Protocol_declarationContext) {
                return OwnerKind.PROTOCOL;
            } else if (p instanceof ObjCParser.Class_interfaceContext) {
                return OwnerKind.CLASS_INTERFACE;
            } else if (p instanceof ObjCParser.Category_interfaceContext) {
                return OwnerKind.CATEGORY_INTERFACE;
            }
        }
        return OwnerKind.OTHER;
    }

    /**
     * Checks whether a declaration sits in an {@code @optional} protocol section.
     */
    public static boolean isOptional(ObjCParser.Method_declarationContext declaration, SwiftCodeBuilder b) {
        TransformationIndices.DeclarationInfo info = b.getIndices().getDeclaration(declaration);
        return info != null && info.isOptional();
    }
}
