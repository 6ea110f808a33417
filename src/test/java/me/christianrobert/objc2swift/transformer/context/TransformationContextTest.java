package me.christianrobert.objc2swift.transformer.context;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransformationContextTest {

    @Test
    void emittedDefinitionsAreTrackedByIdentity() {
        TransformationContext context = new TransformationContext(TransformationIndices.empty());
        ObjCParser.Method_definitionContext first = new ObjCParser.Method_definitionContext(null, 0);
        ObjCParser.Method_definitionContext second = new ObjCParser.Method_definitionContext(null, 0);

        context.markEmitted(first);

        assertTrue(context.isEmitted(first));
        assertFalse(context.isEmitted(second));
        assertEquals(1, context.getEmittedDefinitionCount());
    }

    @Test
    void freshContextHasNoState() {
        ObjCParser.Class_implementationContext implementation = new ObjCParser.Class_implementationContext(null, 0);
        TransformationContext used = new TransformationContext(TransformationIndices.empty());
        used.markAbsorbed(implementation);

        TransformationContext fresh = new TransformationContext(TransformationIndices.empty());

        assertTrue(used.isAbsorbed(implementation));
        assertFalse(fresh.isAbsorbed(implementation));
        assertEquals(0, fresh.getEmittedDefinitionCount());
    }

    @Test
    void indentUnit() {
        assertEquals("    ", new TransformationContext(TransformationIndices.empty()).getIndentUnit());
        assertEquals("\t", new TransformationContext(TransformationIndices.empty(), "\t").getIndentUnit());
        assertEquals("    ", new TransformationContext(TransformationIndices.empty(), null).getIndentUnit());
        assertThrows(IllegalArgumentException.class, () -> new TransformationContext(null));
    }

    @Test
    void emptyIndicesResolveNothing() {
        TransformationIndices indices = TransformationIndices.empty();

        assertNull(indices.getDeclaration(null));
        assertNull(indices.findDefinition(null, MethodKind.INSTANCE, "a"));
        assertNull(indices.getCorrespondingImplementation(null));
        assertEquals(0, indices.getDeclarationCount());
        assertEquals(0, indices.getDefinitionCount());
    }

    @Test
    void exceptionDetailIncludesSourceAndStage() {
        TransformationException e = new TransformationException("boom", "@end", "ANTLR parsing", new IllegalStateException());

        assertEquals("boom\nObjective-C source: @end\nContext: ANTLR parsing", e.getDetailedMessage());
        assertEquals("boom", new TransformationException("boom").getDetailedMessage());
    }

    @Test
    void failureResultFromException() {
        TransformationResult result = TransformationResult.failure("@end",
                new TransformationException("boom", "@end", "ANTLR parsing", null));

        assertTrue(result.isFailure());
        assertNull(result.getSwiftSource());
        assertTrue(result.getErrorMessage().startsWith("boom"));
    }
}
