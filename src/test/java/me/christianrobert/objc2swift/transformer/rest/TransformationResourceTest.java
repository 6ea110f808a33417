package me.christianrobert.objc2swift.transformer.rest;

import me.christianrobert.objc2swift.transformer.context.TransformationResult;
import me.christianrobert.objc2swift.transformer.service.TransformationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TransformationResourceTest {

    private TransformationService transformationService;
    private TransformationResource resource;

    @BeforeEach
    void setUp() {
        transformationService = mock(TransformationService.class);

        resource = new TransformationResource();
        resource.transformationService = transformationService;
    }

    @Test
    void delegatesWithConfiguredAstDefault() {
        String objc = "@interface Foo\n@end\n";
        TransformationResult expected = TransformationResult.success(objc, "class Foo {\n}\n");
        when(transformationService.transformSource(objc)).thenReturn(expected);

        TransformationResult result = resource.transformObjc(null, objc);

        assertSame(expected, result);
        verify(transformationService).transformSource(objc);
        verify(transformationService, never()).transformSource(anyString(), anyBoolean());
    }

    @Test
    void explicitShowAstIsPassedOn() {
        String objc = "@interface Foo\n@end\n";
        TransformationResult expected = TransformationResult.successWithAst(objc, "class Foo {\n}\n", "translation_unit\n");
        when(transformationService.transformSource(objc, true)).thenReturn(expected);

        TransformationResult result = resource.transformObjc(true, objc);

        assertTrue(result.hasAstTree());
        verify(transformationService).transformSource(objc, true);
    }

    @Test
    void failureIsReturnedAsResult() {
        String objc = "@end";
        when(transformationService.transformSource(objc, false))
                .thenReturn(TransformationResult.failure(objc, "Parse errors: Line 1:0 - extraneous input"));

        TransformationResult result = resource.transformObjc(false, objc);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Parse errors:"));
    }

    @Test
    void emptyBodyIsRejectedWithoutCallingService() {
        TransformationResult result = resource.transformObjc(null, "  ");

        assertTrue(result.isFailure());
        assertEquals("Source cannot be empty", result.getErrorMessage());
        verifyNoInteractions(transformationService);
    }
}
