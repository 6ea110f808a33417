package me.christianrobert.objc2swift.transformer;

import me.christianrobert.objc2swift.transformer.context.TransformationException;
import me.christianrobert.objc2swift.transformer.parser.AntlrParser;
import me.christianrobert.objc2swift.transformer.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ANTLR front-end: successful parses, collected syntax errors and input checks.
 */
class AntlrParserTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    @Test
    void parseInterface() {
        ParseResult parseResult = parser.parseTranslationUnit("@interface Foo : NSObject\n- (void)a;\n@end\n");

        assertTrue(parseResult.isSuccess(), "Parsing should succeed");
        assertFalse(parseResult.hasErrors(), "Should have no errors");
        assertNotNull(parseResult.getTree(), "Parse tree should not be null");
        assertEquals(1, parseResult.getTree().external_declaration().size());
    }

    @Test
    void parseIgnoresCommentsAndDirectives() {
        String objc = "#import \"Foo.h\"\n"
                + "// line comment\n"
                + "/* block\n comment */\n"
                + "@implementation Foo\n"
                + "- (void)a { /* inside */ }\n"
                + "@end\n";

        ParseResult parseResult = parser.parseTranslationUnit(objc);

        assertTrue(parseResult.isSuccess());
        assertEquals(objc, parseResult.getOriginalSource());
    }

    @Test
    void parseReportsMissingSemicolon() {
        ParseResult parseResult = parser.parseTranslationUnit("@interface Foo\n- (void)a\n@end\n");

        assertTrue(parseResult.hasErrors(), "Missing ';' should be reported");
        assertFalse(parseResult.isSuccess());
        assertEquals(1, parseResult.getErrors().size());
        assertTrue(parseResult.getErrorMessage().contains("Line 3:0"),
                "Error should carry the position: " + parseResult.getErrorMessage());
    }

    @Test
    void parseReportsUnclosedBody() {
        ParseResult parseResult = parser.parseTranslationUnit("@implementation Foo\n- (void)a {\n    x;\n");

        assertTrue(parseResult.hasErrors());
    }

    @Test
    void parseReportsStrayEnd() {
        ParseResult parseResult = parser.parseTranslationUnit("@end\n");

        assertTrue(parseResult.hasErrors());
    }

    @Test
    void parseRejectsBlankInput() {
        assertThrows(TransformationException.class, () -> parser.parseTranslationUnit("   "));
        assertThrows(TransformationException.class, () -> parser.parseTranslationUnit(null));
    }

    @Test
    void repeatedParsesAreIndependent() {
        ParseResult first = parser.parseTranslationUnit("@interface A\n@end\n");
        ParseResult broken = parser.parseTranslationUnit("@interface B\n- (void)\n@end\n");
        ParseResult second = parser.parseTranslationUnit("@interface C\n@end\n");

        assertTrue(first.isSuccess());
        assertTrue(broken.hasErrors());
        assertTrue(second.isSuccess());
    }
}
