package me.christianrobert.objc2swift.transformer;

import me.christianrobert.objc2swift.antlr.ObjCParser;
import me.christianrobert.objc2swift.transformer.builder.SwiftCodeBuilder;
import me.christianrobert.objc2swift.transformer.context.DefinitionIndexBuilder;
import me.christianrobert.objc2swift.transformer.context.TransformationContext;
import me.christianrobert.objc2swift.transformer.parser.AntlrParser;
import me.christianrobert.objc2swift.transformer.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for classes, categories, extensions, protocols, properties and method bodies.
 */
class ContainerTransformationTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private String transform(String objc) {
        ParseResult parseResult = parser.parseTranslationUnit(objc);
        assertFalse(parseResult.hasErrors(), "Parse should succeed: " + parseResult.getErrorMessage());

        ObjCParser.Translation_unitContext tree = parseResult.getTree();
        return new SwiftCodeBuilder(new TransformationContext(DefinitionIndexBuilder.build(tree))).visit(tree);
    }

    // ==================== Classes ====================

    @Test
    void interfaceAbsorbsImplementation() {
        String objc = "#import <Foundation/Foundation.h>\n"
                + "\n"
                + "@class Bar;\n"
                + "\n"
                + "@interface Foo : NSObject <NSCopying, NSCoding>\n"
                + "- (void)a;\n"
                + "@end\n"
                + "\n"
                + "@implementation Foo\n"
                + "- (void)b {\n"
                + "    y = 2;\n"
                + "}\n"
                + "- (void)a {\n"
                + "    x = 1;\n"
                + "}\n"
                + "@end\n";

        assertEquals("class Foo : NSObject, NSCopying, NSCoding {\n"
                + "    func a() {\n"
                + "        x = 1\n"
                + "    }\n"
                + "    func b() {\n"
                + "        y = 2\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    @Test
    void genericClassKeepsParameterNames() {
        String objc = "@interface Box<__covariant ObjectType> : NSObject <NSCopying>\n- (void)clear;\n@end\n";

        assertEquals("class Box<ObjectType> : NSObject, NSCopying {\n    func clear() {\n    }\n}\n", transform(objc));
    }

    @Test
    void implementationBeforeInterfaceIsStillEmittedOnce() {
        String objc = "@implementation Foo\n- (void)a {\n    x;\n}\n@end\n"
                + "@interface Foo\n- (void)a;\n@end\n";

        assertEquals("class Foo {\n    func a() {\n        x\n    }\n}\n", transform(objc));
    }

    @Test
    void implementationWithoutInterfaceBecomesClass() {
        String objc = "@implementation Foo : NSObject\n@synthesize name = _name;\n- (void)a {\n}\n@end\n";

        assertEquals("class Foo : NSObject {\n    func a() {\n    }\n}\n", transform(objc));
    }

    @Test
    void instanceVariablesAreDropped() {
        String objc = "@interface Foo : NSObject {\n@private\n    int count;\n    NSString *name;\n}\n- (void)a;\n@end\n";

        assertEquals("class Foo : NSObject {\n    func a() {\n    }\n}\n", transform(objc));
    }

    @Test
    void emptyClass() {
        assertEquals("class Foo {\n}\n", transform("@interface Foo\n@end\n"));
    }

    @Test
    void topLevelDeclarationsSeparatedByBlankLine() {
        String objc = "@protocol P\n@end\n@interface Foo\n@end\n";

        assertEquals("protocol P {\n}\n\nclass Foo {\n}\n", transform(objc));
    }

    @Test
    void forwardDeclarationsOnlyProduceNothing() {
        assertEquals("", transform("@class Foo, Bar;\n@protocol P;\n"));
    }

    // ==================== Categories and extensions ====================

    @Test
    void categoryAbsorbsCategoryImplementation() {
        String objc = "@interface Foo (Extras) <P>\n- (void)a;\n@end\n"
                + "@implementation Foo (Extras)\n- (void)a {\n    x = 1;\n}\n- (void)b {\n}\n@end\n";

        assertEquals("extension Foo : P {\n"
                + "    func a() {\n"
                + "        x = 1\n"
                + "    }\n"
                + "    func b() {\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    @Test
    void categoryImplementationWithoutInterfaceBecomesExtension() {
        String objc = "@implementation Foo (Extras)\n- (void)a {\n}\n@end\n";

        assertEquals("extension Foo {\n    func a() {\n    }\n}\n", transform(objc));
    }

    @Test
    void classExtensionDoesNotRepeatDefinitions() {
        String objc = "@interface Foo : NSObject\n- (void)a;\n@end\n"
                + "@interface Foo ()\n- (void)b;\n@end\n"
                + "@implementation Foo\n- (void)a {\n}\n- (void)b {\n}\n- (void)c {\n}\n@end\n";

        assertEquals("class Foo : NSObject {\n"
                + "    func a() {\n"
                + "    }\n"
                + "    func b() {\n"
                + "    }\n"
                + "    func c() {\n"
                + "    }\n"
                + "}\n"
                + "\n"
                + "extension Foo {\n"
                + "}\n", transform(objc));
    }

    @Test
    void classExtensionBeforeInterfaceInlinesItsDefinition() {
        String objc = "@interface Foo ()\n- (void)b;\n@end\n"
                + "@interface Foo\n@end\n"
                + "@implementation Foo\n- (void)b {\n}\n- (void)c {\n}\n@end\n";

        assertEquals("extension Foo {\n"
                + "    func b() {\n"
                + "    }\n"
                + "}\n"
                + "\n"
                + "class Foo {\n"
                + "    func c() {\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    // ==================== Protocols ====================

    @Test
    void protocolMembersHaveNoBodies() {
        String objc = "@protocol Loader <NSObject>\n- (void)load;\n+ (BOOL)isAvailable;\n@end\n";

        assertEquals("protocol Loader : NSObject {\n"
                + "    func load()\n"
                + "    class func isAvailable() -> Bool\n"
                + "}\n", transform(objc));
    }

    @Test
    void optionalProtocolMembers() {
        String objc = "@protocol Loader <NSObject>\n"
                + "- (void)load;\n"
                + "@optional\n"
                + "- (BOOL)canCancel;\n"
                + "@property (nonatomic, readonly) NSString *title;\n"
                + "@required\n"
                + "@property (nonatomic) NSInteger count;\n"
                + "@end\n";

        assertEquals("@objc protocol Loader : NSObject {\n"
                + "    func load()\n"
                + "    optional func canCancel() -> Bool\n"
                + "    optional var title: NSString { get }\n"
                + "    var count: Int { get set }\n"
                + "}\n", transform(objc));
    }

    @Test
    void protocolIsNeverInlinedFromSameNamedImplementation() {
        String objc = "@protocol Foo\n- (void)a;\n@end\n@implementation Foo\n- (void)a {\n    x;\n}\n@end\n";

        assertEquals("protocol Foo {\n"
                + "    func a()\n"
                + "}\n"
                + "\n"
                + "class Foo {\n"
                + "    func a() {\n"
                + "        x\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    // ==================== Properties ====================

    @Test
    void propertiesInClass() {
        String objc = "@interface Foo : NSObject\n"
                + "@property (nonatomic, weak) id delegate;\n"
                + "@property (readonly) NSInteger count;\n"
                + "@property (nonatomic, strong, nullable) NSArray *items;\n"
                + "@property BOOL flag;\n"
                + "@end\n";

        assertEquals("class Foo : NSObject {\n"
                + "    weak var delegate: AnyObject\n"
                + "    private(set) var count: Int\n"
                + "    var items: [AnyObject]\n"
                + "    var flag: Bool\n"
                + "}\n", transform(objc));
    }

    @Test
    void blockPropertyKeepsBlockType() {
        String objc = "@interface Foo : NSObject\n"
                + "@property (copy) void (^handler)(void);\n"
                + "@property (nonatomic, copy, nullable) BOOL (^filter)(id item, NSUInteger index);\n"
                + "- (void)loadWithCompletion:(void (^)(NSError *error))completion;\n"
                + "@end\n";

        assertEquals("class Foo : NSObject {\n"
                + "    var handler: void (^)(void)\n"
                + "    var filter: BOOL (^)(id item, NSUInteger index)\n"
                + "    func loadWithCompletion(completion: void (^)(NSError *error)) {\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    @Test
    void propertyWithSeveralNamesBecomesOneVarEach() {
        String objc = "@interface Foo : NSObject\n"
                + "@property (nonatomic, readonly) NSString *first, *last;\n"
                + "@end\n"
                + "@protocol Named\n"
                + "@property NSInteger a, b;\n"
                + "@end\n";

        assertEquals("class Foo : NSObject {\n"
                + "    private(set) var first: NSString\n"
                + "    private(set) var last: NSString\n"
                + "}\n"
                + "\n"
                + "protocol Named {\n"
                + "    var a: Int { get set }\n"
                + "    var b: Int { get set }\n"
                + "}\n", transform(objc));
    }

    // ==================== Method bodies ====================

    @Test
    void nestedBlocksKeepTheirHeaders() {
        String objc = "@implementation Foo\n"
                + "- (int)count {\n"
                + "    if (x) {\n"
                + "        return 1;\n"
                + "    }\n"
                + "    {\n"
                + "        y;\n"
                + "    }\n"
                + "    ;\n"
                + "    return 0;\n"
                + "}\n"
                + "@end\n";

        assertEquals("class Foo {\n"
                + "    func count() -> Int32 {\n"
                + "        if (x) {\n"
                + "            return 1\n"
                + "        }\n"
                + "        do {\n"
                + "            y\n"
                + "        }\n"
                + "        return 0\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    @Test
    void messageSendsAndLiteralsKeepSourceText() {
        String objc = "@implementation Foo\n"
                + "- (void)greet:(NSString *)name {\n"
                + "    NSLog(@\"Hello %@\", name);\n"
                + "    NSDictionary *d = @{@\"k\": @1};\n"
                + "}\n"
                + "@end\n";

        assertEquals("class Foo {\n"
                + "    func greet(name: NSString) {\n"
                + "        NSLog(@\"Hello %@\", name)\n"
                + "        NSDictionary *d = @{@\"k\": @1}\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    @Test
    void messageSendWithBlockLiteralStaysOneStatement() {
        String objc = "@implementation Foo\n"
                + "- (void)hide {\n"
                + "    [UIView animateWithDuration:0.3 animations:^{ self.alpha = 0; }];\n"
                + "    [self.items addObject:@{@\"k\": [NSNull null]}];\n"
                + "}\n"
                + "@end\n";

        assertEquals("class Foo {\n"
                + "    func hide() {\n"
                + "        [UIView animateWithDuration:0.3 animations:^{ self.alpha = 0; }]\n"
                + "        [self.items addObject:@{@\"k\": [NSNull null]}]\n"
                + "    }\n"
                + "}\n", transform(objc));
    }

    @Test
    void foreignDeclarationsAreSkipped() {
        String objc = "static int counter = 0;\n"
                + "typedef struct { int x; } Point;\n"
                + "@interface Foo\n@end\n";

        assertEquals("class Foo {\n}\n", transform(objc));
    }
}
