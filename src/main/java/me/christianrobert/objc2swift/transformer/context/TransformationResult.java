package me.christianrobert.objc2swift.transformer.context;

/**
 * Result of a transformation operation.
 * Contains either the generated Swift source or an error message.
 * Optionally includes AST tree representation for debugging.
 */
public class TransformationResult {

    private final boolean success;
    private final String swiftSource;
    private final String errorMessage;
    private final String objcSource;
    private final String astTree;  // Optional AST tree representation (null by default)

    private TransformationResult(boolean success, String swiftSource, String errorMessage, String objcSource, String astTree) {
        this.success = success;
        this.swiftSource = swiftSource;
        this.errorMessage = errorMessage;
        this.objcSource = objcSource;
        this.astTree = astTree;
    }

    /**
     * Creates a successful transformation result.
     */
    public static TransformationResult success(String objcSource, String swiftSource) {
        return new TransformationResult(true, swiftSource, null, objcSource, null);
    }

    /**
     * Creates a successful transformation result with AST tree.
     */
    public static TransformationResult successWithAst(String objcSource, String swiftSource, String astTree) {
        return new TransformationResult(true, swiftSource, null, objcSource, astTree);
    }

    /**
     * Creates a failed transformation result.
     */
    public static TransformationResult failure(String objcSource, String errorMessage) {
        return new TransformationResult(false, null, errorMessage, objcSource, null);
    }

    /**
     * Creates a failed transformation result from an exception.
     */
    public static TransformationResult failure(String objcSource, TransformationException exception) {
        return new TransformationResult(false, null, exception.getDetailedMessage(), objcSource, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getSwiftSource() {
        return swiftSource;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getObjcSource() {
        return objcSource;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, swiftSource='" + swiftSource + "'" +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "TransformationResult{success=false, error='" + errorMessage + "'" +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        }
    }
}
