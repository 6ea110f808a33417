package me.christianrobert.objc2swift.transformer.context;

/**
 * Exception thrown during Objective-C to Swift transformation.
 * Captures the offending source snippet and the stage that failed.
 */
public class TransformationException extends RuntimeException {

    private final String objcSource;
    private final String context;

    public TransformationException(String message) {
        super(message);
        this.objcSource = null;
        this.context = null;
    }

    public TransformationException(String message, String objcSource, String context, Throwable cause) {
        super(message, cause);
        this.objcSource = objcSource;
        this.context = context;
    }

    public String getObjcSource() {
        return objcSource;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including source and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (objcSource != null) {
            sb.append("\nObjective-C source: ").append(objcSource);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
