package me.christianrobert.objc2swift.transformer.context;

/**
 * Instance ({@code -}) or class ({@code +}) method.
 */
public enum MethodKind {
    INSTANCE,
    CLASS
}
