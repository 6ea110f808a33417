package me.christianrobert.objc2swift.transformer.context;

/**
 * Structural owner of a method declaration.
 * Assigned once per declaration when the transformation indices are built.
 */
public enum OwnerKind {
    CLASS_INTERFACE,
    CATEGORY_INTERFACE, // named category or class extension
    PROTOCOL,
    OTHER
}
