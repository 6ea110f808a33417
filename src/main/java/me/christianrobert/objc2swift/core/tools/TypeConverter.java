package me.christianrobert.objc2swift.core.tools;

public class TypeConverter {

  public static final String DEFAULT_TYPE = "AnyObject";

  /**
   * Maps an Objective-C primitive keyword (void, id, int, ...) to its Swift type.
   * Unknown keywords pass through unchanged; empty input falls back to AnyObject.
   */
  public static String toSwiftPrimitive(String keyword) {
    if (keyword == null || keyword.isEmpty()) {
      return DEFAULT_TYPE;
    }

    switch (keyword) {
      case "void":
        return "void";
      case "id":
        return DEFAULT_TYPE;
      case "short":
        return "Int8";
      case "int":
      case "long":
        return "Int32";
      case "float":
        return "Float";
      case "double":
        return "Double";
      default:
        return keyword;
    }
  }

  /**
   * Maps a Foundation class or typedef name to its Swift counterpart.
   * Unknown names (user classes) pass through unchanged; empty input falls back to AnyObject.
   */
  public static String toSwiftClassName(String className) {
    if (className == null || className.isEmpty()) {
      return DEFAULT_TYPE;
    }

    switch (className) {
      case "NSInteger":
      case "NSUInteger":
        return "Int";
      case "NSArray":
        return "[AnyObject]";
      case "NSDictionary":
        return "[NSObject : AnyObject]";
      case "SEL":
        return "Selector";
      case "BOOL":
        return "Bool";
      default:
        return className;
    }
  }
}
