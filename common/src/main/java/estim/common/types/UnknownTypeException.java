package estim.common.types;

import java.util.StringJoiner;

public class UnknownTypeException extends IllegalArgumentException {
  public UnknownTypeException(String tag) {
    super("unknown type " + tag + ". accepted types: " + acceptedTags());
  }

  private static String acceptedTags() {
    final StringJoiner joiner = new StringJoiner(", ");
    for (VarType type : VarType.values()) joiner.add(type.tag());
    return joiner.toString();
  }
}
