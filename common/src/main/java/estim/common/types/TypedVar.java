package estim.common.types;

import estim.common.utils.Commons;

/** A variable declaration "name : type". */
public record TypedVar(String name, VarType type) {
  public static TypedVar declare(String typeTag, String name) {
    return new TypedVar(name, VarType.ofTag(typeTag));
  }

  public boolean is(Assumption assumption) {
    return type.assumptions().contains(assumption);
  }

  @Override
  public String toString() {
    return Commons.describe(name, type);
  }
}
