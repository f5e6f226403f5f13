package estim.common.logic;

import estim.common.types.TypedVar;
import estim.common.types.VarType;

/** A named boolean variable. */
public final class Proposition implements Statement {
  private final String name;

  private Proposition(String name) {
    this.name = name;
  }

  public static Proposition mk(String name) {
    return new Proposition(name);
  }

  public static Proposition mk(TypedVar declaration) {
    if (declaration.type() != VarType.BOOL)
      throw new IllegalArgumentException("not a boolean declaration: " + declaration);
    return new Proposition(declaration.name());
  }

  public String name() {
    return name;
  }

  @Override
  public boolean defeq(Statement other) {
    return other instanceof Proposition that && name.equals(that.name);
  }

  /** A proposition that is itself a hypothesis is true; one whose negation is, false. */
  @Override
  public Statement simp(Hypotheses hypotheses) {
    if (hypotheses.contains(this)) return Bool.TRUE;
    if (hypotheses.contains(Not.mk(this))) return Bool.FALSE;
    return this;
  }

  @Override
  public String toString() {
    return name;
  }
}
