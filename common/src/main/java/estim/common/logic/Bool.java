package estim.common.logic;

public enum Bool implements Statement {
  TRUE,
  FALSE;

  public static Bool of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean value() {
    return this == TRUE;
  }

  @Override
  public boolean defeq(Statement other) {
    return other == this;
  }

  @Override
  public Statement negate() {
    return of(!value());
  }

  @Override
  public String toString() {
    return value() ? "true" : "false";
  }
}
