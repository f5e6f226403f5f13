package estim.magnitude.expr;

public enum MKind {
  VAR,
  CONST,
  MAX,
  MIN,
  ADD,
  MUL,
  DIV,
  POW;

  public boolean isLeaf() {
    return this == VAR || this == CONST;
  }
}
