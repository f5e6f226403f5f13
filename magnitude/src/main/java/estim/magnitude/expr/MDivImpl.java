package estim.magnitude.expr;

import java.util.List;

final class MDivImpl implements MDiv {
  private final MExpr numerator;
  private final MExpr denominator;
  private final String str;

  MDivImpl(MExpr numerator, MExpr denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
    this.str = "(" + numerator + " / " + denominator + ")";
  }

  @Override
  public MExpr numerator() {
    return numerator;
  }

  @Override
  public MExpr denominator() {
    return denominator;
  }

  @Override
  public List<MExpr> operands() {
    return List.of(numerator, denominator);
  }

  @Override
  public String toString() {
    return str;
  }
}
