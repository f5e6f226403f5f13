package estim.magnitude.expr;

import static estim.magnitude.expr.MExprSupport.ensureExpr;

/** The formal quotient of two expressions. */
public interface MDiv extends MExpr {
  @Override
  default MKind kind() {
    return MKind.DIV;
  }

  MExpr numerator();

  MExpr denominator();

  static MDiv mk(Object numerator, Object denominator) {
    return new MDivImpl(ensureExpr(numerator), ensureExpr(denominator));
  }
}
