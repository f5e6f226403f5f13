package estim.magnitude.expr;

import org.apache.commons.math3.fraction.BigFraction;

import static estim.magnitude.expr.MExprSupport.ensureExpr;
import static estim.magnitude.expr.MExprSupport.toExponent;

/** The formal power of an expression. Exponents are exact rationals. */
public interface MPow extends MExpr {
  @Override
  default MKind kind() {
    return MKind.POW;
  }

  MExpr base();

  BigFraction exponent();

  /** @throws InvalidExponentException if the exponent is not an integer or an exact rational */
  static MPow mk(Object base, Object exponent) {
    return new MPowImpl(ensureExpr(base), toExponent(exponent));
  }
}
