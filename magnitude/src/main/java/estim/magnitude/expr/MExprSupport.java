package estim.magnitude.expr;

import estim.common.logic.Hypotheses;
import estim.common.utils.MatchingSupport;
import estim.magnitude.expr.normalizer.MNormalization;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.fraction.Fraction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public abstract class MExprSupport {
  private MExprSupport() {}

  /** Returns `obj` if it is already an expression, or wraps a number into a constant. */
  public static MExpr ensureExpr(Object obj) {
    if (obj instanceof MExpr expr) return expr;
    if (obj instanceof Number number) return MConst.mk(number);
    throw new InvalidOperandException(
        "expected an expression or a number, was "
            + (obj == null ? "null" : obj.getClass().getSimpleName()));
  }

  public static List<MExpr> ensureExprs(Object... objs) {
    final List<MExpr> exprs = new ArrayList<>(objs.length);
    for (Object obj : objs) exprs.add(ensureExpr(obj));
    return exprs;
  }

  static BigDecimal toDecimal(Number value) {
    if (value instanceof BigDecimal decimal) return decimal;
    if (value instanceof BigInteger integer) return new BigDecimal(integer);
    if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte)
      return BigDecimal.valueOf(value.longValue());
    if (value instanceof BigFraction fraction) return fractionToDecimal(fraction);
    if (value instanceof Fraction fraction)
      return fractionToDecimal(
          new BigFraction(fraction.getNumerator(), fraction.getDenominator()));

    final double d = value.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d))
      throw new InvalidOperandException("constant value must be finite, was " + value);
    return BigDecimal.valueOf(d);
  }

  private static BigDecimal fractionToDecimal(BigFraction fraction) {
    return new BigDecimal(fraction.getNumerator())
        .divide(new BigDecimal(fraction.getDenominator()), MathContext.DECIMAL128);
  }

  /** Exponents are exact: integers and rationals only, never floating point. */
  public static BigFraction toExponent(Object exponent) {
    if (exponent instanceof BigFraction fraction) return fraction;
    if (exponent instanceof Fraction fraction)
      return new BigFraction(fraction.getNumerator(), fraction.getDenominator());
    if (exponent instanceof BigInteger integer) return new BigFraction(integer);
    if (exponent instanceof Integer || exponent instanceof Long
        || exponent instanceof Short || exponent instanceof Byte)
      return new BigFraction(((Number) exponent).longValue());
    throw new InvalidExponentException(exponent);
  }

  static String exponentToString(BigFraction exponent) {
    if (exponent.getDenominator().equals(BigInteger.ONE)) return exponent.getNumerator().toString();
    return exponent.getNumerator() + "/" + exponent.getDenominator();
  }

  /**
   * Structural equality. Compares the current shape of two trees, not their mathematical value:
   * callers wanting the latter normalize both sides first.
   *
   * <ul>
   *   <li>variables: same name
   *   <li>constants: equal value
   *   <li>max, min, sum, product: operands equal as multisets (see {@link #setDefeq})
   *   <li>quotient: numerators and denominators pairwise
   *   <li>power: equal exponents and bases
   * </ul>
   *
   * Expressions of different kinds are never structurally equal.
   */
  public static boolean defeq(MExpr x, MExpr y) {
    if (x == y) return true;
    if (x == null || y == null || x.kind() != y.kind()) return false;

    return switch (x.kind()) {
      case VAR -> ((MVar) x).name().equals(((MVar) y).name());
      case CONST -> ((MConst) x).value().compareTo(((MConst) y).value()) == 0;
      case MAX, MIN, ADD, MUL -> setDefeq(x.operands(), y.operands());
      case DIV -> defeq(((MDiv) x).numerator(), ((MDiv) y).numerator())
          && defeq(((MDiv) x).denominator(), ((MDiv) y).denominator());
      case POW -> ((MPow) x).exponent().equals(((MPow) y).exponent())
          && defeq(((MPow) x).base(), ((MPow) y).base());
    };
  }

  /**
   * Whether there is a bijection between `xs` and `ys` pairing structurally equal expressions.
   * Solved as a bipartite matching, so repeated near-duplicates cannot fool it.
   */
  public static boolean setDefeq(List<? extends MExpr> xs, List<? extends MExpr> ys) {
    return MatchingSupport.isPerfectMatchable(xs, ys, MExprSupport::defeq);
  }

  public static MExpr normalizeExpr(MExpr expr, Hypotheses hypotheses) {
    return new MNormalization(hypotheses).normalize(expr);
  }

  /**
   * Whether `expr` is built only from constants and the expressions in `vars` (matched
   * structurally).
   */
  public static boolean isDefined(MExpr expr, Collection<? extends MExpr> vars) {
    for (MExpr var : vars) if (defeq(var, expr)) return true;
    if (expr.kind() == MKind.CONST) return true;
    if (expr.kind().isLeaf()) return false;
    for (MExpr operand : expr.operands()) if (!isDefined(operand, vars)) return false;
    return true;
  }
}
