package estim.magnitude.expr;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.List;

final class MPowImpl implements MPow {
  private final MExpr base;
  private final BigFraction exponent;
  private final String str;

  MPowImpl(MExpr base, BigFraction exponent) {
    this.base = base;
    this.exponent = exponent;
    this.str = "(" + base + " ^ " + MExprSupport.exponentToString(exponent) + ")";
  }

  @Override
  public MExpr base() {
    return base;
  }

  @Override
  public BigFraction exponent() {
    return exponent;
  }

  @Override
  public List<MExpr> operands() {
    return List.of(base);
  }

  @Override
  public String toString() {
    return str;
  }
}
