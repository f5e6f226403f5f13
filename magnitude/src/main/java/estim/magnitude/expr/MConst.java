package estim.magnitude.expr;

import java.math.BigDecimal;

/** A constant magnitude. Constants carry no order-of-magnitude information. */
public interface MConst extends MExpr {
  @Override
  default MKind kind() {
    return MKind.CONST;
  }

  BigDecimal value();

  default boolean isOne() {
    return value().compareTo(BigDecimal.ONE) == 0;
  }

  static MConst one() {
    return MConstImpl.ONE;
  }

  /** @throws InvalidOperandException if the value is not a finite positive number */
  static MConst mk(Number value) {
    final BigDecimal decimal = MExprSupport.toDecimal(value);
    if (decimal.signum() <= 0)
      throw new InvalidOperandException("constant value must be positive, was " + value);
    return new MConstImpl(decimal);
  }
}
