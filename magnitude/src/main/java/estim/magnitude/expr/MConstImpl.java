package estim.magnitude.expr;

import java.math.BigDecimal;
import java.util.List;

final class MConstImpl implements MConst {
  static final MConst ONE = new MConstImpl(BigDecimal.ONE);

  private final BigDecimal value;
  private final String str;

  MConstImpl(BigDecimal value) {
    this.value = value;
    this.str = value.stripTrailingZeros().toPlainString();
  }

  @Override
  public BigDecimal value() {
    return value;
  }

  @Override
  public List<MExpr> operands() {
    return List.of();
  }

  @Override
  public String toString() {
    return str;
  }
}
