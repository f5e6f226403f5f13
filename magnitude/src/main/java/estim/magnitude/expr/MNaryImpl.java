package estim.magnitude.expr;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/** Operand storage and rendering shared by max, min, sum and product. */
abstract class MNaryImpl implements MExpr {
  private final ImmutableList<MExpr> operands;
  private final String str;

  MNaryImpl(List<? extends MExpr> operands, String prefix, String separator) {
    this.operands = ImmutableList.copyOf(operands);
    this.str = prefix + "(" + StringUtils.join(this.operands, separator) + ")";
  }

  @Override
  public List<MExpr> operands() {
    return operands;
  }

  @Override
  public String toString() {
    return str;
  }
}
