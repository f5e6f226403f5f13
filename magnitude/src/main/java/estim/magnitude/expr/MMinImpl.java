package estim.magnitude.expr;

import java.util.List;

final class MMinImpl extends MNaryImpl implements MMin {
  MMinImpl(List<? extends MExpr> operands) {
    super(operands, "min", ", ");
  }
}
