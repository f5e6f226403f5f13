package estim.magnitude.expr;

import java.util.List;

final class MMaxImpl extends MNaryImpl implements MMax {
  MMaxImpl(List<? extends MExpr> operands) {
    super(operands, "max", ", ");
  }
}
