package estim.magnitude.expr;

import java.util.List;

final class MAddImpl extends MNaryImpl implements MAdd {
  MAddImpl(List<? extends MExpr> summands) {
    super(summands, "", " + ");
  }
}
