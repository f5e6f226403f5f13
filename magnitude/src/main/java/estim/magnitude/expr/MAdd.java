package estim.magnitude.expr;

import java.util.List;

import static estim.magnitude.expr.MExprSupport.ensureExprs;

/** The formal sum of a non-empty sequence of expressions. */
public interface MAdd extends MExpr {
  @Override
  default MKind kind() {
    return MKind.ADD;
  }

  static MAdd mk(Object... summands) {
    return mk(ensureExprs(summands));
  }

  static MAdd mk(List<? extends MExpr> summands) {
    if (summands.isEmpty()) throw new EmptyOperandSetException(MKind.ADD);
    return new MAddImpl(summands);
  }
}
