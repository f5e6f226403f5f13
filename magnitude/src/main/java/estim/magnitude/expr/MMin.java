package estim.magnitude.expr;

import java.util.List;

import static estim.magnitude.expr.MExprSupport.ensureExprs;

/** The formal minimum of a non-empty set of expressions. */
public interface MMin extends MExpr {
  @Override
  default MKind kind() {
    return MKind.MIN;
  }

  static MMin mk(Object... operands) {
    return mk(ensureExprs(operands));
  }

  static MMin mk(List<? extends MExpr> operands) {
    if (operands.isEmpty()) throw new EmptyOperandSetException(MKind.MIN);
    return new MMinImpl(operands);
  }
}
