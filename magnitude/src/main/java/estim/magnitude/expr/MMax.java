package estim.magnitude.expr;

import java.util.List;

import static estim.magnitude.expr.MExprSupport.ensureExprs;

/** The formal maximum of a non-empty set of expressions. */
public interface MMax extends MExpr {
  @Override
  default MKind kind() {
    return MKind.MAX;
  }

  static MMax mk(Object... operands) {
    return mk(ensureExprs(operands));
  }

  static MMax mk(List<? extends MExpr> operands) {
    if (operands.isEmpty()) throw new EmptyOperandSetException(MKind.MAX);
    return new MMaxImpl(operands);
  }
}
