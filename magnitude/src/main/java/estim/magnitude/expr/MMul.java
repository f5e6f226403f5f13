package estim.magnitude.expr;

import java.util.List;

import static estim.magnitude.expr.MExprSupport.ensureExprs;

/** The formal product of a sequence of expressions. The empty product is the unit. */
public interface MMul extends MExpr {
  @Override
  default MKind kind() {
    return MKind.MUL;
  }

  static MMul mk(Object... factors) {
    return mk(ensureExprs(factors));
  }

  static MMul mk(List<? extends MExpr> factors) {
    return new MMulImpl(factors);
  }
}
