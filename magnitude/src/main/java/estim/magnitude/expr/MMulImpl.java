package estim.magnitude.expr;

import java.util.List;

final class MMulImpl extends MNaryImpl implements MMul {
  MMulImpl(List<? extends MExpr> factors) {
    super(factors, "", " * ");
  }
}
