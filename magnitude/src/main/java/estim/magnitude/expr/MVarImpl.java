package estim.magnitude.expr;

import java.util.List;

final class MVarImpl implements MVar {
  private final String name;

  MVarImpl(String name) {
    this.name = name;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<MExpr> operands() {
    return List.of();
  }

  @Override
  public String toString() {
    return name;
  }
}
