package estim.common.logic;

import java.util.List;

import static estim.common.utils.ListSupport.map;

public final class Or extends Junction {
  private Or(List<? extends Statement> operands) {
    super(operands);
  }

  public static Or mk(Statement... operands) {
    return new Or(List.of(operands));
  }

  public static Or mk(List<? extends Statement> operands) {
    return new Or(operands);
  }

  @Override
  protected Bool unit() {
    return Bool.FALSE;
  }

  @Override
  protected Statement mk0(List<Statement> operands) {
    return new Or(operands);
  }

  @Override
  protected String separator() {
    return " | ";
  }

  @Override
  public Statement negate() {
    return And.mk(map(operands, Statement::negate));
  }
}
