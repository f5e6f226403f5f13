package estim.common.logic;

import java.util.List;

import static estim.common.utils.ListSupport.map;

public final class And extends Junction {
  private And(List<? extends Statement> operands) {
    super(operands);
  }

  public static And mk(Statement... operands) {
    return new And(List.of(operands));
  }

  public static And mk(List<? extends Statement> operands) {
    return new And(operands);
  }

  @Override
  protected Bool unit() {
    return Bool.TRUE;
  }

  @Override
  protected Statement mk0(List<Statement> operands) {
    return new And(operands);
  }

  @Override
  protected String separator() {
    return " & ";
  }

  @Override
  public Statement negate() {
    return Or.mk(map(operands, Statement::negate));
  }
}
