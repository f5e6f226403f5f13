package estim.common.logic;

import com.google.common.collect.ImmutableList;
import estim.common.utils.ListSupport;
import estim.common.utils.MatchingSupport;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/** Common shape of {@link And} and {@link Or}: an n-ary, commutative connective. */
abstract class Junction implements Statement {
  protected final ImmutableList<Statement> operands;

  protected Junction(List<? extends Statement> operands) {
    this.operands = ImmutableList.copyOf(operands);
  }

  public List<Statement> operands() {
    return operands;
  }

  /** The constant that is dropped from the operands (TRUE for And, FALSE for Or). */
  protected abstract Bool unit();

  protected abstract Statement mk0(List<Statement> operands);

  protected abstract String separator();

  @Override
  public boolean defeq(Statement other) {
    return other != null
        && other.getClass() == getClass()
        && MatchingSupport.isPerfectMatchable(
            operands, ((Junction) other).operands, Statement::defeq);
  }

  /**
   * Simplify operands, drop the unit, short-circuit on the absorbing constant, flatten nested
   * junctions of the same kind and remove syntactic duplicates.
   */
  @Override
  public Statement simp(Hypotheses hypotheses) {
    final Bool unit = unit();
    final List<Statement> flattened = new ArrayList<>(operands.size());
    for (Statement operand : operands) {
      final Statement simplified = operand.simp(hypotheses);
      if (simplified == unit) continue;
      if (simplified instanceof Bool) return simplified;
      if (simplified.getClass() == getClass()) flattened.addAll(((Junction) simplified).operands);
      else flattened.add(simplified);
    }

    final List<Statement> reduced = ListSupport.dedup(flattened, Statement::defeq);
    if (reduced.isEmpty()) return unit;
    if (reduced.size() == 1) return reduced.get(0);
    return mk0(reduced);
  }

  @Override
  public String toString() {
    return "(" + StringUtils.join(operands, separator()) + ")";
  }
}
