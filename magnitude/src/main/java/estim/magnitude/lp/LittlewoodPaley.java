package estim.magnitude.lp;

import com.google.common.collect.ImmutableList;
import estim.common.logic.Hypotheses;
import estim.common.logic.Statement;
import estim.magnitude.expr.MExpr;
import estim.magnitude.expr.MExprSupport;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * The Littlewood-Paley relation among three or more magnitudes, kept in compact form. {@link
 * #cases()} unpacks it into the disjunction built by {@link LPSupport#lpProperty}.
 */
public final class LittlewoodPaley implements Statement {
  private final ImmutableList<MExpr> magnitudes;
  private final String name;

  private LittlewoodPaley(List<? extends MExpr> magnitudes) {
    this.magnitudes = ImmutableList.copyOf(magnitudes);
    this.name = "LittlewoodPaley(" + StringUtils.join(this.magnitudes, ", ") + ")";
  }

  /** Two magnitudes collapse to asymptotic equivalence. */
  public static Statement mk(Object... magnitudes) {
    return mk(MExprSupport.ensureExprs(magnitudes));
  }

  public static Statement mk(List<? extends MExpr> magnitudes) {
    final int n = magnitudes.size();
    if (n < 2) throw new InsufficientArgumentsException(n);
    if (n == 2) return magnitudes.get(0).asymp(magnitudes.get(1));
    return new LittlewoodPaley(magnitudes);
  }

  public List<MExpr> magnitudes() {
    return magnitudes;
  }

  public Statement cases() {
    return LPSupport.lpProperty(magnitudes);
  }

  /** The relation is symmetric in its magnitudes, so they are compared as a multiset. */
  @Override
  public boolean defeq(Statement other) {
    return other instanceof LittlewoodPaley that
        && MExprSupport.setDefeq(magnitudes, that.magnitudes);
  }

  @Override
  public Statement negate() {
    return cases().negate();
  }

  @Override
  public Statement simp(Hypotheses hypotheses) {
    return cases().simp(hypotheses);
  }

  @Override
  public String toString() {
    return name;
  }
}
