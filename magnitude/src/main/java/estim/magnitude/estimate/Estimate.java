package estim.magnitude.estimate;

import estim.common.logic.Bool;
import estim.common.logic.Hypotheses;
import estim.common.logic.Or;
import estim.common.logic.Statement;
import estim.magnitude.expr.MConst;
import estim.magnitude.expr.MDiv;
import estim.magnitude.expr.MExpr;

import java.util.logging.Logger;

import static estim.magnitude.expr.MExprSupport.ensureExpr;

/** A comparison "left op right" between two orders of magnitude. */
public final class Estimate implements Statement {
  private static final Logger LOG = Logger.getLogger(Estimate.class.getName());

  private final MExpr left;
  private final EstimateOp op;
  private final MExpr right;
  private final String name;

  private Estimate(MExpr left, EstimateOp op, MExpr right) {
    this.left = left;
    this.op = op;
    this.right = right;
    this.name = left + " " + op + " " + right;
  }

  /** @throws InvalidOperatorException if `op` is null */
  public static Estimate mk(Object left, EstimateOp op, Object right) {
    if (op == null) throw new InvalidOperatorException(null);
    return new Estimate(ensureExpr(left), op, ensureExpr(right));
  }

  /** @throws InvalidOperatorException if `symbol` is not one of the five relations */
  public static Estimate mk(Object left, String symbol, Object right) {
    return mk(left, EstimateOp.ofSymbol(symbol), right);
  }

  public MExpr left() {
    return left;
  }

  public EstimateOp op() {
    return op;
  }

  public MExpr right() {
    return right;
  }

  public String name() {
    return name;
  }

  @Override
  public boolean defeq(Statement other) {
    return other instanceof Estimate that
        && op == that.op
        && left.defeq(that.left)
        && right.defeq(that.right);
  }

  /** X ~ Y negates to (X &gt;&gt; Y) | (X &lt;&lt; Y); the others negate to a single relation. */
  @Override
  public Statement negate() {
    final EstimateOp negated = op.negated();
    if (negated != null) return new Estimate(left, negated, right);
    return Or.mk(new Estimate(left, EstimateOp.GG, right), new Estimate(left, EstimateOp.LL, right));
  }

  /**
   * Canonical form: "ratio op 1" with op among &gt;~, &gt;&gt;, ~, where ratio is the normalized
   * left / right. &lt;~ and &lt;&lt; are first turned around. A ratio of 1 decides the estimate:
   * true for &gt;~ and ~, false for &gt;&gt;.
   */
  @Override
  public Statement simp(Hypotheses hypotheses) {
    if (op == EstimateOp.LESSSIM || op == EstimateOp.LL)
      return new Estimate(right, op.reversed(), left).simp(hypotheses);

    final MExpr ratio = MDiv.mk(left, right).simp(hypotheses);
    final Statement result;
    if (ratio instanceof MConst c && c.isOne()) result = Bool.of(!op.isStrict());
    else result = new Estimate(ratio, op, MConst.one());

    LOG.fine(() -> "simp " + name + " => " + result);
    return result;
  }

  @Override
  public String toString() {
    return name;
  }
}
