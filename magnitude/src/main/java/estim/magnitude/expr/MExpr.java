package estim.magnitude.expr;

import estim.common.logic.Hypotheses;
import estim.magnitude.estimate.Estimate;
import estim.magnitude.estimate.EstimateOp;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.List;

import static estim.magnitude.expr.MExprSupport.ensureExpr;

/**
 * A formal expression denoting an order of magnitude. Expressions are immutable trees; every
 * operation below returns a new expression.
 */
public interface MExpr {
  MKind kind();

  /** Direct children, in construction order. Empty for leaves. */
  List<MExpr> operands();

  /** Structural equality, see {@link MExprSupport#defeq(MExpr, MExpr)}. */
  default boolean defeq(MExpr other) {
    return MExprSupport.defeq(this, other);
  }

  default MExpr simp(Hypotheses hypotheses) {
    return MExprSupport.normalizeExpr(this, hypotheses);
  }

  default MExpr simp() {
    return simp(Hypotheses.empty());
  }

  /** this + other. Summands of an existing sum on either side are spliced in, not nested. */
  default MExpr add(Object other) {
    final MExpr that = ensureExpr(other);
    final List<MExpr> summands = new ArrayList<>();
    if (kind() == MKind.ADD) summands.addAll(operands());
    else summands.add(this);
    if (that.kind() == MKind.ADD) summands.addAll(that.operands());
    else summands.add(that);
    return MAdd.mk(summands);
  }

  /** this * other. Factors of an existing product on either side are spliced in, not nested. */
  default MExpr mul(Object other) {
    final MExpr that = ensureExpr(other);
    final List<MExpr> factors = new ArrayList<>();
    if (kind() == MKind.MUL) factors.addAll(operands());
    else factors.add(this);
    if (that.kind() == MKind.MUL) factors.addAll(that.operands());
    else factors.add(that);
    return MMul.mk(factors);
  }

  default MExpr div(Object other) {
    return MDiv.mk(this, ensureExpr(other));
  }

  /** this ^ exponent, where exponent is an integer or an exact rational. */
  default MExpr pow(Object exponent) {
    return MPow.mk(this, exponent);
  }

  default MExpr sqrt() {
    return MPow.mk(this, new BigFraction(1, 2));
  }

  /** The Japanese bracket &lt;x&gt; = (1 + x^2)^(1/2). */
  default MExpr bracket() {
    return MAdd.mk(MConst.one(), pow(2)).sqrt();
  }

  /** this &lt;~ other: this = O(other). */
  default Estimate lesssim(Object other) {
    return Estimate.mk(this, EstimateOp.LESSSIM, ensureExpr(other));
  }

  /** this &lt;&lt; other: this = o(other). */
  default Estimate ll(Object other) {
    return Estimate.mk(this, EstimateOp.LL, ensureExpr(other));
  }

  /** this ~ other: each is O() of the other. */
  default Estimate asymp(Object other) {
    return Estimate.mk(this, EstimateOp.ASYMP, ensureExpr(other));
  }

  /** this &gt;~ other: other = O(this). */
  default Estimate gtrsim(Object other) {
    return Estimate.mk(this, EstimateOp.GTRSIM, ensureExpr(other));
  }

  /** this &gt;&gt; other: other = o(this). */
  default Estimate gg(Object other) {
    return Estimate.mk(this, EstimateOp.GG, ensureExpr(other));
  }
}
