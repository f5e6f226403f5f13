package estim.magnitude.expr.normalizer;

import estim.common.logic.Hypotheses;
import estim.common.utils.ListSupport;
import estim.magnitude.expr.*;
import org.apache.commons.lang3.tuple.MutablePair;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkState;
import static estim.magnitude.expr.MExprSupport.defeq;
import static estim.magnitude.expr.MKind.*;

/**
 * Rewrites a magnitude expression into its normal form.
 *
 * <p>Normal form: no sums (a sum is comparable to its largest term), no quotients, no constants
 * other than a lone 1, max/min flattened and free of structural duplicates, products flattened
 * with one power per distinct base, powers pushed through products and folded into each other.
 *
 * <p>Each rule normalizes its children first, so the rewrite is a single bottom-up pass and
 * terminates by structural recursion. Normalizing a normal form yields a structurally equal
 * expression.
 */
public class MNormalization {
  private static final Logger LOG = Logger.getLogger(MNormalization.class.getName());

  // Not consulted by any rule yet. Threaded through every recursive call so that
  // hypothesis-conditional rewrites can be added without changing signatures.
  private final Hypotheses hypotheses;

  public MNormalization(Hypotheses hypotheses) {
    this.hypotheses = hypotheses;
  }

  public Hypotheses hypotheses() {
    return hypotheses;
  }

  public MExpr normalize(MExpr expr) {
    final MExpr normalized =
        switch (expr.kind()) {
          case VAR -> expr;
          case CONST -> MConst.one();
          case MAX, MIN -> normalizeMaxMin(expr);
          case ADD -> normalizeAdd((MAdd) expr);
          case MUL -> normalizeMul((MMul) expr);
          case DIV -> normalizeDiv((MDiv) expr);
          case POW -> normalizePow((MPow) expr);
        };
    if (LOG.isLoggable(Level.FINEST)) LOG.finest("simp " + expr + " => " + normalized);
    return normalized;
  }

  /** MAX[E1, MAX[E2, E3], E1] -> MAX[E1, E2, E3]; MAX[E] -> E. Same for MIN. */
  private MExpr normalizeMaxMin(MExpr expr) {
    final MKind kind = expr.kind();
    final List<MExpr> flattened = new ArrayList<>(expr.operands().size());
    for (MExpr operand : expr.operands()) {
      final MExpr normalized = normalize(operand);
      if (normalized.kind() == kind) flattened.addAll(normalized.operands());
      else flattened.add(normalized);
    }

    final List<MExpr> reduced = ListSupport.dedup(flattened, MExprSupport::defeq);
    checkState(!reduced.isEmpty(), "%s lost all operands during simplification: %s", kind, expr);

    if (reduced.size() == 1) return reduced.get(0);
    return kind == MAX ? MMax.mk(reduced) : MMin.mk(reduced);
  }

  /** E1 + .. + En -> MAX[E1, .., En]. */
  private MExpr normalizeAdd(MAdd add) {
    return normalize(MMax.mk(add.operands()));
  }

  /**
   * Three phases:
   *
   * <ol>
   *   <li>normalize factors, splice in nested products, drop constants;
   *   <li>gather factors by base (a non-power is its own base with exponent 1), summing exponents;
   *   <li>rebuild each base^exponent and drop those that became constants.
   * </ol>
   *
   * An empty result is the constant 1; a single remaining factor stands for itself.
   */
  private MExpr normalizeMul(MMul mul) {
    final List<MExpr> factors = new ArrayList<>(mul.operands().size());
    for (MExpr factor : mul.operands()) spliceFactor(factors, normalize(factor));
    return gatherFactors(factors);
  }

  private static void spliceFactor(List<MExpr> factors, MExpr normalized) {
    if (normalized.kind() == MUL) factors.addAll(normalized.operands());
    else if (normalized.kind() != CONST) factors.add(normalized);
  }

  // Factors must already be normal and free of products and constants.
  private MExpr gatherFactors(List<MExpr> factors) {
    // Pairwise defeq against the bases seen so far, so quadratic in the number of factors.
    final List<MutablePair<MExpr, BigFraction>> terms = new ArrayList<>(factors.size());
    for (MExpr factor : factors) {
      final MExpr base;
      final BigFraction exponent;
      if (factor.kind() == POW) {
        base = ((MPow) factor).base();
        exponent = ((MPow) factor).exponent();
      } else {
        base = factor;
        exponent = BigFraction.ONE;
      }

      final MutablePair<MExpr, BigFraction> term = findTerm(terms, base);
      if (term != null) term.setRight(term.getRight().add(exponent));
      else terms.add(MutablePair.of(base, exponent));
    }

    final List<MExpr> monomials = new ArrayList<>(terms.size());
    for (MutablePair<MExpr, BigFraction> term : terms)
      spliceFactor(monomials, powOfNormal(term.getLeft(), term.getRight()));

    if (monomials.isEmpty()) return MConst.one();
    if (monomials.size() == 1) return monomials.get(0);
    return MMul.mk(monomials);
  }

  private static MutablePair<MExpr, BigFraction> findTerm(
      List<MutablePair<MExpr, BigFraction>> terms, MExpr base) {
    for (MutablePair<MExpr, BigFraction> term : terms) if (defeq(term.getLeft(), base)) return term;
    return null;
  }

  /** E1 / E2 -> E1 * E2^(-1). */
  private MExpr normalizeDiv(MDiv div) {
    return normalize(MMul.mk(div.numerator(), MPow.mk(div.denominator(), BigFraction.MINUS_ONE)));
  }

  private MExpr normalizePow(MPow pow) {
    return powOfNormal(normalize(pow.base()), pow.exponent());
  }

  /**
   * E^1 -> E; E^0 -> 1; C^p -> 1; (E^p)^q -> E^(pq); (E1 * .. * En)^p -> E1^p * .. * En^p.
   *
   * <p>The base must already be normal; it is never normalized again.
   */
  private MExpr powOfNormal(MExpr base, BigFraction exponent) {
    if (exponent.equals(BigFraction.ONE)) return base;
    if (exponent.equals(BigFraction.ZERO) || base.kind() == CONST) return MConst.one();

    if (base.kind() == POW) {
      final MPow inner = (MPow) base;
      return powOfNormal(inner.base(), inner.exponent().multiply(exponent));
    }

    if (base.kind() == MUL) {
      final List<MExpr> distributed = new ArrayList<>(base.operands().size());
      for (MExpr factor : base.operands()) spliceFactor(distributed, powOfNormal(factor, exponent));
      return gatherFactors(distributed);
    }

    return MPow.mk(base, exponent);
  }
}
