package estim.common.logic;

/**
 * A boolean-valued statement. Statements are immutable; {@link #negate()} and {@link
 * #simp(Hypotheses)} always return new values.
 */
public interface Statement {
  /** Syntactic equivalence, up to reordering of the operands of commutative connectives. */
  boolean defeq(Statement other);

  default Statement negate() {
    return Not.mk(this);
  }

  default Statement simp(Hypotheses hypotheses) {
    return this;
  }

  default Statement simp() {
    return simp(Hypotheses.empty());
  }
}
