package estim.common.logic;

public final class Not implements Statement {
  private final Statement body;

  private Not(Statement body) {
    this.body = body;
  }

  public static Statement mk(Statement body) {
    if (body instanceof Bool b) return b.negate();
    return new Not(body);
  }

  public Statement body() {
    return body;
  }

  @Override
  public boolean defeq(Statement other) {
    return other instanceof Not that && body.defeq(that.body);
  }

  @Override
  public Statement negate() {
    return body;
  }

  /** not(E) -> E.negate(), pushed inward as far as the operand knows how to negate itself. */
  @Override
  public Statement simp(Hypotheses hypotheses) {
    final Statement simplified = body.simp(hypotheses);
    final Statement negated = simplified.negate();
    if (negated instanceof Not not) {
      if (hypotheses.contains(not)) return Bool.TRUE;
      if (hypotheses.contains(not.body)) return Bool.FALSE;
      return not;
    }
    return negated.simp(hypotheses);
  }

  @Override
  public String toString() {
    return "not(" + body + ")";
  }
}
