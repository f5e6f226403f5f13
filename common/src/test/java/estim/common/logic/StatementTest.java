package estim.common.logic;

import estim.common.types.TypedVar;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("logic")
@Tag("fast")
class StatementTest {
  private final Proposition p = Proposition.mk("p");
  private final Proposition q = Proposition.mk("q");
  private final Proposition r = Proposition.mk("r");

  @Test
  void testBoolNegation() {
    assertSame(Bool.FALSE, Bool.TRUE.negate());
    assertSame(Bool.TRUE, Bool.FALSE.negate());
    assertSame(Bool.FALSE, Not.mk(Bool.TRUE));
    assertEquals("true", Bool.TRUE.toString());
  }

  @Test
  void testJunctionDefeqIgnoresOrder() {
    assertTrue(And.mk(p, q, r).defeq(And.mk(r, p, q)));
    assertFalse(And.mk(p, q).defeq(Or.mk(p, q)));
    assertFalse(And.mk(p, p, q).defeq(And.mk(p, q, q)));
  }

  @Test
  void testAndSimplification() {
    assertTrue(And.mk(p, Bool.TRUE, And.mk(q, p)).simp().defeq(And.mk(p, q)));
    assertSame(Bool.FALSE, And.mk(p, Bool.FALSE, q).simp());
    assertSame(Bool.TRUE, And.mk(Bool.TRUE, Bool.TRUE).simp());
    assertSame(q, And.mk(q, q).simp());
  }

  @Test
  void testOrSimplification() {
    assertTrue(Or.mk(p, Bool.FALSE, Or.mk(q, r)).simp().defeq(Or.mk(r, q, p)));
    assertSame(Bool.TRUE, Or.mk(p, Bool.TRUE).simp());
    assertSame(Bool.FALSE, Or.mk(Bool.FALSE).simp());
  }

  @Test
  void testNegationIsPushedInward() {
    final Statement negated = Not.mk(And.mk(p, Or.mk(q, r))).simp();
    assertTrue(negated.defeq(Or.mk(Not.mk(p), And.mk(Not.mk(q), Not.mk(r)))), negated.toString());
    assertSame(p, Not.mk(Not.mk(p)).simp());
    assertEquals("not(p)", Not.mk(p).toString());
  }

  @Test
  void testHypotheses() {
    final Hypotheses hypotheses = Hypotheses.of(p, Not.mk(q), p);
    assertEquals(2, hypotheses.size());
    assertTrue(hypotheses.contains(Proposition.mk("p")));

    assertSame(Bool.TRUE, p.simp(hypotheses));
    assertSame(Bool.FALSE, q.simp(hypotheses));
    assertSame(Bool.TRUE, Not.mk(q).simp(hypotheses));
    assertSame(r, And.mk(p, r).simp(hypotheses));
    assertSame(Bool.FALSE, And.mk(q, r).simp(hypotheses));
    assertTrue(Hypotheses.empty().isEmpty());
  }

  @Test
  void testDeclaredProposition() {
    assertTrue(Proposition.mk(TypedVar.declare("bool", "p")).defeq(p));
    assertThrows(
        IllegalArgumentException.class, () -> Proposition.mk(TypedVar.declare("order", "N")));
  }
}
