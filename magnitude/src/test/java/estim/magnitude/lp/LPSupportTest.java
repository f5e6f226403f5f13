package estim.magnitude.lp;

import estim.common.logic.And;
import estim.common.logic.Bool;
import estim.common.logic.Or;
import estim.common.logic.Statement;
import estim.magnitude.estimate.Estimate;
import estim.magnitude.estimate.EstimateOp;
import estim.magnitude.expr.MConst;
import estim.magnitude.expr.MExpr;
import estim.magnitude.expr.MVar;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("lp")
@Tag("fast")
class LPSupportTest {
  private final MVar n1 = MVar.mk("N1");
  private final MVar n2 = MVar.mk("N2");
  private final MVar n3 = MVar.mk("N3");
  private final MVar n4 = MVar.mk("N4");

  @Test
  void testMinimumArity() {
    assertThrows(InsufficientArgumentsException.class, () -> LPSupport.lpProperty());
    assertThrows(InsufficientArgumentsException.class, () -> LPSupport.lpProperty(n1));
    assertThrows(InsufficientArgumentsException.class, () -> LittlewoodPaley.mk(n1));
  }

  @Test
  void testTwoMagnitudesAreEquivalent() {
    final Statement property = LPSupport.lpProperty(n1, n2);
    assertTrue(property instanceof Estimate);
    assertTrue(property.defeq(n1.asymp(n2)));
    assertTrue(LittlewoodPaley.mk(n1, n2).defeq(n1.asymp(n2)));
  }

  @Test
  void testThreeMagnitudes() {
    final Statement property = LPSupport.lpProperty(n1, n2, n3);
    assertTrue(property instanceof Or);
    final List<Statement> cases = ((Or) property).operands();
    assertEquals(3, cases.size());
    for (Statement c : cases) {
      assertTrue(c instanceof And);
      final List<Statement> conjuncts = ((And) c).operands();
      assertEquals(2, conjuncts.size());
      assertEquals(EstimateOp.ASYMP, ((Estimate) conjuncts.get(0)).op());
      assertEquals(EstimateOp.LESSSIM, ((Estimate) conjuncts.get(1)).op());
    }

    final Statement expected =
        Or.mk(
            And.mk(n1.asymp(n2), n3.lesssim(n1)),
            And.mk(n1.asymp(n3), n2.lesssim(n1)),
            And.mk(n2.asymp(n3), n1.lesssim(n2)));
    assertTrue(property.defeq(expected), property.toString());
  }

  @Test
  void testFourMagnitudes() {
    final Or property = (Or) LPSupport.lpProperty(List.of(n1, n2, n3, n4));
    assertEquals(6, property.operands().size());
    for (Statement c : property.operands()) assertEquals(3, ((And) c).operands().size());
  }

  @Test
  void testLittlewoodPaleyRelation() {
    final Statement relation = LittlewoodPaley.mk(n1, n2, n3);
    assertTrue(relation instanceof LittlewoodPaley);
    assertEquals("LittlewoodPaley(N1, N2, N3)", relation.toString());
    assertTrue(relation.defeq(LittlewoodPaley.mk(n3, n1, n2)));
    assertFalse(relation.defeq(LittlewoodPaley.mk(n1, n2, n4)));
    assertTrue(((LittlewoodPaley) relation).cases().defeq(LPSupport.lpProperty(n1, n2, n3)));

    final Statement negated = relation.negate();
    assertTrue(negated instanceof And);
    assertEquals(3, ((And) negated).operands().size());
  }

  @Test
  void testDegenerateRelationSimplifies() {
    final MExpr n = MVar.mk("N");
    assertSame(Bool.TRUE, LittlewoodPaley.mk(n, n, n).simp());

    // Constant multiples are invisible: the three cases reduce to N >~ 1, N ~ 1 and N ~ 1.
    final Statement simplified = LittlewoodPaley.mk(n, n.mul(2), 3).simp();
    assertTrue(simplified.defeq(Or.mk(n.gtrsim(1), n.asymp(1))), simplified.toString());
  }

  @Test
  void testBracket() {
    assertTrue(LPSupport.bracket(5).simp().defeq(MConst.one()));
    final MExpr expected = MConst.one().add(n1.pow(2)).simp().sqrt().simp();
    assertTrue(LPSupport.bracket(n1).simp().defeq(expected));
    assertTrue(LPSupport.sqrt(n1).defeq(n1.sqrt()));
  }
}
