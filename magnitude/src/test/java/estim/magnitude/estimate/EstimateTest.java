package estim.magnitude.estimate;

import estim.common.logic.Bool;
import estim.common.logic.Not;
import estim.common.logic.Or;
import estim.common.logic.Statement;
import estim.magnitude.expr.MConst;
import estim.magnitude.expr.MExpr;
import estim.magnitude.expr.MMax;
import estim.magnitude.expr.MMul;
import estim.magnitude.expr.MVar;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("estimate")
@Tag("fast")
class EstimateTest {
  private final MVar x = MVar.mk("x");
  private final MVar y = MVar.mk("y");

  private List<MExpr> samples() {
    return List.of(x, x.mul(y), x.add(y).sqrt(), MMax.mk(x, 2).div(y), MConst.mk(4));
  }

  @Test
  void testRelationBuilders() {
    assertEquals(EstimateOp.LESSSIM, x.lesssim(y).op());
    assertEquals(EstimateOp.LL, x.ll(y).op());
    assertEquals(EstimateOp.ASYMP, x.asymp(y).op());
    assertEquals(EstimateOp.GTRSIM, x.gtrsim(y).op());
    assertEquals(EstimateOp.GG, x.gg(y).op());
    assertEquals("x <~ y", x.lesssim(y).toString());
    assertEquals("(x + y) >> 3", x.add(y).gg(3).name());
    assertTrue(x.lesssim(3).right().defeq(MConst.mk(3)));
  }

  @Test
  void testOperatorSymbols() {
    assertEquals(EstimateOp.LESSSIM, EstimateOp.ofSymbol("<~"));
    assertEquals(EstimateOp.LESSSIM, EstimateOp.ofSymbol("≲"));
    assertEquals(EstimateOp.GG, EstimateOp.ofSymbol("≫"));
    assertEquals(EstimateOp.ASYMP, Estimate.mk(x, "~", y).op());
    assertThrows(InvalidOperatorException.class, () -> Estimate.mk(x, "=<", y));
    assertThrows(InvalidOperatorException.class, () -> EstimateOp.ofSymbol(">="));
    assertThrows(InvalidOperatorException.class, () -> Estimate.mk(x, (EstimateOp) null, y));
    assertThrows(InvalidOperatorException.class, () -> Estimate.mk(x, (String) null, y));
  }

  @Test
  void testNegation() {
    assertTrue(x.lesssim(y).negate().defeq(x.gg(y)));
    assertTrue(x.ll(y).negate().defeq(x.gtrsim(y)));
    assertTrue(x.gtrsim(y).negate().defeq(x.ll(y)));
    assertTrue(x.gg(y).negate().defeq(x.lesssim(y)));
    assertTrue(x.asymp(y).negate().defeq(Or.mk(x.ll(y), x.gg(y))));

    for (EstimateOp op : EstimateOp.values()) {
      if (op == EstimateOp.ASYMP) continue;
      final Estimate e = Estimate.mk(x.mul(y), op, MMax.mk(x, y));
      assertTrue(e.negate().negate().defeq(e), op.symbol());
    }
  }

  @Test
  void testDefeq() {
    assertTrue(x.mul(y).lesssim(x).defeq(y.mul(x).lesssim(MVar.mk("x"))));
    assertFalse(x.lesssim(y).defeq(x.ll(y)));
    assertFalse(x.lesssim(y).defeq(y.lesssim(x)));
    assertFalse(x.lesssim(y).defeq(Bool.TRUE));
  }

  @Test
  void testCanonicalForm() {
    final Statement simplified = x.lesssim(y).simp();
    assertTrue(simplified instanceof Estimate);
    final Estimate canonical = (Estimate) simplified;
    assertEquals(EstimateOp.GTRSIM, canonical.op());
    assertTrue(canonical.right().defeq(MConst.one()));
    assertTrue(canonical.left().defeq(MMul.mk(y, x.pow(-1))), canonical.toString());

    assertEquals(EstimateOp.GG, ((Estimate) x.ll(y).simp()).op());
    assertEquals(EstimateOp.ASYMP, ((Estimate) x.asymp(y).simp()).op());
    assertTrue(canonical.simp().defeq(canonical));
  }

  @Test
  void testOrientation() {
    for (MExpr a : samples())
      for (MExpr b : samples()) {
        assertTrue(a.lesssim(b).simp().defeq(b.gtrsim(a).simp()), a + " vs " + b);
        assertTrue(a.ll(b).simp().defeq(b.gg(a).simp()), a + " vs " + b);
      }
  }

  @Test
  void testSelfComparison() {
    for (MExpr a : samples()) {
      assertSame(Bool.TRUE, a.gtrsim(a).simp());
      assertSame(Bool.TRUE, a.lesssim(a).simp());
      assertSame(Bool.TRUE, a.asymp(a).simp());
      assertSame(Bool.FALSE, a.gg(a).simp());
      assertSame(Bool.FALSE, a.ll(a).simp());
    }
    assertSame(Bool.TRUE, x.mul(2).asymp(x).simp());
    assertSame(Bool.TRUE, Estimate.mk(3, "<~", 5).simp());
    assertSame(Bool.TRUE, x.add(x).asymp(x).simp());
  }

  @Test
  void testNegatedEstimateSimplifies() {
    final Statement negated = Not.mk(x.lesssim(y)).simp();
    assertTrue(negated.defeq(x.gg(y).simp()), negated.toString());
    assertSame(Bool.FALSE, Not.mk(x.lesssim(x)).simp());
  }
}
