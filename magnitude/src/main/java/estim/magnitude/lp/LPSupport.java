package estim.magnitude.lp;

import estim.common.logic.And;
import estim.common.logic.Or;
import estim.common.logic.Statement;
import estim.magnitude.expr.MExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static estim.magnitude.expr.MExprSupport.ensureExpr;

/** Relations arising in the Littlewood-Paley analysis of frequency interactions. */
public abstract class LPSupport {
  private static final Logger LOG = Logger.getLogger(LPSupport.class.getName());

  private LPSupport() {}

  public static MExpr sqrt(Object x) {
    return ensureExpr(x).sqrt();
  }

  /** The Japanese bracket &lt;x&gt; = (1 + x^2)^(1/2). */
  public static MExpr bracket(Object x) {
    return ensureExpr(x).bracket();
  }

  /**
   * The Littlewood-Paley property of N1, .., Nk: they are the magnitudes of vectors summing to
   * zero. Equivalently, some two of them are comparable and bound all the others:
   *
   * <pre>
   *   OR over pairs i &lt; j of ( Ni ~ Nj  AND  Nk &lt;~ Ni for every other k )
   * </pre>
   *
   * With two magnitudes this is just N1 ~ N2.
   *
   * @throws InsufficientArgumentsException if fewer than two magnitudes are given
   */
  public static Statement lpProperty(MExpr... magnitudes) {
    return lpProperty(List.of(magnitudes));
  }

  public static Statement lpProperty(List<? extends MExpr> magnitudes) {
    final int n = magnitudes.size();
    if (n < 2) throw new InsufficientArgumentsException(n);
    if (n == 2) return magnitudes.get(0).asymp(magnitudes.get(1));

    final List<Statement> cases = new ArrayList<>(n * (n - 1) / 2);
    for (int i = 0; i < n; ++i) {
      for (int j = i + 1; j < n; ++j) {
        final MExpr dominant = magnitudes.get(i);
        final List<Statement> conjuncts = new ArrayList<>(n - 1);
        conjuncts.add(dominant.asymp(magnitudes.get(j)));
        for (int k = 0; k < n; ++k) {
          if (k != i && k != j) conjuncts.add(magnitudes.get(k).lesssim(dominant));
        }
        cases.add(And.mk(conjuncts));
      }
    }

    LOG.fine(() -> "Littlewood-Paley property of " + magnitudes + ": " + cases.size() + " cases");
    return Or.mk(cases);
  }
}
