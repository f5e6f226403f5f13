package estim.common.utils;

import java.util.Arrays;
import java.util.List;
import java.util.function.BiPredicate;

/** Bipartite matching between two lists under a compatibility predicate. */
public abstract class MatchingSupport {
  private MatchingSupport() {}

  /**
   * Whether there is a bijection between `xs` and `ys` such that every matched pair satisfies
   * `compatible`. Lists of different sizes are rejected immediately.
   *
   * <p>Uses augmenting paths (Kuhn's algorithm), so the answer does not depend on the order of
   * elements, unlike a greedy removal.
   */
  public static <X, Y> boolean isPerfectMatchable(
      List<X> xs, List<Y> ys, BiPredicate<? super X, ? super Y> compatible) {
    final int n = xs.size();
    if (n != ys.size()) return false;
    if (n == 0) return true;

    final boolean[][] edges = new boolean[n][n];
    for (int i = 0; i < n; ++i) {
      boolean any = false;
      for (int j = 0; j < n; ++j) {
        edges[i][j] = compatible.test(xs.get(i), ys.get(j));
        any |= edges[i][j];
      }
      if (!any) return false;
    }

    final int[] matchOfY = new int[n];
    Arrays.fill(matchOfY, -1);
    for (int i = 0; i < n; ++i) {
      if (!augment(i, edges, matchOfY, new boolean[n])) return false;
    }
    return true;
  }

  private static boolean augment(int x, boolean[][] edges, int[] matchOfY, boolean[] visited) {
    for (int y = 0; y < matchOfY.length; ++y) {
      if (!edges[x][y] || visited[y]) continue;
      visited[y] = true;
      if (matchOfY[y] < 0 || augment(matchOfY[y], edges, matchOfY, visited)) {
        matchOfY[y] = x;
        return true;
      }
    }
    return false;
  }
}
