package estim.common.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Function;

public interface ListSupport {
  static <X, Y> List<Y> map(Iterable<X> xs, Function<? super X, ? extends Y> func) {
    final List<Y> ret = new ArrayList<>();
    for (X x : xs) ret.add(func.apply(x));
    return ret;
  }

  /** Index of the first element equivalent to `x` under `eq`, or -1. */
  static <T> int indexOf(List<T> xs, T x, BiPredicate<? super T, ? super T> eq) {
    for (int i = 0, bound = xs.size(); i < bound; ++i) if (eq.test(xs.get(i), x)) return i;
    return -1;
  }

  /**
   * Removes duplicates under a custom equivalence, keeping the first representative of each
   * class. Pairwise, so O(n^2); the equivalence need not be hash-compatible.
   */
  static <T> List<T> dedup(Iterable<T> xs, BiPredicate<? super T, ? super T> eq) {
    final List<T> ret = new ArrayList<>();
    for (T x : xs) if (indexOf(ret, x, eq) < 0) ret.add(x);
    return ret;
  }
}
