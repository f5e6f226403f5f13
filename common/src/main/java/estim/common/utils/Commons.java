package estim.common.utils;

public interface Commons {
  /** Renders a named object as "name: object". */
  static String describe(String name, Object object) {
    return name + ": " + object;
  }
}
