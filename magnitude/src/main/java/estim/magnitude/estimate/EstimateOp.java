package estim.magnitude.estimate;

/**
 * The five estimate relations.
 *
 * <pre>
 *   X &lt;~ Y : X = O(Y)
 *   X &lt;&lt; Y : X = o(Y)
 *   X ~  Y : X &lt;~ Y and Y &lt;~ X
 *   X &gt;~ Y : Y = O(X)
 *   X &gt;&gt; Y : Y = o(X)
 * </pre>
 */
public enum EstimateOp {
  LESSSIM("<~", "≲"),
  LL("<<", "≪"),
  ASYMP("~", "~"),
  GTRSIM(">~", "≳"),
  GG(">>", "≫");

  private final String symbol;
  private final String unicode;

  EstimateOp(String symbol, String unicode) {
    this.symbol = symbol;
    this.unicode = unicode;
  }

  public String symbol() {
    return symbol;
  }

  public String unicode() {
    return unicode;
  }

  /** Accepts either the ASCII or the Unicode spelling. */
  public static EstimateOp ofSymbol(String symbol) {
    for (EstimateOp op : values())
      if (op.symbol.equals(symbol) || op.unicode.equals(symbol)) return op;
    throw new InvalidOperatorException(symbol);
  }

  /** The relation holding exactly when this one fails, or null for ASYMP (no single operator). */
  public EstimateOp negated() {
    return switch (this) {
      case LESSSIM -> GG;
      case LL -> GTRSIM;
      case ASYMP -> null;
      case GTRSIM -> LL;
      case GG -> LESSSIM;
    };
  }

  /** The relation obtained by swapping the two sides: X op Y iff Y op.reversed() X. */
  public EstimateOp reversed() {
    return switch (this) {
      case LESSSIM -> GTRSIM;
      case LL -> GG;
      case ASYMP -> ASYMP;
      case GTRSIM -> LESSSIM;
      case GG -> LL;
    };
  }

  public boolean isStrict() {
    return this == LL || this == GG;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
