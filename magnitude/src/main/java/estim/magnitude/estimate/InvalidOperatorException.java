package estim.magnitude.estimate;

import estim.magnitude.expr.MagnitudeException;

public class InvalidOperatorException extends MagnitudeException {
  public InvalidOperatorException(String symbol) {
    super("invalid operator " + symbol + " for estimate");
  }
}
