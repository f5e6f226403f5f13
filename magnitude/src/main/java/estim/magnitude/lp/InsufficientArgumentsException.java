package estim.magnitude.lp;

import estim.magnitude.expr.MagnitudeException;

public class InsufficientArgumentsException extends MagnitudeException {
  public InsufficientArgumentsException(int given) {
    super("Littlewood-Paley constraints must involve at least two magnitudes, got " + given);
  }
}
