package estim.magnitude.expr;

/** Raised when a magnitude expression or relation is constructed from malformed input. */
public class MagnitudeException extends IllegalArgumentException {
  public MagnitudeException(String message) {
    super(message);
  }
}
