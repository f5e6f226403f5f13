package estim.magnitude.expr;

public class InvalidExponentException extends MagnitudeException {
  public InvalidExponentException(Object exponent) {
    super(
        "exponent "
            + exponent
            + " must be an integer or a rational, was "
            + (exponent == null ? "null" : exponent.getClass().getSimpleName()));
  }
}
