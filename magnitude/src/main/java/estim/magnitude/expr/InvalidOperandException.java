package estim.magnitude.expr;

public class InvalidOperandException extends MagnitudeException {
  public InvalidOperandException(String message) {
    super(message);
  }
}
