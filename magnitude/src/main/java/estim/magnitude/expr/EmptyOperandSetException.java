package estim.magnitude.expr;

public class EmptyOperandSetException extends MagnitudeException {
  public EmptyOperandSetException(MKind kind) {
    super(kind.name().toLowerCase() + " requires at least one operand");
  }
}
