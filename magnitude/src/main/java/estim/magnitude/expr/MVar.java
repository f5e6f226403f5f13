package estim.magnitude.expr;

import estim.common.types.TypedVar;
import estim.common.types.VarType;

import static com.google.common.base.Preconditions.checkNotNull;

/** A variable magnitude. */
public interface MVar extends MExpr {
  @Override
  default MKind kind() {
    return MKind.VAR;
  }

  String name();

  static MVar mk(String name) {
    return new MVarImpl(checkNotNull(name, "variable name"));
  }

  /** A variable from a declaration; only "order" declarations denote magnitudes. */
  static MVar mk(TypedVar declaration) {
    if (declaration.type() != VarType.ORDER)
      throw new InvalidOperandException(
          "not an order of magnitude: " + declaration + " (expected type order)");
    return new MVarImpl(declaration.name());
  }
}
