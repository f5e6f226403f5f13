package estim.common.types;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** The closed set of type tags a variable can be declared with. */
public enum VarType {
  INT("int", Assumption.INTEGER),
  POS_INT("pos_int", Assumption.INTEGER, Assumption.POSITIVE),
  NONNEG_INT("nonneg_int", Assumption.INTEGER, Assumption.NONNEGATIVE),
  NONZERO_INT("nonzero_int", Assumption.INTEGER, Assumption.NONZERO),
  REAL("real", Assumption.REAL),
  POS_REAL("pos_real", Assumption.REAL, Assumption.POSITIVE),
  NONNEG_REAL("nonneg_real", Assumption.REAL, Assumption.NONNEGATIVE),
  NONZERO_REAL("nonzero_real", Assumption.REAL, Assumption.NONZERO),
  RAT("rat", Assumption.RATIONAL),
  POS_RAT("pos_rat", Assumption.RATIONAL, Assumption.POSITIVE),
  NONNEG_RAT("nonneg_rat", Assumption.RATIONAL, Assumption.NONNEGATIVE),
  NONZERO_RAT("nonzero_rat", Assumption.RATIONAL, Assumption.NONZERO),
  COMPLEX("complex", Assumption.COMPLEX),
  NONZERO_COMPLEX("nonzero_complex", Assumption.COMPLEX, Assumption.NONZERO),
  BOOL("bool", Assumption.BOOLEAN),
  ORDER("order", Assumption.ORDER);

  private final String tag;
  private final Set<Assumption> assumptions;

  VarType(String tag, Assumption first, Assumption... rest) {
    this.tag = tag;
    this.assumptions = Collections.unmodifiableSet(EnumSet.of(first, rest));
  }

  public String tag() {
    return tag;
  }

  public Set<Assumption> assumptions() {
    return assumptions;
  }

  public static VarType ofTag(String tag) {
    for (VarType type : values()) if (type.tag.equals(tag)) return type;
    throw new UnknownTypeException(tag);
  }

  /**
   * The most specific tag describing a symbol with the given properties, or null if none fits.
   * Number kinds are tried from the narrowest (integer) to the widest (complex); within a kind,
   * positivity wins over non-negativity, which wins over non-zeroness.
   */
  public static VarType classify(Set<Assumption> props) {
    if (props.contains(Assumption.INTEGER))
      return refine(props, INT, POS_INT, NONNEG_INT, NONZERO_INT);
    if (props.contains(Assumption.RATIONAL))
      return refine(props, RAT, POS_RAT, NONNEG_RAT, NONZERO_RAT);
    if (props.contains(Assumption.REAL))
      return refine(props, REAL, POS_REAL, NONNEG_REAL, NONZERO_REAL);
    if (props.contains(Assumption.COMPLEX))
      return props.contains(Assumption.NONZERO) ? NONZERO_COMPLEX : COMPLEX;
    if (props.contains(Assumption.BOOLEAN)) return BOOL;
    if (props.contains(Assumption.ORDER)) return ORDER;
    return null;
  }

  private static VarType refine(
      Set<Assumption> props, VarType plain, VarType pos, VarType nonneg, VarType nonzero) {
    if (props.contains(Assumption.POSITIVE)) return pos;
    if (props.contains(Assumption.NONNEGATIVE)) return nonneg;
    if (props.contains(Assumption.NONZERO)) return nonzero;
    return plain;
  }

  @Override
  public String toString() {
    return tag;
  }
}
