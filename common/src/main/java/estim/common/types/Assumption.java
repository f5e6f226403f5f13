package estim.common.types;

/** Properties a declared symbol may be assumed to have. */
public enum Assumption {
  INTEGER,
  RATIONAL,
  REAL,
  COMPLEX,
  POSITIVE,
  NONNEGATIVE,
  NONZERO,
  BOOLEAN,
  ORDER
}
