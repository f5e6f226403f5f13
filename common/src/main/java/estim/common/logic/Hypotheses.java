package estim.common.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import estim.common.utils.ListSupport;

import java.util.Iterator;
import java.util.List;

/**
 * An immutable collection of statements assumed to hold. Membership is by {@link
 * Statement#defeq}, not by object equality.
 */
public final class Hypotheses implements Iterable<Statement> {
  private static final Hypotheses EMPTY = new Hypotheses(ImmutableList.of());

  private final ImmutableList<Statement> statements;

  private Hypotheses(ImmutableList<Statement> statements) {
    this.statements = statements;
  }

  public static Hypotheses empty() {
    return EMPTY;
  }

  public static Hypotheses of(Statement... statements) {
    return EMPTY.with(List.of(statements));
  }

  public Hypotheses with(Statement statement) {
    return with(List.of(statement));
  }

  public Hypotheses with(List<? extends Statement> more) {
    final List<Statement> merged =
        ListSupport.dedup(Iterables.concat(statements, more), Statement::defeq);
    return new Hypotheses(ImmutableList.copyOf(merged));
  }

  public boolean contains(Statement statement) {
    for (Statement s : statements) if (s.defeq(statement)) return true;
    return false;
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public int size() {
    return statements.size();
  }

  @Override
  public Iterator<Statement> iterator() {
    return statements.iterator();
  }

  @Override
  public String toString() {
    return statements.toString();
  }
}
