package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceCodeReferable;
import exactprint.util.SourceRange;

/**
 * This abstract class stores information that is common between all syntax nodes. The range of a
 * node is also its key into the annotation table.
 */
public abstract class Node implements SourceCodeReferable {

  private final SourceRange range;

  Node(SourceRange range) {
    this.range = checkNotNull(range);
  }

  @Override
  public SourceRange range() {
    return range;
  }

  /** Human readable name of the node's variant, as used in diagnostics. */
  public String kind() {
    Class<?> enclosing = getClass().getEnclosingClass();
    String simpleName = getClass().getSimpleName();
    return enclosing == null ? simpleName : enclosing.getSimpleName() + "." + simpleName;
  }

  public abstract <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg);

  @Override
  public String toString() {
    return kind() + "@" + range;
  }
}
