package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;

/** A right hand side, optionally guarded: {@code | x > 0, y <- f x = e}. */
public class GuardedRhs extends Node {

  public final List<Stmt> guards;
  public final Expr body;

  public GuardedRhs(List<Stmt> guards, Expr body, SourceRange range) {
    super(range);
    this.guards = ImmutableList.copyOf(guards);
    this.body = checkNotNull(body);
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitGuardedRhs(this, arg);
  }
}
