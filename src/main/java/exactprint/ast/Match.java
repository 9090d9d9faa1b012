package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;

/** One equation of a function binding, {@code f x y | g = e where binds}. */
public class Match extends Node {

  public final Name name;
  public final List<Pat> patterns;
  public final List<GuardedRhs> rhs;
  public final LocalBinds binds;

  public Match(
      Name name, List<Pat> patterns, List<GuardedRhs> rhs, LocalBinds binds, SourceRange range) {
    super(range);
    this.name = checkNotNull(name);
    this.patterns = ImmutableList.copyOf(patterns);
    this.rhs = ImmutableList.copyOf(rhs);
    this.binds = checkNotNull(binds);
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitMatch(this, arg);
  }
}
