package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;

/** A data constructor with its argument types. */
public class ConDecl extends Node {

  public final Name name;
  public final List<Type> arguments;

  public ConDecl(Name name, List<Type> arguments, SourceRange range) {
    super(range);
    this.name = checkNotNull(name);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitConDecl(this, arg);
  }
}
