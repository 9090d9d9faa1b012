package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;

public abstract class Pat extends Node {

  Pat(SourceRange range) {
    super(range);
  }

  public static class Var extends Pat {
    public final Name name;

    public Var(Name name, SourceRange range) {
      super(range);
      this.name = checkNotNull(name);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitVarPat(this, arg);
    }
  }

  public static class Lit extends Pat {
    public final Literal literal;

    public Lit(Literal literal) {
      super(literal.range());
      this.literal = literal;
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitLitPat(this, arg);
    }
  }

  /** A constructor applied to argument patterns, {@code Just x}. */
  public static class Con extends Pat {
    public final Name constructor;
    public final List<Pat> arguments;

    public Con(Name constructor, List<Pat> arguments, SourceRange range) {
      super(range);
      this.constructor = checkNotNull(constructor);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitConPat(this, arg);
    }
  }

  public static class Wild extends Pat {
    public Wild(SourceRange range) {
      super(range);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitWildPat(this, arg);
    }
  }

  /** {@code all@(x:xs)} */
  public static class As extends Pat {
    public final Name name;
    public final Pat pattern;

    public As(Name name, Pat pattern, SourceRange range) {
      super(range);
      this.name = checkNotNull(name);
      this.pattern = checkNotNull(pattern);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitAsPat(this, arg);
    }
  }

  public static class Tuple extends Pat {
    public final List<Pat> elements;
    public final boolean unboxed;

    public Tuple(List<Pat> elements, boolean unboxed, SourceRange range) {
      super(range);
      this.elements = ImmutableList.copyOf(elements);
      this.unboxed = unboxed;
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitTuplePat(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitVarPat(Var that, A arg);

    R visitLitPat(Lit that, A arg);

    R visitConPat(Con that, A arg);

    R visitWildPat(Wild that, A arg);

    R visitAsPat(As that, A arg);

    R visitTuplePat(Tuple that, A arg);
  }
}
