package exactprint.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;

/** Top level and local declarations. */
public abstract class Decl extends Node {

  Decl(SourceRange range) {
    super(range);
  }

  /** {@code f, g :: Int -> Int} */
  public static class TypeSig extends Decl {
    public final List<Name> names;
    public final Type type;

    public TypeSig(List<Name> names, Type type, SourceRange range) {
      super(range);
      checkArgument(!names.isEmpty(), "type signature without names");
      this.names = ImmutableList.copyOf(names);
      this.type = checkNotNull(type);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitTypeSig(this, arg);
    }
  }

  /** A function defined by one or more equations. */
  public static class FunBind extends Decl {
    public final Name name;
    public final List<Match> matches;

    public FunBind(Name name, List<Match> matches, SourceRange range) {
      super(range);
      checkArgument(!matches.isEmpty(), "function binding without equations");
      this.name = checkNotNull(name);
      this.matches = ImmutableList.copyOf(matches);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitFunBind(this, arg);
    }
  }

  /** {@code (a, b) = rhs where binds} */
  public static class PatBind extends Decl {
    public final Pat lhs;
    public final List<GuardedRhs> rhs;
    public final LocalBinds binds;

    public PatBind(Pat lhs, List<GuardedRhs> rhs, LocalBinds binds, SourceRange range) {
      super(range);
      this.lhs = checkNotNull(lhs);
      this.rhs = ImmutableList.copyOf(rhs);
      this.binds = checkNotNull(binds);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitPatBind(this, arg);
    }
  }

  /** {@code data T a = A a | B} */
  public static class DataDecl extends Decl {
    public final Name name;
    public final List<Name> typeVariables;
    public final List<ConDecl> constructors;

    public DataDecl(
        Name name, List<Name> typeVariables, List<ConDecl> constructors, SourceRange range) {
      super(range);
      this.name = checkNotNull(name);
      this.typeVariables = ImmutableList.copyOf(typeVariables);
      this.constructors = ImmutableList.copyOf(constructors);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitDataDecl(this, arg);
    }
  }

  /** A declaration form the parser knows but the printer has no renderer for. */
  public static class Other extends Decl {
    public final String what;

    public Other(String what, SourceRange range) {
      super(range);
      this.what = checkNotNull(what);
    }

    @Override
    public String kind() {
      return super.kind() + "(" + what + ")";
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitOtherDecl(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitTypeSig(TypeSig that, A arg);

    R visitFunBind(FunBind that, A arg);

    R visitPatBind(PatBind that, A arg);

    R visitDataDecl(DataDecl that, A arg);

    R visitOtherDecl(Other that, A arg);
  }
}
