package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;

public abstract class Type extends Node {

  Type(SourceRange range) {
    super(range);
  }

  /** A type variable or type constructor. */
  public static class Var extends Type {
    public final Name name;

    public Var(Name name, SourceRange range) {
      super(range);
      this.name = checkNotNull(name);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitTyVar(this, arg);
    }
  }

  public static class App extends Type {
    public final Type function;
    public final Type argument;

    public App(Type function, Type argument, SourceRange range) {
      super(range);
      this.function = checkNotNull(function);
      this.argument = checkNotNull(argument);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitTyApp(this, arg);
    }
  }

  public static class Fun extends Type {
    public final Type argument;
    public final Type result;

    public Fun(Type argument, Type result, SourceRange range) {
      super(range);
      this.argument = checkNotNull(argument);
      this.result = checkNotNull(result);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitFunTy(this, arg);
    }
  }

  public static class Paren extends Type {
    public final Type type;

    public Paren(Type type, SourceRange range) {
      super(range);
      this.type = checkNotNull(type);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitParTy(this, arg);
    }
  }

  public static class Tuple extends Type {
    public final List<Type> elements;
    public final boolean unboxed;

    public Tuple(List<Type> elements, boolean unboxed, SourceRange range) {
      super(range);
      this.elements = ImmutableList.copyOf(elements);
      this.unboxed = unboxed;
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitTupleTy(this, arg);
    }
  }

  /** {@code (Eq a, Show a) => a -> String} */
  public static class Qualified extends Type {
    public final List<Type> context;
    public final Type body;

    public Qualified(List<Type> context, Type body, SourceRange range) {
      super(range);
      this.context = ImmutableList.copyOf(context);
      this.body = checkNotNull(body);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitQualifiedTy(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitTyVar(Var that, A arg);

    R visitTyApp(App that, A arg);

    R visitFunTy(Fun that, A arg);

    R visitParTy(Paren that, A arg);

    R visitTupleTy(Tuple that, A arg);

    R visitQualifiedTy(Qualified that, A arg);
  }
}
