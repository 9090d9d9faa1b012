package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

public abstract class Expr extends Node {

  Expr(SourceRange range) {
    super(range);
  }

  public static class Var extends Expr {
    public final Name name;

    public Var(Name name, SourceRange range) {
      super(range);
      this.name = checkNotNull(name);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitVar(this, arg);
    }
  }

  public static class Lit extends Expr {
    public final Literal literal;

    public Lit(Literal literal) {
      super(literal.range());
      this.literal = literal;
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitLit(this, arg);
    }
  }

  /** Binary operator application, {@code a + b} or {@code a `div` b}. */
  public static class OpApp extends Expr {
    public final Expr left;
    public final Var operator;
    public final Expr right;

    public OpApp(Expr left, Var operator, Expr right, SourceRange range) {
      super(range);
      this.left = checkNotNull(left);
      this.operator = checkNotNull(operator);
      this.right = checkNotNull(right);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitOpApp(this, arg);
    }
  }

  public static class App extends Expr {
    public final Expr function;
    public final Expr argument;

    public App(Expr function, Expr argument, SourceRange range) {
      super(range);
      this.function = checkNotNull(function);
      this.argument = checkNotNull(argument);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitApp(this, arg);
    }
  }

  public static class Paren extends Expr {
    public final Expr expression;

    public Paren(Expr expression, SourceRange range) {
      super(range);
      this.expression = checkNotNull(expression);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitParen(this, arg);
    }
  }

  public static class Let extends Expr {
    public final LocalBinds binds;
    public final Expr body;

    public Let(LocalBinds binds, Expr body, SourceRange range) {
      super(range);
      this.binds = checkNotNull(binds);
      this.body = checkNotNull(body);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitLet(this, arg);
    }
  }

  public static class Do extends Expr {
    public final List<Stmt> statements;

    public Do(List<Stmt> statements, SourceRange range) {
      super(range);
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitDo(this, arg);
    }
  }

  public static class Tuple extends Expr {
    public final List<Expr> elements;
    public final boolean unboxed;

    public Tuple(List<Expr> elements, boolean unboxed, SourceRange range) {
      super(range);
      this.elements = ImmutableList.copyOf(elements);
      this.unboxed = unboxed;
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitTuple(this, arg);
    }
  }

  /** An explicit list, {@code [a, b, c]}. */
  public static class ExplicitList extends Expr {
    public final List<Expr> elements;

    public ExplicitList(List<Expr> elements, SourceRange range) {
      super(range);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitExplicitList(this, arg);
    }
  }

  /** {@code [from ..]}, {@code [from, then ..]}, {@code [from .. to]}, {@code [from, then .. to]} */
  public static class ArithSeq extends Expr {
    public final Expr from;
    public final Optional<Expr> then;
    public final Optional<Expr> to;

    public ArithSeq(Expr from, @Nullable Expr then, @Nullable Expr to, SourceRange range) {
      super(range);
      this.from = checkNotNull(from);
      this.then = Optional.ofNullable(then);
      this.to = Optional.ofNullable(to);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitArithSeq(this, arg);
    }
  }

  /** An expression form the parser knows but the printer has no renderer for. */
  public static class Other extends Expr {
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
      return visitor.visitOtherExpr(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitVar(Var that, A arg);

    R visitLit(Lit that, A arg);

    R visitOpApp(OpApp that, A arg);

    R visitApp(App that, A arg);

    R visitParen(Paren that, A arg);

    R visitLet(Let that, A arg);

    R visitDo(Do that, A arg);

    R visitTuple(Tuple that, A arg);

    R visitExplicitList(ExplicitList that, A arg);

    R visitArithSeq(ArithSeq that, A arg);

    R visitOtherExpr(Other that, A arg);
  }
}
