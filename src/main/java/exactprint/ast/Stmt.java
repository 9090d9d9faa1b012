package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceRange;

/** Statements of a do block; guards are statements, too. */
public abstract class Stmt extends Node {

  Stmt(SourceRange range) {
    super(range);
  }

  public static class Body extends Stmt {
    public final Expr expression;

    public Body(Expr expression, SourceRange range) {
      super(range);
      this.expression = checkNotNull(expression);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitBodyStmt(this, arg);
    }
  }

  /** {@code x <- action} */
  public static class Bind extends Stmt {
    public final Pat pattern;
    public final Expr expression;

    public Bind(Pat pattern, Expr expression, SourceRange range) {
      super(range);
      this.pattern = checkNotNull(pattern);
      this.expression = checkNotNull(expression);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitBindStmt(this, arg);
    }
  }

  public static class Let extends Stmt {
    public final LocalBinds binds;

    public Let(LocalBinds binds, SourceRange range) {
      super(range);
      this.binds = checkNotNull(binds);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitLetStmt(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitBodyStmt(Body that, A arg);

    R visitBindStmt(Bind that, A arg);

    R visitLetStmt(Let that, A arg);
  }
}
