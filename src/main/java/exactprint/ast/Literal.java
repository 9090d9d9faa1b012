package exactprint.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceRange;

/**
 * Literals. Characters and strings keep their source text between the quotes; a number's spelling
 * ({@code 0x1F}, {@code 1e3}) comes from its annotation instead.
 */
public abstract class Literal extends Node {

  Literal(SourceRange range) {
    super(range);
  }

  /** A character literal; {@code raw} is the text between the quotes, e.g. {@code \n}. */
  public static class Char extends Literal {
    public final String raw;

    public Char(String raw, SourceRange range) {
      super(range);
      this.raw = checkNotNull(raw);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitCharLit(this, arg);
    }
  }

  /** A string literal; {@code raw} is the text between the quotes, escapes not interpreted. */
  public static class Str extends Literal {
    public final String raw;

    public Str(String raw, SourceRange range) {
      super(range);
      this.raw = checkNotNull(raw);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitStringLit(this, arg);
    }
  }

  public static class Number extends Literal {
    public Number(SourceRange range) {
      super(range);
    }

    @Override
    public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
      return visitor.visitNumberLit(this, arg);
    }
  }

  public interface Visitor<A, R> {

    R visitCharLit(Char that, A arg);

    R visitStringLit(Str that, A arg);

    R visitNumberLit(Number that, A arg);
  }
}
