package exactprint.token;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceCodeReferable;
import exactprint.util.SourceRange;

/** A token of the original source as delivered by the lexer. Instances are immutable. */
public class Token implements SourceCodeReferable {

  public final TokenKind kind;
  public final SourceRange range;
  /** The exact source text of the token, delimiters included. */
  public final String lexval;

  public Token(TokenKind kind, SourceRange range, String lexval) {
    this.kind = checkNotNull(kind);
    this.range = checkNotNull(range);
    this.lexval = checkNotNull(lexval);
  }

  @Override
  public SourceRange range() {
    return range;
  }

  @Override
  public String toString() {
    return range.begin + " " + kind.name().toLowerCase() + " (" + lexval + ")";
  }
}
