package exactprint.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import exactprint.util.SourceRange;

/** An identifier or operator, possibly qualified ({@code Data.Map.insert}). */
public class Name extends Node {

  private static final CharMatcher SYMBOL_CHARS = CharMatcher.anyOf("!#$%&*+./<=>?@\\^|-~:");

  public final String text;

  public Name(String text, SourceRange range) {
    super(range);
    checkArgument(!checkNotNull(text).isEmpty(), "empty name");
    this.text = text;
  }

  /** True for operators like {@code +} or {@code >>=}. */
  public boolean isSymbol() {
    int lastDot = text.lastIndexOf('.', text.length() - 2);
    String unqualified = lastDot < 0 ? text : text.substring(lastDot + 1);
    return SYMBOL_CHARS.matchesAllOf(unqualified);
  }

  /** How the name is written in prefix position: operators get parentheses. */
  public String prefixForm() {
    return isSymbol() ? "(" + text + ")" : text;
  }

  /** How the name is written between two operands: identifiers get backticks. */
  public String infixForm() {
    return isSymbol() ? text : "`" + text + "`";
  }

  @Override
  public <A, R> R acceptVisitor(SyntaxVisitor<A, R> visitor, A arg) {
    return visitor.visitName(this, arg);
  }
}
