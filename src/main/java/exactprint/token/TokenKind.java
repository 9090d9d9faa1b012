package exactprint.token;

/** Coarse token classes, as far as the exact printer needs to tell them apart. */
public enum TokenKind {
  IDENT,
  SYMBOL,
  KEYWORD,
  LITERAL,
  SPECIAL,
  LINE_COMMENT,
  BLOCK_COMMENT,
  EOF;

  public boolean isComment() {
    return this == LINE_COMMENT || this == BLOCK_COMMENT;
  }
}
