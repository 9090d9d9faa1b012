package exactprint.comment;

import static org.jooq.lambda.Seq.seq;

import exactprint.token.Token;
import exactprint.token.TokenKind;
import java.util.List;

public class Comments {

  private Comments() {}

  /** Extracts the comments of a token stream, in token order. */
  public static List<Comment> fromTokens(Iterable<Token> tokens) {
    return seq(tokens)
        .filter(t -> t.kind.isComment())
        .map(t -> new Comment(t.kind == TokenKind.BLOCK_COMMENT, t.range, t.lexval))
        .toList();
  }
}
