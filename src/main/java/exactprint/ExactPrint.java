package exactprint;

import exactprint.annotation.AnnotationTable;
import exactprint.ast.Node;
import exactprint.comment.Comment;
import exactprint.comment.Comments;
import exactprint.printer.ExactPrinter;
import exactprint.printer.PrinterOptions;
import exactprint.token.Token;
import java.util.List;

public class ExactPrint {

  private ExactPrint() {}

  /** Prints a tree without annotations; only trees without auxiliary tokens print this way. */
  public static String exactPrint(Node root, List<Comment> comments) {
    return exactPrintAnnotation(root, comments, new AnnotationTable());
  }

  public static String exactPrint(Node root, List<Comment> comments, PrinterOptions options) {
    return exactPrintAnnotation(root, comments, new AnnotationTable(), options);
  }

  /**
   * Reproduces the source {@code root} was parsed from. Unsupported syntax is handled as {@link
   * EnvVar#EXACTPRINT_UNSUPPORTED} says.
   */
  public static String exactPrintAnnotation(
      Node root, List<Comment> comments, AnnotationTable annotations) {
    return exactPrintAnnotation(root, comments, annotations, PrinterOptions.fromEnvironment());
  }

  public static String exactPrintAnnotation(
      Node root, List<Comment> comments, AnnotationTable annotations, PrinterOptions options) {
    return ExactPrinter.print(root, comments, annotations, options);
  }

  public static List<Comment> toksToComments(Iterable<Token> tokens) {
    return Comments.fromTokens(tokens);
  }
}
