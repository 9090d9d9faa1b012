package exactprint.printer;

import exactprint.annotation.AnnotationTable;
import exactprint.ast.Module;
import exactprint.comment.Comment;
import java.util.List;

class GeneratedModule {
  final Module module;
  final List<Comment> comments;
  /** Every comment of the source, floated ones included, in source order. */
  final List<String> commentTexts;
  final AnnotationTable annotations;
  final String source;

  GeneratedModule(
      Module module,
      List<Comment> comments,
      List<String> commentTexts,
      AnnotationTable annotations,
      String source) {
    this.module = module;
    this.comments = comments;
    this.commentTexts = commentTexts;
    this.annotations = annotations;
    this.source = source;
  }

  @Override
  public String toString() {
    return source;
  }
}
