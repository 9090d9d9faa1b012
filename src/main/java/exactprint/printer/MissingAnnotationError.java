package exactprint.printer;

import exactprint.ExactPrintError;
import exactprint.annotation.AnnotationPayload;
import exactprint.ast.Node;

/** A visited node lacks the annotation its renderer needs to place its tokens. */
public class MissingAnnotationError extends ExactPrintError {

  public final String nodeKind;

  MissingAnnotationError(Node node, Class<? extends AnnotationPayload> expected, int found) {
    super(
        String.format(
            "Missing annotation at %s: %s needs exactly one %s annotation, found %d",
            node.range(), node.kind(), expected.getSimpleName(), found),
        node.range());
    this.nodeKind = node.kind();
  }
}
