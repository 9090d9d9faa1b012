package exactprint.printer;

import exactprint.ExactPrintError;
import exactprint.ast.Node;

/** The printer has no renderer for this kind of node. */
public class UnsupportedVariantError extends ExactPrintError {

  public final String nodeKind;

  UnsupportedVariantError(Node node) {
    super(String.format("No exact printer for %s at %s", node.kind(), node.range()), node.range());
    this.nodeKind = node.kind();
  }
}
