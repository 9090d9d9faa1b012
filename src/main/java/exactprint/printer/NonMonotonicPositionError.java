package exactprint.printer;

import exactprint.ExactPrintError;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;

/**
 * Output was requested at a position the cursor has already passed. The annotations or the comment
 * positions do not match the tree.
 */
public class NonMonotonicPositionError extends ExactPrintError {

  public final SourcePosition cursor;
  public final SourcePosition target;

  NonMonotonicPositionError(SourcePosition cursor, SourcePosition target) {
    super(
        String.format("Cannot move back from %s to %s", cursor, target),
        new SourceRange(target, cursor));
    this.cursor = cursor;
    this.target = target;
  }
}
