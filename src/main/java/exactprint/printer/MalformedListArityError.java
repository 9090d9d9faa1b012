package exactprint.printer;

import exactprint.ExactPrintError;
import exactprint.util.SourceRange;
import org.jetbrains.annotations.Nullable;

/** A list combinator got a number of bracket or separator positions that does not fit its items. */
public class MalformedListArityError extends ExactPrintError {

  MalformedListArityError(
      String combinator, String expected, int actual, @Nullable SourceRange range) {
    super(
        String.format("%s expects %s positions but got %d", combinator, expected, actual), range);
  }
}
