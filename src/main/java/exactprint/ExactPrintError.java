package exactprint;

import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Basic error class in this project. Any such error aborts the printing run. */
public class ExactPrintError extends RuntimeException {

  public final Optional<SourceRange> range;

  public ExactPrintError(String message, @Nullable SourceRange range) {
    super(message);
    this.range = Optional.ofNullable(range);
  }

  public ExactPrintError(String message) {
    this(message, null);
  }

  public String getSourceReferencingMessage(List<String> sourceFile) {
    if (!range.isPresent() || sourceFile.isEmpty()) {
      return getMessage();
    }
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.get().annotateSourceFileExcerpt(sourceFile);
  }
}
