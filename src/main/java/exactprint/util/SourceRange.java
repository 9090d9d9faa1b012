package exactprint.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.List;

/**
 * A half-open interval in the concrete syntax, denoting the extent of some syntax element or token.
 * In particular, @end@ is one beyond the last character of the element.
 *
 * <p>A range whose begin equals its end is a <em>null span</em>: it marks a synthetic token that has
 * a place in the layout but no text of its own.
 */
public class SourceRange {
  public final SourcePosition begin;
  public final SourcePosition end; // exclusive!

  public SourceRange(SourcePosition begin, SourcePosition end) {
    this.begin = checkNotNull(begin);
    this.end = checkNotNull(end);
    checkArgument(!end.isBefore(begin), "SourceRange ends before it begins");
  }

  public SourceRange(SourcePosition begin, int length) {
    this(begin, begin.moveHorizontal(length));
  }

  public static SourceRange of(int beginLine, int beginColumn, int endLine, int endColumn) {
    return new SourceRange(
        new SourcePosition(beginLine, beginColumn), new SourcePosition(endLine, endColumn));
  }

  /** A zero-width range at {@code position}. */
  public static SourceRange nullAt(SourcePosition position) {
    return new SourceRange(position, position);
  }

  public boolean isNull() {
    return begin.equals(end);
  }

  public String annotateSourceFileExcerpt(List<String> sourceFile) {
    StringBuilder sb = new StringBuilder();
    if (begin.line < end.line) {
      // we can only really squiggle at the side
      int digits = (int) Math.floor(Math.log10(end.line)) + 1;
      int begin = this.begin.line;
      int end = Math.min(this.end.line, sourceFile.size());
      for (int i = begin; i <= end; ++i) {
        sb.append(String.format("%" + digits + "d|> %s", i, sourceFile.get(i - 1)));
        sb.append(System.lineSeparator());
      }
    } else {
      assert begin.line == end.line;

      int line0 = begin.line - 1;
      if (line0 >= sourceFile.size()) {
        // squiggle the EOF
        line0 = sourceFile.size() - 1;
        String prefix = String.format("%d| ", line0 + 1);
        sb.append(prefix);
        String lastLine = sourceFile.get(line0);
        sb.append(lastLine);
        sb.append(System.lineSeparator());
        sb.append(Strings.repeat(" ", prefix.length() + lastLine.length()));
        sb.append("^");
        sb.append(System.lineSeparator());
      } else {
        String prefix = String.format("%d| ", line0 + 1);
        sb.append(prefix);
        int squiggleOffset = prefix.length() + begin.column - 1;
        // a null span still gets a single caret
        int squiggleLength = Math.max(1, end.column - begin.column);
        sb.append(sourceFile.get(line0));
        sb.append(System.lineSeparator());
        sb.append(Strings.repeat(" ", squiggleOffset));
        sb.append(Strings.repeat("^", squiggleLength));
        sb.append(System.lineSeparator());
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SourceRange that = (SourceRange) o;

    return begin.equals(that.begin) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return 31 * begin.hashCode() + end.hashCode();
  }

  @Override
  public String toString() {
    return String.format("%s-%s", begin, end);
  }
}
