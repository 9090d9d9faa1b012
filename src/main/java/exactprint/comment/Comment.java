package exactprint.comment;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceCodeReferable;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.Comparator;
import org.jetbrains.annotations.NotNull;

/**
 * A comment at an absolute source range. The text is kept verbatim, delimiters included. Comments
 * are ordered by their start, then by their end.
 */
public class Comment implements AttachedComment, SourceCodeReferable, Comparable<Comment> {

  private static final Comparator<Comment> ORDER =
      Comparator.<Comment, SourcePosition>comparing(c -> c.range.begin)
          .thenComparing(c -> c.range.end);

  public final boolean isBlock;
  public final SourceRange range;
  public final String text;

  public Comment(boolean isBlock, SourceRange range, String text) {
    this.isBlock = isBlock;
    this.range = checkNotNull(range);
    this.text = checkNotNull(text);
  }

  public static Comment line(SourceRange range, String text) {
    return new Comment(false, range, text);
  }

  public static Comment block(SourceRange range, String text) {
    return new Comment(true, range, text);
  }

  @Override
  public SourceRange range() {
    return range;
  }

  public SourcePosition start() {
    return range.begin;
  }

  @Override
  public Comment resolve(SourcePosition cursor) {
    return this;
  }

  @Override
  public int compareTo(@NotNull Comment other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Comment that = (Comment) o;

    return isBlock == that.isBlock && range.equals(that.range) && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    int result = range.hashCode();
    result = 31 * result + text.hashCode();
    return 31 * result + (isBlock ? 1 : 0);
  }

  @Override
  public String toString() {
    return range + " " + text;
  }
}
