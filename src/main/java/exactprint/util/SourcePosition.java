package exactprint.util;

import static com.google.common.base.Preconditions.checkArgument;

import org.jetbrains.annotations.NotNull;

/**
 * Position in the source file. Lines and columns both start at 1. Instances of this class are
 * immutable and ordered by line, then column.
 */
public class SourcePosition implements Comparable<SourcePosition> {

  public static final SourcePosition BEGIN_OF_FILE = new SourcePosition(1, 1);
  public final int line;
  public final int column;

  public SourcePosition(int line, int column) {
    checkArgument(line >= 1, "line must be positive, was %s", line);
    checkArgument(column >= 1, "column must be positive, was %s", column);
    this.line = line;
    this.column = column;
  }

  public SourcePosition moveHorizontal(int length) {
    return new SourcePosition(line, column + length);
  }

  public SourcePosition nextLine() {
    return new SourcePosition(line + 1, 1);
  }

  /** Componentwise shift, as used for the printer's offset. */
  public SourcePosition shift(DeltaPos offset) {
    return new SourcePosition(line + offset.line, column + offset.column);
  }

  public boolean isBefore(SourcePosition other) {
    return compareTo(other) < 0;
  }

  @Override
  public String toString() {
    return "[" + line + ":" + column + "]";
  }

  @Override
  public int compareTo(@NotNull SourcePosition other) {
    int byLine = Integer.compare(line, other.line);
    return byLine != 0 ? byLine : Integer.compare(column, other.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SourcePosition that = (SourcePosition) o;

    return compareTo(that) == 0;
  }

  @Override
  public int hashCode() {
    int result = line;
    result = 31 * result + column;
    return result;
  }
}
