package exactprint.util;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A position relative to some cursor. With {@code line == 0} the target is on the cursor's line,
 * {@code column} columns further right. With {@code line > 0} the target is {@code line} lines
 * further down, indented by {@code column} columns from the start of that line.
 */
public class DeltaPos {

  public static final DeltaPos ZERO = new DeltaPos(0, 0);
  public final int line;
  public final int column;

  public DeltaPos(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public static DeltaPos sameLine(int columns) {
    return new DeltaPos(0, columns);
  }

  /** The absolute position this delta denotes when taken from {@code cursor}. */
  public SourcePosition applyTo(SourcePosition cursor) {
    if (line == 0) {
      return new SourcePosition(cursor.line, cursor.column + column);
    }
    return new SourcePosition(cursor.line + line, 1 + column);
  }

  /** The inverse of {@link #applyTo}: the delta leading from {@code from} to {@code to}. */
  public static DeltaPos between(SourcePosition from, SourcePosition to) {
    checkArgument(!to.isBefore(from), "%s lies before %s", to, from);
    if (from.line == to.line) {
      return new DeltaPos(0, to.column - from.column);
    }
    return new DeltaPos(to.line - from.line, to.column - 1);
  }

  @Override
  public String toString() {
    return "DP(" + line + "," + column + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    DeltaPos that = (DeltaPos) o;

    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }
}
