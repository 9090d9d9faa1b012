package exactprint.comment;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.DeltaPos;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;

/** A floated comment whose start and end are both stored relative to the owning node. */
public class DeltaComment implements AttachedComment {

  public final boolean isBlock;
  public final DeltaPos start;
  public final DeltaPos end;
  public final String text;

  public DeltaComment(boolean isBlock, DeltaPos start, DeltaPos end, String text) {
    this.isBlock = isBlock;
    this.start = checkNotNull(start);
    this.end = checkNotNull(end);
    this.text = checkNotNull(text);
  }

  @Override
  public Comment resolve(SourcePosition cursor) {
    return new Comment(isBlock, new SourceRange(start.applyTo(cursor), end.applyTo(cursor)), text);
  }

  @Override
  public String toString() {
    return start + "-" + end + " " + text;
  }
}
