package exactprint.printer;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Strings;
import exactprint.annotation.AnnotationTable;
import exactprint.annotation.Annotations;
import exactprint.comment.AttachedComment;
import exactprint.comment.Comment;
import exactprint.comment.CommentQueue;
import exactprint.util.DeltaPos;
import exactprint.util.SourcePosition;
import exactprint.util.SourceRange;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one printing run: the cursor, the offset applied to absolute node positions, the queue of
 * comments not printed yet, the annotation table and the output written so far.
 *
 * <p>Text only ever moves the cursor forward. Every operation that positions text pads with spaces
 * and newlines from the cursor to its target, printing pending comments that start before the
 * target on the way, and fails with a {@link NonMonotonicPositionError} if the target lies behind
 * the cursor.
 *
 * <p>Instances are not thread safe and belong to exactly one run.
 */
public class PrintContext {

  private static final Logger LOGGER = LoggerFactory.getLogger("PrintContext");

  private SourcePosition cursor = SourcePosition.BEGIN_OF_FILE;
  private DeltaPos offset = DeltaPos.ZERO;
  private final CommentQueue comments;
  private final AnnotationTable annotations;
  private final StringBuilder output = new StringBuilder();

  public PrintContext(List<Comment> comments, AnnotationTable annotations) {
    this.comments = new CommentQueue(comments);
    this.annotations = annotations.copy();
  }

  public SourcePosition getPos() {
    return cursor;
  }

  public void setPos(SourcePosition position) {
    cursor = checkNotNull(position);
  }

  public DeltaPos getOffset() {
    return offset;
  }

  public void setOffset(DeltaPos offset) {
    this.offset = checkNotNull(offset);
  }

  /** Writes {@code text} verbatim and moves the cursor right by its length. */
  public void printString(String text) {
    output.append(text);
    cursor = cursor.moveHorizontal(text.length());
  }

  public void newLine() {
    output.append('\n');
    cursor = cursor.nextLine();
  }

  /** Pads with newlines and spaces up to {@code target}. */
  public void padUntil(SourcePosition target) {
    if (target.isBefore(cursor)) {
      throw new NonMonotonicPositionError(cursor, target);
    }
    while (cursor.line < target.line) {
      newLine();
    }
    printString(Strings.repeat(" ", target.column - cursor.column));
  }

  /** Prints, in order, every pending comment starting before {@code limit}. */
  public void printComments(SourcePosition limit) {
    Optional<Comment> next = comments.peek();
    while (next.isPresent() && next.get().start().isBefore(limit)) {
      Comment comment = next.get();
      comments.drop();
      LOGGER.debug("comment {} before {}", comment, limit);
      padUntil(comment.start());
      printString(comment.text);
      setPos(comment.range.end);
      next = comments.peek();
    }
  }

  /** Prints every comment still pending. */
  public void printRemainingComments() {
    if (!comments.isEmpty()) {
      LOGGER.debug("{} comments after the last token", comments.size());
    }
    while (!comments.isEmpty()) {
      printComments(comments.peek().get().start().moveHorizontal(1));
    }
  }

  /**
   * Resolves comments floated onto the node at the cursor and queues them for printing. The batch
   * may gather comments from several records, so it is sorted by start first.
   */
  public void mergeComments(List<AttachedComment> floated) {
    if (floated.isEmpty()) {
      return;
    }
    List<Comment> resolved = seq(floated).map(c -> c.resolve(cursor)).sorted().toList();
    LOGGER.debug("merging {} at {}", resolved, cursor);
    comments.merge(resolved);
  }

  /** Moves to an absolute position of the tree, shifted by the current offset. */
  public void printWhitespace(SourcePosition position) {
    advanceTo(position.shift(offset));
  }

  /** Moves to an already resolved position: pending comments before it first, then padding. */
  void advanceTo(SourcePosition target) {
    printComments(target);
    padUntil(target);
  }

  public void printStringAt(SourcePosition position, String text) {
    printWhitespace(position);
    printString(text);
  }

  public void printStringAtDelta(DeltaPos delta, String text) {
    advanceTo(delta.applyTo(cursor));
    printString(text);
  }

  public void printStringAtMaybeDelta(Optional<DeltaPos> delta, String text) {
    delta.ifPresent(d -> printStringAtDelta(d, text));
  }

  /** Like {@link #printStringAtMaybeDelta}, but the delta is taken from {@code anchor}. */
  public void printStringAtMaybeDeltaP(
      SourcePosition anchor, Optional<DeltaPos> delta, String text) {
    delta.ifPresent(d -> printStringAtDeltaP(anchor, d, text));
  }

  public void printStringAtDeltaP(SourcePosition anchor, DeltaPos delta, String text) {
    advanceTo(delta.applyTo(anchor));
    printString(text);
  }

  public Annotations lookupAnnotation(SourceRange span) {
    return annotations.lookup(span);
  }

  public void storeAnnotation(SourceRange span, Annotations anns) {
    annotations.store(span, anns);
  }

  public boolean hasPendingComments() {
    return !comments.isEmpty();
  }

  public String output() {
    return output.toString();
  }
}
