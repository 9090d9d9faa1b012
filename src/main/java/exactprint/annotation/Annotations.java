package exactprint.annotation;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import exactprint.comment.AttachedComment;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * All annotation records stored for one span. {@link #NONE} stands for a span without an entry in
 * the table. Instances are immutable.
 */
public class Annotations {

  public static final Annotations NONE = new Annotations(ImmutableList.of());

  private final ImmutableList<Annotation> records;

  public Annotations(List<Annotation> records) {
    this.records = ImmutableList.copyOf(records);
  }

  public static Annotations of(Annotation... records) {
    return new Annotations(Arrays.asList(records));
  }

  public static Annotations of(AnnotationPayload... payloads) {
    return new Annotations(seq(Arrays.asList(payloads)).map(Annotation::new).toList());
  }

  public boolean isPresent() {
    return !records.isEmpty();
  }

  public List<Annotation> records() {
    return records;
  }

  /** The comments floated onto the span, over all records. */
  public List<AttachedComment> comments() {
    return seq(records).flatMap(a -> seq(a.comments)).toList();
  }

  public Annotations withoutComments() {
    return new Annotations(seq(records).map(Annotation::withoutComments).toList());
  }

  /** Every payload of the given kind. */
  public <P extends AnnotationPayload> List<P> payloads(Class<P> kind) {
    return seq(records).map(a -> a.payload).ofType(kind).toList();
  }

  public <P extends AnnotationPayload> Optional<P> find(Class<P> kind) {
    return payloads(kind).stream().findFirst();
  }

  @Override
  public String toString() {
    return records.toString();
  }
}
