package exactprint.annotation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import exactprint.comment.AttachedComment;
import java.util.List;

/** One annotation record of a node: token positions plus the comments floated onto the node. */
public class Annotation {

  public final List<AttachedComment> comments;
  public final AnnotationPayload payload;

  public Annotation(List<? extends AttachedComment> comments, AnnotationPayload payload) {
    this.comments = ImmutableList.copyOf(comments);
    this.payload = checkNotNull(payload);
  }

  public Annotation(AnnotationPayload payload) {
    this(ImmutableList.of(), payload);
  }

  public Annotation withoutComments() {
    return comments.isEmpty() ? this : new Annotation(payload);
  }

  @Override
  public String toString() {
    return comments.isEmpty() ? payload.toString() : payload + " " + comments;
  }
}
