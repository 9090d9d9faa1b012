package exactprint.annotation;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.util.SourceRange;
import java.util.HashMap;
import java.util.Map;

/**
 * Side table from the span of a syntax node to the annotations describing it. Printing rewrites
 * entries while it strips consumed comments, so each printing run works on its own {@link #copy()}.
 */
public class AnnotationTable {

  private final Map<SourceRange, Annotations> entries;

  public AnnotationTable() {
    this.entries = new HashMap<>();
  }

  private AnnotationTable(Map<SourceRange, Annotations> entries) {
    this.entries = new HashMap<>(entries);
  }

  /** Returns {@link Annotations#NONE} if the span has no entry. */
  public Annotations lookup(SourceRange span) {
    return entries.getOrDefault(span, Annotations.NONE);
  }

  public AnnotationTable store(SourceRange span, Annotations annotations) {
    entries.put(checkNotNull(span), checkNotNull(annotations));
    return this;
  }

  public AnnotationTable store(SourceRange span, AnnotationPayload... payloads) {
    return store(span, Annotations.of(payloads));
  }

  public AnnotationTable store(SourceRange span, Annotation... records) {
    return store(span, Annotations.of(records));
  }

  public boolean contains(SourceRange span) {
    return entries.containsKey(span);
  }

  public int size() {
    return entries.size();
  }

  public AnnotationTable copy() {
    return new AnnotationTable(entries);
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
