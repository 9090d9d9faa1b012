package exactprint.comment;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The comments still waiting to be printed, ascending by start. Only the head is ever consumed;
 * comments discovered later are merged in without disturbing the order.
 */
public class CommentQueue {

  private Deque<Comment> pending;

  public CommentQueue(Collection<Comment> comments) {
    List<Comment> sorted = ImmutableList.sortedCopyOf(comments);
    this.pending = new ArrayDeque<>(sorted);
  }

  public static CommentQueue empty() {
    return new CommentQueue(ImmutableList.of());
  }

  public Optional<Comment> peek() {
    return Optional.ofNullable(pending.peekFirst());
  }

  /** Drops the head of the queue, if any. */
  public void drop() {
    pending.pollFirst();
  }

  public boolean isEmpty() {
    return pending.isEmpty();
  }

  public int size() {
    return pending.size();
  }

  /**
   * Merges an already sorted batch into the queue. Where a newcomer and a queued comment start at
   * the same position the newcomer goes first.
   */
  public void merge(List<Comment> newcomers) {
    checkArgument(
        Comparators.isInOrder(newcomers, Comparator.naturalOrder()),
        "comments to merge are not sorted: %s",
        newcomers);
    if (newcomers.isEmpty()) {
      return;
    }
    Deque<Comment> merged = new ArrayDeque<>(pending.size() + newcomers.size());
    Iterator<Comment> news = newcomers.iterator();
    Comment next = news.next();
    while (next != null) {
      Comment queued = pending.peekFirst();
      if (queued == null || !queued.start().isBefore(next.start())) {
        merged.addLast(next);
        next = news.hasNext() ? news.next() : null;
      } else {
        merged.addLast(pending.pollFirst());
      }
    }
    merged.addAll(pending);
    pending = merged;
  }

  public List<Comment> toList() {
    return ImmutableList.copyOf(pending);
  }

  @Override
  public String toString() {
    return pending.toString();
  }
}
