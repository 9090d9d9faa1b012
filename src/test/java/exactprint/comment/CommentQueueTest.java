package exactprint.comment;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import exactprint.util.SourceRange;
import org.junit.Test;

public class CommentQueueTest {

  private static Comment at(int line, int column, String text) {
    return Comment.line(SourceRange.of(line, column, line, column + text.length()), text);
  }

  @Test
  public void construction_sortsByStart() {
    Comment a = at(1, 5, "-- a");
    Comment b = at(2, 1, "-- b");
    Comment c = at(4, 3, "-- c");
    CommentQueue queue = new CommentQueue(ImmutableList.of(c, a, b));
    assertThat(queue.toList(), contains(a, b, c));
    assertThat(queue.peek().get(), is(equalTo(a)));
  }

  @Test
  public void drop_removesHead() {
    Comment a = at(1, 5, "-- a");
    Comment b = at(2, 1, "-- b");
    CommentQueue queue = new CommentQueue(ImmutableList.of(a, b));
    queue.drop();
    assertThat(queue.toList(), contains(b));
    queue.drop();
    assertThat(queue.isEmpty(), is(true));
    assertThat(queue.peek().isPresent(), is(false));
    queue.drop();
    assertThat(queue.size(), is(0));
  }

  @Test
  public void merge_interleavesByStart() {
    Comment a = at(1, 5, "-- a");
    Comment c = at(4, 3, "-- c");
    Comment b = at(2, 1, "-- b");
    Comment d = at(7, 1, "-- d");
    CommentQueue queue = new CommentQueue(ImmutableList.of(a, c));
    queue.merge(ImmutableList.of(b, d));
    assertThat(queue.toList(), contains(a, b, c, d));
  }

  @Test
  public void merge_newcomerGoesFirstOnTiedStart() {
    Comment queued = at(3, 1, "-- queued");
    Comment newcomer = at(3, 1, "{- new -}");
    CommentQueue queue = new CommentQueue(ImmutableList.of(queued));
    queue.merge(ImmutableList.of(newcomer));
    assertThat(queue.toList(), contains(newcomer, queued));
  }

  @Test
  public void merge_intoEmptyQueue() {
    Comment a = at(1, 5, "-- a");
    CommentQueue queue = CommentQueue.empty();
    queue.merge(ImmutableList.of(a));
    assertThat(queue.toList(), contains(a));
  }

  @Test(expected = IllegalArgumentException.class)
  public void merge_rejectsUnsortedBatch() {
    CommentQueue.empty().merge(ImmutableList.of(at(5, 1, "-- x"), at(1, 1, "-- y")));
  }
}
