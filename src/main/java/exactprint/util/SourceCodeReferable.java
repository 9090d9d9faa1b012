package exactprint.util;

/** Objects of this type refer to a region of the original source text. */
public interface SourceCodeReferable {

  /** Returns the {@link SourceRange} this object refers to in the original source text */
  SourceRange range();
}
