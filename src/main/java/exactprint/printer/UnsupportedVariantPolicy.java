package exactprint.printer;

/** What to do when a node has no renderer. */
public enum UnsupportedVariantPolicy {
  /** Abort the run with an {@link UnsupportedVariantError}. */
  FAIL,
  /** Print a marker naming the node kind and carry on. The output is not faithful. */
  PLACEHOLDER
}
