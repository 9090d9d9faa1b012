package exactprint.printer;

import static com.google.common.base.Preconditions.checkNotNull;

import exactprint.EnvVar;

/** Settings of a printing run. Instances are immutable. */
public class PrinterOptions {

  public static final PrinterOptions DEFAULT = new PrinterOptions(UnsupportedVariantPolicy.FAIL);

  public final UnsupportedVariantPolicy unsupportedVariantPolicy;

  private PrinterOptions(UnsupportedVariantPolicy unsupportedVariantPolicy) {
    this.unsupportedVariantPolicy = checkNotNull(unsupportedVariantPolicy);
  }

  public static PrinterOptions fromEnvironment() {
    if (EnvVar.EXACTPRINT_UNSUPPORTED.isSetToValue("placeholder")) {
      return DEFAULT.withUnsupportedVariantPolicy(UnsupportedVariantPolicy.PLACEHOLDER);
    }
    return DEFAULT;
  }

  public PrinterOptions withUnsupportedVariantPolicy(UnsupportedVariantPolicy policy) {
    return new PrinterOptions(policy);
  }

  @Override
  public String toString() {
    return "PrinterOptions{unsupportedVariantPolicy=" + unsupportedVariantPolicy + "}";
  }
}
