package exactprint;

import java.util.ArrayList;

public enum EnvVar {
  EXACTPRINT_UNSUPPORTED(
      "Set to \"placeholder\" to print a marker instead of failing on unsupported syntax.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public boolean isSetToValue(String varValue) {
    String value = getValue();
    return value != null && value.equalsIgnoreCase(varValue);
  }

  private String getValue() {
    return System.getenv(this.name());
  }

  public static String[] getAllEnvVarDescriptions() {
    ArrayList<String> descriptions = new ArrayList<>();
    for (EnvVar envVariable : EnvVar.values()) {
      descriptions.add(envVariable.name() + ": " + envVariable.description);
    }
    return descriptions.toArray(new String[0]);
  }
}
