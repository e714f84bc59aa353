package com.gentoro.capindex;

import com.gentoro.capindex.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line options in {@code --name value} form. */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("build", "query", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "help");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new ValidationException("Invalid mode: " + mode + " (expected one of " + MODES + ")");
    }
    String config = parameters.get("config-file");
    if (config == null || config.isBlank()) {
      throw new ValidationException("Missing config file location");
    }
    if ("build".equals(mode) && getOptional("elements").isEmpty()) {
      throw new ValidationException("--elements <file.yaml> is required in build mode");
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  /** Configuration location, e.g. "classpath:application.yaml" or "/etc/capindex.yaml". */
  public String configFile() {
    return parameters.get("config-file");
  }

  public Optional<String> getOptional(String name) {
    String v = parameters.get(name);
    return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
