package ca.gc.cra.meshradar.api;

import ca.gc.cra.meshradar.config.ConfigMerger;
import ca.gc.cra.meshradar.config.DefaultsForMode;
import ca.gc.cra.meshradar.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps every command runs before building its config record: key/value parsing, the optional
 * {@code config=PATH} YAML file, and the CLI &gt; YAML &gt; defaults merge.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Outcome of resolving the effective configuration: either a merged map or the exit code to return.
   *
   * @param effective merged configuration when resolution succeeded
   * @param failure exit code when it did not
   */
  record Resolution(Optional<Map<String, String>> effective, Optional<ExitCode> failure) {
    static Resolution ok(Map<String, String> effective) {
      return new Resolution(Optional.of(effective), Optional.empty());
    }

    static Resolution failed(ExitCode code) {
      return new Resolution(Optional.empty(), Optional.of(code));
    }
  }

  /**
   * Parses key/value arguments, loads YAML for {@code mode} and merges both over the mode defaults.
   * Failures are logged and the usage line printed.
   *
   * @param mode CLI mode (ingest, top, graph)
   * @param input parsed arguments
   * @param usage one-line usage printed on invalid input
   * @param log logger of the calling command
   * @return merged map or the exit code to return
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    Objects.requireNonNull(input, "input");
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      return Resolution.ok(ConfigMerger.buildEffectiveConfig(mode, yamlConfig, kv, defaults, log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
