package ca.gc.cra.meshradar.infrastructure.decode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Slash-delimited topic pattern that locates the gateway and channel segments.
 * <p><strong>Why:</strong> Broker deployments nest the mesh topic tree under different prefixes; the position of the
 * gateway and channel segments is configuration, not code.</p>
 * <p><strong>Syntax:</strong> literal segments match exactly, {@code +} matches one segment, {@code #} matches one
 * or more segments and may appear once, {@code {gateway}} and {@code {channel}} capture one segment each and are
 * both required.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class TopicLayout {
  /** Default layout for the public mesh MQTT tree ({@code msh/US/CA/2/e/LongFast/!a1b2c3d4}). */
  public static final String DEFAULT_PATTERN = "msh/#/2/e/{channel}/{gateway}";

  static final String GATEWAY = "{gateway}";
  static final String CHANNEL = "{channel}";
  private static final String ONE = "+";
  private static final String MANY = "#";

  private final String pattern;
  private final List<String> tokens;
  private final int manyIndex;

  private TopicLayout(String pattern, List<String> tokens, int manyIndex) {
    this.pattern = pattern;
    this.tokens = tokens;
    this.manyIndex = manyIndex;
  }

  /**
   * Parses a layout pattern.
   *
   * @param pattern layout such as {@code msh/#/2/e/{channel}/{gateway}}
   * @return compiled layout
   * @throws IllegalArgumentException if the pattern is blank, has empty segments, repeats {@code #}, or lacks a
   *     gateway or channel capture
   */
  public static TopicLayout parse(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    String trimmed = pattern.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("topicLayout must not be blank");
    }
    List<String> tokens = List.of(trimmed.split("/", -1));
    int gateways = 0;
    int channels = 0;
    int manyIndex = -1;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (token.isEmpty()) {
        throw new IllegalArgumentException("topicLayout has an empty segment: " + pattern);
      }
      switch (token) {
        case GATEWAY -> gateways++;
        case CHANNEL -> channels++;
        case MANY -> {
          if (manyIndex >= 0) {
            throw new IllegalArgumentException("topicLayout may contain '#' only once: " + pattern);
          }
          manyIndex = i;
        }
        default -> {
          if (token.contains("{") || token.contains("}")) {
            throw new IllegalArgumentException("topicLayout has an unknown placeholder '" + token + "'");
          }
        }
      }
    }
    if (gateways != 1 || channels != 1) {
      throw new IllegalArgumentException(
          "topicLayout must contain {gateway} and {channel} exactly once: " + pattern);
    }
    return new TopicLayout(trimmed, tokens, manyIndex);
  }

  /**
   * Matches a concrete topic.
   *
   * @param topic broker topic
   * @return captured gateway and channel, or empty when the topic does not fit the layout
   */
  public Optional<TopicRoute> match(String topic) {
    if (topic == null || topic.isEmpty()) {
      return Optional.empty();
    }
    String[] segments = topic.split("/", -1);
    List<String> aligned = align(segments);
    if (aligned == null) {
      return Optional.empty();
    }
    String gateway = null;
    String channel = null;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      String segment = aligned.get(i);
      if (token.equals(MANY)) {
        continue;
      }
      if (segment.isEmpty()) {
        return Optional.empty();
      }
      switch (token) {
        case GATEWAY -> gateway = segment;
        case CHANNEL -> channel = segment;
        case ONE -> {
          // any single segment
        }
        default -> {
          if (!token.equals(segment)) {
            return Optional.empty();
          }
        }
      }
    }
    return Optional.of(new TopicRoute(gateway, channel));
  }

  /** Lines segments up with tokens; the {@code #} slot receives the joined middle run. */
  private List<String> align(String[] segments) {
    if (manyIndex < 0) {
      return segments.length == tokens.size() ? List.of(segments) : null;
    }
    int fixed = tokens.size() - 1;
    int run = segments.length - fixed;
    if (run < 1) {
      return null;
    }
    List<String> aligned = new ArrayList<>(tokens.size());
    for (int i = 0; i < manyIndex; i++) {
      aligned.add(segments[i]);
    }
    aligned.add(String.join("/", List.of(segments).subList(manyIndex, manyIndex + run)));
    for (int i = manyIndex + run; i < segments.length; i++) {
      aligned.add(segments[i]);
    }
    return aligned;
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public String toString() {
    return pattern;
  }
}
