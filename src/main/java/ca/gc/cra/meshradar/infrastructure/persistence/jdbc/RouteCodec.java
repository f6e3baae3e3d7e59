package ca.gc.cra.meshradar.infrastructure.persistence.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Comma-separated column encoding for traceroute hop and SNR lists. */
final class RouteCodec {
  private RouteCodec() {}

  static String encodeNodes(List<Long> nodes) {
    return nodes.stream().map(String::valueOf).collect(Collectors.joining(","));
  }

  static String encodeSnr(List<Double> snr) {
    return snr.stream().map(String::valueOf).collect(Collectors.joining(","));
  }

  static List<Long> decodeNodes(String column) {
    List<Long> nodes = new ArrayList<>();
    for (String part : split(column)) {
      nodes.add(Long.parseLong(part));
    }
    return nodes;
  }

  // Double.parseDouble accepts the "NaN" written for unknown SNR
  static List<Double> decodeSnr(String column) {
    List<Double> snr = new ArrayList<>();
    for (String part : split(column)) {
      snr.add(Double.parseDouble(part));
    }
    return snr;
  }

  private static String[] split(String column) {
    return column == null || column.isEmpty() ? new String[0] : column.split(",");
  }
}
