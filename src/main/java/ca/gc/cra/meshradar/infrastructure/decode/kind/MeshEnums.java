package ca.gc.cra.meshradar.infrastructure.decode.kind;

import java.util.Map;

/**
 * Display names for mesh enum values carried as plain varints.
 *
 * <p>Values introduced by newer firmware render as {@code UNKNOWN_<n>} instead of failing the decode.</p>
 */
final class MeshEnums {
  private static final Map<Integer, String> HARDWARE_MODELS = Map.ofEntries(
      Map.entry(0, "UNSET"),
      Map.entry(1, "TLORA_V2"),
      Map.entry(2, "TLORA_V1"),
      Map.entry(3, "TLORA_V2_1_1P6"),
      Map.entry(4, "TBEAM"),
      Map.entry(5, "HELTEC_V2_0"),
      Map.entry(6, "TBEAM_V0P7"),
      Map.entry(7, "T_ECHO"),
      Map.entry(8, "TLORA_V1_1P3"),
      Map.entry(9, "RAK4631"),
      Map.entry(10, "HELTEC_V2_1"),
      Map.entry(11, "HELTEC_V1"),
      Map.entry(12, "LILYGO_TBEAM_S3_CORE"),
      Map.entry(13, "RAK11200"),
      Map.entry(14, "NANO_G1"),
      Map.entry(15, "TLORA_V2_1_1P8"),
      Map.entry(16, "TLORA_T3_S3"),
      Map.entry(25, "STATION_G1"),
      Map.entry(26, "RAK11310"),
      Map.entry(31, "STATION_G2"),
      Map.entry(37, "PORTDUINO"),
      Map.entry(39, "DIY_V1"),
      Map.entry(42, "M5STACK"),
      Map.entry(43, "HELTEC_V3"),
      Map.entry(44, "HELTEC_WSL_V3"),
      Map.entry(47, "RPI_PICO"),
      Map.entry(48, "HELTEC_WIRELESS_TRACKER"),
      Map.entry(49, "HELTEC_WIRELESS_PAPER"),
      Map.entry(50, "T_DECK"),
      Map.entry(51, "T_WATCH_S3"),
      Map.entry(255, "PRIVATE_HW"));

  private static final Map<Integer, String> ROLES = Map.ofEntries(
      Map.entry(0, "CLIENT"),
      Map.entry(1, "CLIENT_MUTE"),
      Map.entry(2, "ROUTER"),
      Map.entry(3, "ROUTER_CLIENT"),
      Map.entry(4, "REPEATER"),
      Map.entry(5, "TRACKER"),
      Map.entry(6, "SENSOR"),
      Map.entry(7, "TAK"),
      Map.entry(8, "CLIENT_HIDDEN"),
      Map.entry(9, "LOST_AND_FOUND"),
      Map.entry(10, "TAK_TRACKER"),
      Map.entry(11, "ROUTER_LATE"));

  private MeshEnums() {}

  static String hardwareModel(int value) {
    return HARDWARE_MODELS.getOrDefault(value, unknown(value));
  }

  static String role(int value) {
    return ROLES.getOrDefault(value, unknown(value));
  }

  private static String unknown(int value) {
    return "UNKNOWN_" + value;
  }
}
