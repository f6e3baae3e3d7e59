package ca.gc.cra.meshradar.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostnameAndIpv4() {
    assertEquals("kafka-1.example.com:9092", Net.validateHostPort("kafka-1.example.com:9092"));
    assertEquals("10.0.0.1:9092", Net.validateHostPort("10.0.0.1:9092"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[2001:db8::1]:9092", Net.validateHostPort("[2001:db8::1]:9092"));
  }

  @Test
  void validateHostPortRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1:80"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("-bad.host:80"));
  }

  @Test
  void hostPortListIsNormalized() {
    assertEquals("a:1,b:2", Net.validateHostPortList(" a:1 , b:2 "));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPortList("a:1,b"));
  }

  @Test
  void brokerUriAcceptsMqttSchemes() {
    assertEquals("tcp://mqtt.meshtastic.org:1883", Net.validateBrokerUri("TCP://mqtt.meshtastic.org:1883"));
    assertEquals("ssl://broker.local:8883", Net.validateBrokerUri("ssl://broker.local:8883"));
    assertEquals("wss://broker.local/mqtt", Net.validateBrokerUri("wss://broker.local/mqtt"));
  }

  @Test
  void brokerUriRejectsOtherSchemesAndMissingHost() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateBrokerUri("http://broker.local:1883"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBrokerUri("tcp:///nohost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBrokerUri("broker.local:1883"));
  }
}
