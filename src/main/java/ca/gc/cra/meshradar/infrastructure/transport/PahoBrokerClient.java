package ca.gc.cra.meshradar.infrastructure.transport;

import ca.gc.cra.meshradar.domain.error.TransportException;
import ca.gc.cra.meshradar.validation.Net;
import ca.gc.cra.meshradar.validation.Strings;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link BrokerClient} over the Eclipse Paho MQTT v3 synchronous client.
 * <p><strong>Role:</strong> Infrastructure adapter; sessions are clean and in-memory, automatic reconnect is off.</p>
 * <p><strong>Thread-safety:</strong> Connect, subscribe and disconnect are called from the listener's connection
 * thread only. Callbacks arrive on Paho's callback thread.</p>
 *
 * @since 0.1.0
 */
public final class PahoBrokerClient implements BrokerClient {
  private static final Logger log = LoggerFactory.getLogger(PahoBrokerClient.class);
  private static final int QOS = 0;

  private final MqttClient client;
  private final MqttConnectOptions options;

  /**
   * Creates a client for one broker.
   *
   * @param settings broker endpoint and credentials
   * @throws TransportException if the broker URI is rejected by Paho
   */
  public PahoBrokerClient(Settings settings) throws TransportException {
    Objects.requireNonNull(settings, "settings");
    try {
      this.client = new MqttClient(settings.brokerUrl(), settings.clientId(), new MemoryPersistence());
    } catch (MqttException ex) {
      throw new TransportException("Cannot create MQTT client for " + settings.brokerUrl(), ex);
    }
    this.options = new MqttConnectOptions();
    options.setCleanSession(true);
    options.setAutomaticReconnect(false);
    options.setConnectionTimeout(settings.connectTimeoutSeconds());
    options.setKeepAliveInterval(settings.keepAliveSeconds());
    if (settings.username() != null) {
      options.setUserName(settings.username());
    }
    if (settings.password() != null) {
      options.setPassword(settings.password().toCharArray());
    }
  }

  @Override
  public void connect(Listener listener) throws TransportException {
    Objects.requireNonNull(listener, "listener");
    client.setCallback(new MqttCallback() {
      @Override
      public void connectionLost(Throwable cause) {
        listener.onConnectionLost(cause);
      }

      @Override
      public void messageArrived(String topic, MqttMessage message) {
        listener.onMessage(topic, message.getPayload());
      }

      @Override
      public void deliveryComplete(IMqttDeliveryToken token) {
        // subscribe-only client: nothing is published
      }
    });
    try {
      client.connect(options);
      log.info("Connected to MQTT broker {} as {}", client.getServerURI(), client.getClientId());
    } catch (MqttException ex) {
      throw new TransportException("MQTT connect to " + client.getServerURI() + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void subscribe(List<String> filters) throws TransportException {
    String[] topics = filters.toArray(new String[0]);
    int[] qos = new int[topics.length];
    Arrays.fill(qos, QOS);
    try {
      client.subscribe(topics, qos);
      log.info("Subscribed to {}", filters);
    } catch (MqttException ex) {
      throw new TransportException("MQTT subscribe to " + filters + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public boolean isConnected() {
    return client.isConnected();
  }

  @Override
  public void disconnect() throws TransportException {
    if (!client.isConnected()) {
      return;
    }
    try {
      client.disconnect();
    } catch (MqttException ex) {
      throw new TransportException("MQTT disconnect failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() throws TransportException {
    try {
      disconnect();
    } finally {
      try {
        client.close();
      } catch (MqttException ex) {
        throw new TransportException("MQTT client close failed: " + ex.getMessage(), ex);
      }
    }
  }

  /**
   * Broker endpoint and credentials.
   *
   * @param brokerUrl {@code tcp://}, {@code ssl://}, {@code ws://} or {@code wss://} URI
   * @param clientId MQTT client identifier
   * @param username user, or {@code null}
   * @param password password, or {@code null}
   * @param connectTimeoutSeconds connect timeout
   * @param keepAliveSeconds keep-alive interval
   */
  public record Settings(
      String brokerUrl,
      String clientId,
      String username,
      String password,
      int connectTimeoutSeconds,
      int keepAliveSeconds) {

    public Settings {
      brokerUrl = Net.validateBrokerUri(brokerUrl);
      clientId = Strings.requireNonBlank("clientId", clientId);
    }

    @Override
    public String toString() {
      return "Settings[brokerUrl=" + brokerUrl + ", clientId=" + clientId + ", username=" + username
          + ", password=" + (password == null ? "null" : "****") + "]";
    }
  }
}
