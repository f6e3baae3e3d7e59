package ca.gc.cra.meshradar.adapter.kafka;

import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.application.port.MessageSource;
import ca.gc.cra.meshradar.application.port.MetricsPort;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import ca.gc.cra.meshradar.validation.Net;
import ca.gc.cra.meshradar.validation.Strings;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageSource} reading an MQTT-to-Kafka bridge topic.
 * <p><strong>Why:</strong> Lets deployments that already mirror the broker into Kafka ingest without a second MQTT
 * session.</p>
 * <p><strong>Role:</strong> Infrastructure adapter; the record key is the original MQTT topic and the value is the
 * envelope bytes.</p>
 * <p><strong>Thread-safety:</strong> Consumer access is serialized, so several decode workers may poll.</p>
 * <p><strong>Observability:</strong> Keyless records are counted as {@code transport.kafka.keyless} and skipped.</p>
 *
 * @since 0.1.0
 */
public final class KafkaBridgeMessageSource implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaBridgeMessageSource.class);
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

  private final Consumer<String, byte[]> consumer;
  private final String topic;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Deque<RawMessage> buffered = new ArrayDeque<>();
  private boolean closed;

  /**
   * Creates a source with a fresh consumer group.
   *
   * @param bootstrapServers comma-separated {@code host:port} list
   * @param topic bridge topic
   * @param groupId consumer group
   * @param clock receive-time source
   * @param metrics metrics sink
   */
  public KafkaBridgeMessageSource(
      String bootstrapServers, String topic, String groupId, ClockPort clock, MetricsPort metrics) {
    this(createConsumer(bootstrapServers, groupId), topic, clock, metrics);
  }

  KafkaBridgeMessageSource(Consumer<String, byte[]> consumer, String topic, ClockPort clock, MetricsPort metrics) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.topic = Strings.sanitizeKafkaTopic("kafkaTopic", topic);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public synchronized void start() {
    consumer.subscribe(List.of(topic));
    log.info("Consuming bridge topic {}", topic);
  }

  @Override
  public Optional<RawMessage> poll() throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException("poll interrupted");
    }
    synchronized (this) {
      if (closed) {
        return Optional.empty();
      }
      if (buffered.isEmpty()) {
        fetch();
      }
      return Optional.ofNullable(buffered.pollFirst());
    }
  }

  private void fetch() {
    long now = clock.nowMillis();
    for (ConsumerRecord<String, byte[]> record : consumer.poll(POLL_TIMEOUT)) {
      if (record.key() == null || record.key().isBlank()) {
        metrics.increment("transport.kafka.keyless");
        log.debug("Skipping keyless record at {}-{}@{}", record.topic(), record.partition(), record.offset());
        continue;
      }
      buffered.addLast(new RawMessage(record.key(), record.value(), now));
    }
    if (!buffered.isEmpty()) {
      metrics.observe("transport.kafka.batch", buffered.size());
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    consumer.close(Duration.ofSeconds(5));
  }

  private static Consumer<String, byte[]> createConsumer(String bootstrapServers, String groupId) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, Net.validateHostPortList(bootstrapServers));
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, Strings.requireNonBlank("kafkaGroupId", groupId));
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 500);
    return new KafkaConsumer<>(props);
  }
}
