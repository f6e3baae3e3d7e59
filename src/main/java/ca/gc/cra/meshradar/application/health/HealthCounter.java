package ca.gc.cra.meshradar.application.health;

/**
 * Counters exposed on the health surface. Each one is mirrored into {@code MetricsPort} under its metric key.
 */
public enum HealthCounter {
  DECODE_FAILED("decode.envelope.failed"),
  PAYLOAD_FAILED("decode.payload.failed"),
  UNDECRYPTABLE("decode.undecryptable"),
  TOPIC_MISMATCH("decode.topic.mismatch"),
  DEDUP_NOOP("store.dedup.noop"),
  STORE_RETRY("store.write.retry"),
  STORE_DROPPED("store.write.dropped"),
  SUBSCRIBER_EVICTED("hub.subscriber.evicted"),
  PATH_ANOMALY("path.anomaly.conflict"),
  INGRESS_DROPPED("transport.ingress.dropped"),
  CONNECTION_LOST("transport.connection.lost"),
  WORKER_ERROR("pipeline.worker.error");

  private final String metricKey;

  HealthCounter(String metricKey) {
    this.metricKey = metricKey;
  }

  /**
   * Dotted metric name this counter is mirrored to.
   *
   * @return metric key
   */
  public String metricKey() {
    return metricKey;
  }
}
