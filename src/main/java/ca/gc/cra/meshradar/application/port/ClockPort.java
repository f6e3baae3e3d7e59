package ca.gc.cra.meshradar.application.port;

/**
 * Wall-clock source used to stamp receive and import times.
 *
 * <p>Tests inject fixed clocks to make windowed queries deterministic.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
