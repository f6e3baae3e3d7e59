package ca.gc.cra.meshradar.api;

/**
 * Process exit codes returned by every meshradar command.
 *
 * <p>Scripts and supervisors rely on these values; do not renumber them.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure while reading configuration or talking to the store. */
  IO_ERROR(3),
  /** Configuration was rejected after merging. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
