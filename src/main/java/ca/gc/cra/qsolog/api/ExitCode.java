package ca.gc.cra.qsolog.api;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code qsolog} commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or named an unusable path. */
  INVALID_ARGS(2),
  /** Reading the input, the store, or writing the output failed. */
  IO_ERROR(3),
  /** Merged configuration was rejected. */
  CONFIG_ERROR(4),
  /** Unexpected failure inside a use case. */
  RUNTIME_FAILURE(5),
  /** Run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
