package ca.gc.cra.qsolog.domain.awards;

/**
 * Counts required to claim an award.
 *
 * @param dxcc unique countries required for DXCC; positive
 * @param vucc unique grids required for VUCC; positive
 * @since 0.1.0
 */
public record AwardThresholds(int dxcc, int vucc) {
  /** Threshold applied when none is configured. */
  public static final int DEFAULT_THRESHOLD = 100;

  /**
   * Validates thresholds.
   *
   * @throws IllegalArgumentException if a threshold is not positive
   */
  public AwardThresholds {
    if (dxcc <= 0) {
      throw new IllegalArgumentException("dxcc threshold must be positive (was " + dxcc + ")");
    }
    if (vucc <= 0) {
      throw new IllegalArgumentException("vucc threshold must be positive (was " + vucc + ")");
    }
  }

  /**
   * Returns the standard thresholds of 100 countries and 100 grids.
   *
   * @return default thresholds
   */
  public static AwardThresholds defaults() {
    return new AwardThresholds(DEFAULT_THRESHOLD, DEFAULT_THRESHOLD);
  }
}
