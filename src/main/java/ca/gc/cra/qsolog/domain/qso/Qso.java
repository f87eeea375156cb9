package ca.gc.cra.qsolog.domain.qso;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * <strong>What:</strong> One logged two-way radio contact.
 * <p><strong>Why:</strong> Gives the import, export, and awards stages a single immutable value to exchange.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@code RecordNormalizer} and consumed by
 * {@code AdifEncoder} and {@code AwardsAggregator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for sharing across worker threads.</p>
 * <p><strong>Performance:</strong> Holds references only; strings are blank-normalized once at construction.</p>
 *
 * @param call worked station callsign; never blank
 * @param startAt contact start in naive UTC, truncated to whole seconds; never {@code null}
 * @param band band label such as {@code 20m}; {@code null} when absent
 * @param mode mode label such as {@code SSB} or {@code FT8}; {@code null} when absent
 * @param freqMhz frequency in MHz; {@code null} when absent
 * @param rstSent signal report sent; {@code null} when absent
 * @param rstRcvd signal report received; {@code null} when absent
 * @param name operator name; {@code null} when absent
 * @param qth operator location; {@code null} when absent
 * @param grid Maidenhead grid square; {@code null} when absent
 * @param country DXCC country name; {@code null} when absent
 * @param comment free-form notes; {@code null} when absent
 * @since 0.1.0
 */
public record Qso(
    String call,
    LocalDateTime startAt,
    String band,
    String mode,
    Double freqMhz,
    String rstSent,
    String rstRcvd,
    String name,
    String qth,
    String grid,
    String country,
    String comment) {
  /** Earliest year expressible in an eight-digit {@code QSO_DATE}. */
  public static final int MIN_YEAR = 0;
  /** Latest year expressible in an eight-digit {@code QSO_DATE}. */
  public static final int MAX_YEAR = 9999;

  /**
   * Enforces the required fields and folds empty optional strings to {@code null}.
   *
   * @throws NullPointerException if {@code call} or {@code startAt} is {@code null}
   * @throws IllegalArgumentException if {@code call} is blank or the year is outside 0000-9999
   */
  public Qso {
    Objects.requireNonNull(call, "call");
    Objects.requireNonNull(startAt, "startAt");
    if (call.isBlank()) {
      throw new IllegalArgumentException("call must not be blank");
    }
    if (startAt.getYear() < MIN_YEAR || startAt.getYear() > MAX_YEAR) {
      throw new IllegalArgumentException("startAt year must be within 0000-9999 (was " + startAt.getYear() + ")");
    }
    startAt = startAt.truncatedTo(ChronoUnit.SECONDS);
    band = emptyToNull(band);
    mode = emptyToNull(mode);
    rstSent = emptyToNull(rstSent);
    rstRcvd = emptyToNull(rstRcvd);
    name = emptyToNull(name);
    qth = emptyToNull(qth);
    grid = emptyToNull(grid);
    country = emptyToNull(country);
    comment = emptyToNull(comment);
  }

  /**
   * Starts a builder seeded with the two required fields.
   *
   * @param call worked station callsign
   * @param startAt contact start time
   * @return builder for the optional fields
   */
  public static Builder builder(String call, LocalDateTime startAt) {
    return new Builder(call, startAt);
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  /**
   * Fluent builder for contacts with many optional attributes.
   * <p>Not thread-safe; build one contact per instance.</p>
   */
  public static final class Builder {
    private final String call;
    private final LocalDateTime startAt;
    private String band;
    private String mode;
    private Double freqMhz;
    private String rstSent;
    private String rstRcvd;
    private String name;
    private String qth;
    private String grid;
    private String country;
    private String comment;

    private Builder(String call, LocalDateTime startAt) {
      this.call = call;
      this.startAt = startAt;
    }

    public Builder band(String value) {
      this.band = value;
      return this;
    }

    public Builder mode(String value) {
      this.mode = value;
      return this;
    }

    public Builder freqMhz(Double value) {
      this.freqMhz = value;
      return this;
    }

    public Builder rstSent(String value) {
      this.rstSent = value;
      return this;
    }

    public Builder rstRcvd(String value) {
      this.rstRcvd = value;
      return this;
    }

    public Builder name(String value) {
      this.name = value;
      return this;
    }

    public Builder qth(String value) {
      this.qth = value;
      return this;
    }

    public Builder grid(String value) {
      this.grid = value;
      return this;
    }

    public Builder country(String value) {
      this.country = value;
      return this;
    }

    public Builder comment(String value) {
      this.comment = value;
      return this;
    }

    /**
     * Creates the immutable contact.
     *
     * @return contact carrying the configured values
     * @throws NullPointerException if a required field is missing
     * @throws IllegalArgumentException if the callsign is blank
     */
    public Qso build() {
      return new Qso(call, startAt, band, mode, freqMhz, rstSent, rstRcvd, name, qth, grid, country, comment);
    }
  }
}
