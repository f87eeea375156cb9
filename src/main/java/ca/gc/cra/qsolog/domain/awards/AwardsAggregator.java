package ca.gc.cra.qsolog.domain.awards;

import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.domain.qso.QsoValues;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Serial awards computation over a contact collection.
 *
 * <p>Every value passes through {@link QsoValues#norm(String)}; blank values are excluded from all sets.
 * A contact without a band contributes its grid under the {@code ""} band key.</p>
 *
 * @since 0.1.0
 */
public final class AwardsAggregator {
  /** Band key used for grids worked on contacts that carry no band. */
  public static final String UNKNOWN_BAND = "";

  private AwardsAggregator() {}

  /**
   * Summarizes the given contacts in one pass.
   *
   * @param qsos contacts to summarize; must not be {@code null}
   * @return immutable summary
   */
  public static AwardsSummary summarize(Iterable<Qso> qsos) {
    Objects.requireNonNull(qsos, "qsos");
    long total = 0;
    Set<String> countries = new HashSet<>();
    Set<String> grids = new HashSet<>();
    Set<String> calls = new HashSet<>();
    Set<String> bands = new HashSet<>();
    Set<String> modes = new HashSet<>();
    Map<String, Set<String>> gridsByBand = new HashMap<>();
    for (Qso qso : qsos) {
      total++;
      QsoValues.norm(qso.country()).ifPresent(countries::add);
      QsoValues.norm(qso.call()).ifPresent(calls::add);
      QsoValues.norm(qso.mode()).ifPresent(modes::add);
      String band = QsoValues.norm(qso.band()).orElse(UNKNOWN_BAND);
      if (!band.isEmpty()) {
        bands.add(band);
      }
      QsoValues.norm(qso.grid()).ifPresent(grid -> {
        grids.add(grid);
        gridsByBand.computeIfAbsent(band, b -> new HashSet<>()).add(grid);
      });
    }
    if (total == 0) {
      return AwardsSummary.empty();
    }
    return new AwardsSummary(total, countries, grids, calls, bands, modes, gridsByBand);
  }
}
