package ca.gc.cra.qsolog.domain.awards;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a summary into short, readable award progress notes.
 *
 * <p>An award is "close" once the count reaches 90% of its threshold, rounded down.</p>
 *
 * @since 0.1.0
 */
public final class AwardSuggestions {
  /** Distinct grids on one band that earn a per-band mention. */
  public static final int STRONG_BAND_GRIDS = 50;

  private AwardSuggestions() {}

  /**
   * Builds suggestions in a stable order: DXCC, VUCC, then bands sorted by name.
   *
   * @param summary awards summary; must not be {@code null}
   * @param thresholds award thresholds; must not be {@code null}
   * @return suggestions, possibly empty
   */
  public static List<String> suggest(AwardsSummary summary, AwardThresholds thresholds) {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(thresholds, "thresholds");
    List<String> out = new ArrayList<>();
    int countries = summary.uniqueCountries();
    if (countries >= thresholds.dxcc()) {
      out.add("DXCC achieved: " + countries + " unique countries");
    } else if (countries >= closeAt(thresholds.dxcc())) {
      out.add("DXCC close: " + countries + " countries (need " + (thresholds.dxcc() - countries) + " more)");
    }
    int grids = summary.uniqueGrids();
    if (grids >= thresholds.vucc()) {
      out.add("VUCC achieved: " + grids + " unique grids");
    } else if (grids >= closeAt(thresholds.vucc())) {
      out.add("VUCC close: " + grids + " grids (need " + (thresholds.vucc() - grids) + " more)");
    }
    for (Map.Entry<String, Integer> entry : summary.gridsPerBand().entrySet()) {
      if (entry.getValue() >= STRONG_BAND_GRIDS) {
        String band = entry.getKey().isEmpty() ? "unknown" : entry.getKey();
        out.add("Strong grid count on " + band + ": " + entry.getValue());
      }
    }
    return List.copyOf(out);
  }

  private static int closeAt(int threshold) {
    return (int) ((long) threshold * 9 / 10);
  }
}
