package ca.gc.cra.qsolog.domain.awards;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Immutable awards statistics over a collection of contacts.
 * <p><strong>Why:</strong> Chunk-local summaries must combine without double counting a value seen in two chunks.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link AwardsAggregator} and folded by summary engines.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep the normalized unique values for countries, grids, calls, bands, and modes.</li>
 *   <li>Keep grid <em>sets</em> per band so merged per-band counts stay exact.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; every exposed collection is unmodifiable.</p>
 *
 * @implNote {@link #merge(AwardsSummary)} unions sets before counting, so it is associative and commutative
 *     with {@link #empty()} as identity.
 * @since 0.1.0
 */
public final class AwardsSummary {
  private static final AwardsSummary EMPTY =
      new AwardsSummary(0, Set.of(), Set.of(), Set.of(), Set.of(), Set.of(), Map.of());

  private final long totalQsos;
  private final Set<String> countries;
  private final Set<String> grids;
  private final Set<String> calls;
  private final Set<String> bands;
  private final Set<String> modes;
  private final Map<String, Set<String>> gridsByBand;

  AwardsSummary(
      long totalQsos,
      Set<String> countries,
      Set<String> grids,
      Set<String> calls,
      Set<String> bands,
      Set<String> modes,
      Map<String, Set<String>> gridsByBand) {
    if (totalQsos < 0) {
      throw new IllegalArgumentException("totalQsos must be >= 0");
    }
    this.totalQsos = totalQsos;
    this.countries = Set.copyOf(countries);
    this.grids = Set.copyOf(grids);
    this.calls = Set.copyOf(calls);
    this.bands = Set.copyOf(bands);
    this.modes = Set.copyOf(modes);
    Map<String, Set<String>> copy = new HashMap<>();
    gridsByBand.forEach((band, set) -> copy.put(band, Set.copyOf(set)));
    this.gridsByBand = Map.copyOf(copy);
  }

  /**
   * Returns the summary of an empty collection, the identity for {@link #merge(AwardsSummary)}.
   *
   * @return empty summary
   */
  public static AwardsSummary empty() {
    return EMPTY;
  }

  /**
   * Combines two summaries by set union; per-band grid sets are unioned before they are counted.
   *
   * @param other summary to combine with; must not be {@code null}
   * @return new summary equal to summarizing both underlying collections together
   */
  public AwardsSummary merge(AwardsSummary other) {
    Objects.requireNonNull(other, "other");
    // Every contact carries a call, so a zero total implies empty sets.
    if (other.totalQsos == 0) {
      return this;
    }
    if (totalQsos == 0) {
      return other;
    }
    Map<String, Set<String>> mergedByBand = new HashMap<>();
    gridsByBand.forEach((band, set) -> mergedByBand.put(band, new HashSet<>(set)));
    other.gridsByBand.forEach(
        (band, set) -> mergedByBand.computeIfAbsent(band, b -> new HashSet<>()).addAll(set));
    return new AwardsSummary(
        totalQsos + other.totalQsos,
        union(countries, other.countries),
        union(grids, other.grids),
        union(calls, other.calls),
        union(bands, other.bands),
        union(modes, other.modes),
        mergedByBand);
  }

  private static Set<String> union(Set<String> a, Set<String> b) {
    Set<String> out = new HashSet<>(a);
    out.addAll(b);
    return out;
  }

  public long totalQsos() {
    return totalQsos;
  }

  public Set<String> countries() {
    return countries;
  }

  public Set<String> grids() {
    return grids;
  }

  public Set<String> calls() {
    return calls;
  }

  public Set<String> bands() {
    return bands;
  }

  public Set<String> modes() {
    return modes;
  }

  public int uniqueCountries() {
    return countries.size();
  }

  public int uniqueGrids() {
    return grids.size();
  }

  public int uniqueCalls() {
    return calls.size();
  }

  public int uniqueBands() {
    return bands.size();
  }

  public int uniqueModes() {
    return modes.size();
  }

  /**
   * Returns the distinct grids worked on each band; contacts without a band are keyed by {@code ""}.
   *
   * @return unmodifiable band to grid-set map
   */
  public Map<String, Set<String>> gridsByBand() {
    return gridsByBand;
  }

  /**
   * Counts distinct grids per band, sorted by band.
   *
   * @return unmodifiable band to distinct-grid-count map
   */
  public Map<String, Integer> gridsPerBand() {
    Map<String, Integer> counts = new TreeMap<>();
    gridsByBand.forEach((band, set) -> counts.put(band, set.size()));
    return Collections.unmodifiableMap(counts);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AwardsSummary)) {
      return false;
    }
    AwardsSummary that = (AwardsSummary) o;
    return totalQsos == that.totalQsos
        && countries.equals(that.countries)
        && grids.equals(that.grids)
        && calls.equals(that.calls)
        && bands.equals(that.bands)
        && modes.equals(that.modes)
        && gridsByBand.equals(that.gridsByBand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(totalQsos, countries, grids, calls, bands, modes, gridsByBand);
  }

  @Override
  public String toString() {
    return "AwardsSummary{totalQsos=" + totalQsos
        + ", countries=" + countries.size()
        + ", grids=" + grids.size()
        + ", calls=" + calls.size()
        + ", bands=" + bands.size()
        + ", modes=" + modes.size()
        + ", gridsPerBand=" + gridsPerBand()
        + '}';
  }
}
