package ca.gc.cra.qsolog.domain.awards;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.testutil.AdifSamples;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AwardsSummaryTest {
  private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

  private static Qso qso(String call, String band, String grid) {
    return Qso.builder(call, START).band(band).grid(grid).country("C-" + call).build();
  }

  @Test
  void mergeUnionsPerBandGridsInsteadOfAdding() {
    AwardsSummary a = AwardsAggregator.summarize(List.of(qso("A", "20M", "FN42"), qso("B", "20M", "FN43")));
    AwardsSummary b = AwardsAggregator.summarize(List.of(qso("C", "20M", "FN42")));

    AwardsSummary merged = a.merge(b);

    assertEquals(Map.of("20M", 2), merged.gridsPerBand());
    assertEquals(2, merged.uniqueGrids());
    assertEquals(3, merged.totalQsos());
  }

  @Test
  void mergeOfChunksEqualsSummaryOfWhole() {
    List<Qso> all = AdifSamples.contacts(500);

    AwardsSummary whole = AwardsAggregator.summarize(all);
    AwardsSummary parts = AwardsAggregator.summarize(all.subList(0, 123))
        .merge(AwardsAggregator.summarize(all.subList(123, 400)))
        .merge(AwardsAggregator.summarize(all.subList(400, 500)));

    assertEquals(whole, parts);
  }

  @Test
  void mergeIsAssociativeAndCommutative() {
    List<Qso> all = AdifSamples.contacts(90);
    AwardsSummary a = AwardsAggregator.summarize(all.subList(0, 30));
    AwardsSummary b = AwardsAggregator.summarize(all.subList(20, 60));
    AwardsSummary c = AwardsAggregator.summarize(all.subList(50, 90));

    assertEquals(a.merge(b).merge(c), a.merge(b.merge(c)));
    assertEquals(a.merge(b), b.merge(a));
  }

  @Test
  void emptyIsIdentity() {
    AwardsSummary a = AwardsAggregator.summarize(AdifSamples.contacts(10));

    assertEquals(a, a.merge(AwardsSummary.empty()));
    assertEquals(a, AwardsSummary.empty().merge(a));
  }
}
