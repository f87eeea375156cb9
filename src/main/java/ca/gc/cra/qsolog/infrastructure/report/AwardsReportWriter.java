package ca.gc.cra.qsolog.infrastructure.report;

import ca.gc.cra.qsolog.domain.awards.AwardsSummary;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders an awards summary and its suggestions as a text table or a JSON document.
 * <p><strong>Role:</strong> Output adapter used by the {@code awards} command.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}, which is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class AwardsReportWriter {
  private static final String UNKNOWN_BAND_LABEL = "unknown";

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes the report to {@code out} in the requested format. The writer is flushed, not closed.
   *
   * @param summary awards summary; must not be {@code null}
   * @param suggestions suggestion lines; must not be {@code null}
   * @param format output format; must not be {@code null}
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(AwardsSummary summary, List<String> suggestions, ReportFormat format, Writer out)
      throws IOException {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(suggestions, "suggestions");
    Objects.requireNonNull(out, "out");
    switch (Objects.requireNonNull(format, "format")) {
      case JSON:
        writeJson(summary, suggestions, out);
        break;
      case TEXT:
      default:
        writeText(summary, suggestions, out);
        break;
    }
    out.flush();
  }

  private void writeText(AwardsSummary summary, List<String> suggestions, Writer out) throws IOException {
    out.write("Awards summary\n");
    row(out, "Total QSOs", summary.totalQsos());
    row(out, "Unique countries", summary.uniqueCountries());
    row(out, "Unique grids", summary.uniqueGrids());
    row(out, "Unique calls", summary.uniqueCalls());
    row(out, "Unique bands", summary.uniqueBands());
    row(out, "Unique modes", summary.uniqueModes());
    for (Map.Entry<String, Integer> entry : summary.gridsPerBand().entrySet()) {
      row(out, "Grids on " + bandLabel(entry.getKey()), entry.getValue());
    }
    out.write('\n');
    if (suggestions.isEmpty()) {
      out.write("No award suggestions yet; keep logging!\n");
      return;
    }
    out.write("Suggestions\n");
    for (String suggestion : suggestions) {
      out.write("- " + suggestion + "\n");
    }
  }

  private void writeJson(AwardsSummary summary, List<String> suggestions, Writer out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("total_qsos", summary.totalQsos());
      gen.writeNumberField("unique_countries", summary.uniqueCountries());
      gen.writeNumberField("unique_grids", summary.uniqueGrids());
      gen.writeNumberField("unique_calls", summary.uniqueCalls());
      gen.writeNumberField("unique_bands", summary.uniqueBands());
      gen.writeNumberField("unique_modes", summary.uniqueModes());
      gen.writeObjectFieldStart("grids_per_band");
      for (Map.Entry<String, Integer> entry : summary.gridsPerBand().entrySet()) {
        gen.writeNumberField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeArrayFieldStart("suggestions");
      for (String suggestion : suggestions) {
        gen.writeString(suggestion);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    out.write('\n');
  }

  private static void row(Writer out, String label, long value) throws IOException {
    out.write(String.format(Locale.ROOT, "  %-20s %8d\n", label, value));
  }

  private static String bandLabel(String band) {
    return band.isEmpty() ? UNKNOWN_BAND_LABEL : band;
  }
}
