package ca.gc.cra.qsolog.domain.adif;

import ca.gc.cra.qsolog.domain.qso.Qso;
import java.util.function.Function;

/**
 * ADIF tags understood by the codec, declared in the order the encoder writes them.
 *
 * <p>{@link #QSO_DATE}, {@link #TIME_ON} and {@link #FREQ} need dedicated rendering and carry no plain
 * string accessor; every other constant maps one optional {@link Qso} string attribute.</p>
 *
 * @since 0.1.0
 */
public enum AdifField {
  QSO_DATE(null),
  TIME_ON(null),
  CALL(Qso::call),
  BAND(Qso::band),
  MODE(Qso::mode),
  FREQ(null),
  RST_SENT(Qso::rstSent),
  RST_RCVD(Qso::rstRcvd),
  NAME(Qso::name),
  QTH(Qso::qth),
  GRIDSQUARE(Qso::grid),
  COUNTRY(Qso::country),
  COMMENT(Qso::comment);

  private final Function<Qso, String> text;

  AdifField(Function<Qso, String> text) {
    this.text = text;
  }

  /**
   * Reads the plain string value of this field from a contact.
   *
   * @param qso contact to read
   * @return attribute value, or {@code null} when absent or when the field needs dedicated rendering
   */
  String text(Qso qso) {
    return text == null ? null : text.apply(qso);
  }
}
