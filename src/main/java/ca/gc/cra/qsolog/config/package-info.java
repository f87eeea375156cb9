/**
 * Configuration for the QSO log CLI: embedded defaults, YAML loading, CLI precedence, typed records,
 * and the composition root.
 * <p><strong>Precedence:</strong> CLI {@code key=value} &gt; YAML ({@code config=PATH}) &gt;
 * {@link ca.gc.cra.qsolog.config.DefaultsForMode}.</p>
 */
package ca.gc.cra.qsolog.config;
