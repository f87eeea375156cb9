/**
 * Serial and executor-backed implementations of the import and summary engines.
 * <p><strong>Role:</strong> Infrastructure adapters for {@link ca.gc.cra.qsolog.application.port.ImportEngine} and
 * {@link ca.gc.cra.qsolog.application.port.SummaryEngine}, chosen by the {@code engine} setting.</p>
 * <p><strong>Concurrency:</strong> Tasks are pure functions over immutable spans or slices; fan-in is the only
 * synchronization point.</p>
 * <p><strong>Metrics:</strong> {@code import.fallback.serial}, {@code awards.chunks}, {@code awards.fallback.serial}.</p>
 */
package ca.gc.cra.qsolog.infrastructure.engine;
