/**
 * Contact store adapters: an in-memory store and an ADIF log file.
 * <p><strong>Role:</strong> Implementations of {@link ca.gc.cra.qsolog.application.port.QsoStorePort}.</p>
 */
package ca.gc.cra.qsolog.infrastructure.persistence;
