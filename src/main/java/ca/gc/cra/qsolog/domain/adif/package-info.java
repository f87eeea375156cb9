/**
 * ADIF codec: splitting, tag scanning, record normalization and streaming encoding.
 * <p><strong>Role:</strong> Pure domain functions composed by import engines, store adapters and the export use case.</p>
 * <p><strong>Concurrency:</strong> Stateless helpers; safe to call from import worker threads.</p>
 * <p><strong>Performance:</strong> Single forward pass per record; no fixed-size buffers.</p>
 */
package ca.gc.cra.qsolog.domain.adif;
