/**
 * Application ports: engines, the contact store and metrics.
 * <p><strong>Role:</strong> Seams between use cases and infrastructure adapters chosen by the composition root.</p>
 * <p><strong>Concurrency:</strong> Implementations document thread-safety; engines own their worker pools.</p>
 */
package ca.gc.cra.qsolog.application.port;
