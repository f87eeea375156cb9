/**
 * Input validation helpers shared by the CLI and configuration layers.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 */
package ca.gc.cra.qsolog.validation;
