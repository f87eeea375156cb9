/**
 * Executor factories for engine worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring thread pools for import and awards fan-out.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Performance:</strong> Bounded queues and named threads keep overload visible in thread dumps.</p>
 */
package ca.gc.cra.qsolog.infrastructure.exec;
