/**
 * Application use cases for the import, export, and awards commands.
 * <p><strong>Role:</strong> Coordinate engines, stores, and metrics ports; free of CLI and storage details.</p>
 * <p><strong>Concurrency:</strong> Each use case runs on the calling thread; engines own any worker pools.</p>
 * <p><strong>Metrics:</strong> {@code import.*}, {@code store.records.inserted}, {@code export.records}.</p>
 */
package ca.gc.cra.qsolog.application.pipeline;
