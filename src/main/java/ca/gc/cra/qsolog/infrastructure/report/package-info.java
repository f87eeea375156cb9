/**
 * Awards report rendering (text table and Jackson-streamed JSON).
 */
package ca.gc.cra.qsolog.infrastructure.report;
