/**
 * Command-line entry points: the {@code qsolog} dispatcher and its {@code import}, {@code export},
 * and {@code awards} commands.
 * <p>Commands return an {@link ca.gc.cra.qsolog.api.ExitCode}; only {@code main} methods exit the JVM.</p>
 */
package ca.gc.cra.qsolog.api;
