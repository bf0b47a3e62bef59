/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mediametric.exception.MediaMetricException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.mediametric.exception.ConfigurationException} - Structural asset or
 *       runner misconfiguration; raised before any resource is touched</li>
 *   <li>{@link com.phillippitts.mediametric.exception.MissingDependencyException} - A required
 *       external tool (transcoder, mkfifo) is unavailable</li>
 *   <li>{@link com.phillippitts.mediametric.exception.ResourceTimeoutException} - A streaming stage's
 *       named pipe never appeared within the bounded poll</li>
 *   <li>{@link com.phillippitts.mediametric.exception.ExternalProcessException} - An external process
 *       failed, timed out or exited non-zero</li>
 *   <li>{@link com.phillippitts.mediametric.exception.ComputeException} and
 *       {@link com.phillippitts.mediametric.exception.ResultParseException} - Reported by
 *       computation plugins</li>
 * </ul>
 *
 * <p>Configuration and dependency errors abort a whole batch before scheduling. All other
 * exceptions abort only the asset whose pipeline raised them; nothing is retried internally.
 *
 * @since 1.0
 */
package com.phillippitts.mediametric.exception;
