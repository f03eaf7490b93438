/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.sttguard.exception.SttGuardException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.sttguard.exception.FrameDecodeException} - Thrown when a
 *       data-channel message is truncated, carries malformed metadata, or has a payload
 *       that is not a whole number of 16-bit samples</li>
 * </ul>
 *
 * <p>Integrity verification failures are deliberately absent from this hierarchy: a
 * checksum or length mismatch is an expected outcome and travels as a
 * {@link com.phillippitts.sttguard.service.integrity.VerificationVerdict}.
 *
 * @since 1.0
 */
package com.phillippitts.sttguard.exception;
