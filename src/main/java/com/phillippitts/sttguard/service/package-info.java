/**
 * Service layer for the audio data channel.
 *
 * <p>Sub-packages, leaf first:
 * <ul>
 *   <li>{@code protocol} - length-prefixed frame codec</li>
 *   <li>{@code integrity} - sample-sum checksum and verification verdicts</li>
 *   <li>{@code policy} - immutable integrity policy shared by all connections</li>
 *   <li>{@code connection} - per-connection failure tracking and the
 *       {@link com.phillippitts.sttguard.service.connection.AudioDataService} that ties the
 *       pieces together</li>
 *   <li>{@code pipeline} - seam to the speech-recognition pipeline</li>
 *   <li>{@code events}, {@code metrics} - operator-facing logging and Micrometer counters</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.sttguard.service;
