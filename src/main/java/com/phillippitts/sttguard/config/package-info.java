/**
 * Spring configuration for the data channel.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.sttguard.config.IntegrityConfig} - builds the shared,
 *       immutable {@link com.phillippitts.sttguard.service.policy.PolicyConfig}</li>
 *   <li>{@link com.phillippitts.sttguard.config.WebSocketConfig} - maps the WebSocket
 *       endpoint that carries framed audio</li>
 *   <li>{@link com.phillippitts.sttguard.config.properties.IntegrityProperties} - typed
 *       {@code stt.integrity.*} properties, validated at startup</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.sttguard.config;
