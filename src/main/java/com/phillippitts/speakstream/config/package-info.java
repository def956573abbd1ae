/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration classes:
 * <ul>
 *   <li>{@link com.phillippitts.speakstream.config.ThreadPoolConfig} - shared pool behind every
 *       session's serial executor</li>
 *   <li>{@link com.phillippitts.speakstream.config.RecognizerConfig} - the single recognizer
 *       selected by {@code speakstream.recognizer.engine}</li>
 *   <li>{@link com.phillippitts.speakstream.config.WebSocketConfig} - streaming endpoint
 *       registration (server mode)</li>
 *   <li>{@link com.phillippitts.speakstream.config.ClientConfig} - console client wiring
 *       ({@code client} profile)</li>
 *   <li>{@link com.phillippitts.speakstream.config.BatchConfig} - file transcription wiring
 *       ({@code batch} profile)</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code speakstream.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.stt} - engine-specific properties for Vosk and whisper.cpp</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakstream.config;
