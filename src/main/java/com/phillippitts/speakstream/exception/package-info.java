/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.speakstream.exception.SpeakStreamException}:
 * <ul>
 *   <li>{@link com.phillippitts.speakstream.exception.ProtocolException} - malformed control
 *       message; logged and skipped, the session continues</li>
 *   <li>{@link com.phillippitts.speakstream.exception.RecognizerException} - recognizer call
 *       failed; surfaced to the client as a result with {@code error} set</li>
 *   <li>{@link com.phillippitts.speakstream.exception.ConnectionException} - transport closed or
 *       broken; terminates that session only</li>
 *   <li>{@link com.phillippitts.speakstream.exception.ConfigurationException} - fatal at startup,
 *       process exits non-zero (subtype
 *       {@link com.phillippitts.speakstream.exception.ModelNotFoundException})</li>
 *   <li>{@link com.phillippitts.speakstream.exception.InvalidAudioException} - audio file could
 *       not be decoded in batch mode</li>
 * </ul>
 */
package com.phillippitts.speakstream.exception;
