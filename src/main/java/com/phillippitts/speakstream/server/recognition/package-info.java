/**
 * Speech recognition behind the streaming server and the batch runner.
 *
 * <p>Architecture:
 * <ul>
 *   <li>{@link com.phillippitts.speakstream.server.recognition.SpeechRecognizer} - one shared,
 *       non-reentrant engine loaded at startup</li>
 *   <li>{@link com.phillippitts.speakstream.server.recognition.RecognizerGuard} - serializes
 *       calls across sessions</li>
 *   <li>{@link com.phillippitts.speakstream.server.recognition.RecognitionDispatcher} - converts
 *       PCM chunks, invokes the engine and maps its output to results</li>
 * </ul>
 *
 * <p>Engines: {@code vosk} (in-process JNI) and {@code whisper} (whisper.cpp subprocess).
 *
 * @since 1.0
 */
package com.phillippitts.speakstream.server.recognition;
