/**
 * PCM format constants and conversions shared by the server, the client recorder and the
 * batch transcriber.
 */
package com.phillippitts.speakstream.audio;
