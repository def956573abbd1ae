/**
 * Offline transcription of audio files into per-file JSON results ({@code batch} profile).
 */
package com.phillippitts.speakstream.batch;
