/**
 * Wire protocol of the streaming connection: JSON control and result messages.
 *
 * <p>Binary frames carry raw PCM16LE mono audio at the session's sample rate and are
 * concatenated, never delimited.
 */
package com.phillippitts.speakstream.protocol;
