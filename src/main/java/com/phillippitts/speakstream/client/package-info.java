/**
 * Console client: captures microphone audio, streams it to the server and shows the
 * running transcript.
 */
package com.phillippitts.speakstream.client;
