/**
 * Immutable value types shared by server, client and batch modes.
 */
package com.phillippitts.speakstream.domain;
