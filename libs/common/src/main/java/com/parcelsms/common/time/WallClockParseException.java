/*
 * Where: Common time abstraction
 * What: Signals an instant string that cannot be parsed
 * Why: Malformed stored instants are isolated to the record that carries them
 */
package com.parcelsms.common.time;

public class WallClockParseException extends RuntimeException {

  public WallClockParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
