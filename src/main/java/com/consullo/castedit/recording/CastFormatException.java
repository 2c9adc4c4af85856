package com.consullo.castedit.recording;

/**
 * Raised when a cast file cannot be loaded at all. Only the single load is aborted; existing sources and
 * timeline state are left untouched.
 *
 * @since 1.0
 */
public final class CastFormatException extends Exception {

  private static final long serialVersionUID = 1L;

  public CastFormatException(String message) {
    super(message);
  }

  public CastFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
