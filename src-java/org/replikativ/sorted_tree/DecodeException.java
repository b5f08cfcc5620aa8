package org.replikativ.sorted_tree;

/**
 * Flattened input could not be turned back into a collection.
 */
public class DecodeException extends Exception {
  private final int _position;

  public DecodeException(int position, String message) {
    super(message + " (at element " + position + ")");
    _position = position;
  }

  public DecodeException(int position, String message, Throwable cause) {
    super(message + " (at element " + position + ")", cause);
    _position = position;
  }

  // Offset in the flattened stream where decoding stopped
  public int position() {
    return _position;
  }
}
