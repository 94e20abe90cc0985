package de.example.py2sqf;

/**
 * The tree violates a shape the Python parser always guarantees, so the translator's view of
 * its input is wrong. Translation stops.
 */
public class MalformedTreeException extends RuntimeException {
  public MalformedTreeException(String message) {
    super(message);
  }
}
