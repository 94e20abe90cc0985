package de.example.py2sqf;

/**
 * One construct the translator skipped.
 *
 * @param construct the construct, e.g. {@code "function call"} or a node kind
 * @param reason    what made it untranslatable
 */
public record Diagnostic(String construct, String reason) {

  @Override
  public String toString() {
    return "Unsupported " + construct + ": " + reason;
  }
}
