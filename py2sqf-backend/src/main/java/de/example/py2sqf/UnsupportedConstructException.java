package de.example.py2sqf;

/**
 * Raised while lowering a node that has no SQF form. Caught by the enclosing statement,
 * which then emits nothing and records the diagnostic.
 */
final class UnsupportedConstructException extends RuntimeException {
  private final Diagnostic diagnostic;

  UnsupportedConstructException(String construct, String reason) {
    super("Unsupported " + construct + ": " + reason);
    this.diagnostic = new Diagnostic(construct, reason);
  }

  Diagnostic diagnostic() {
    return diagnostic;
  }
}
