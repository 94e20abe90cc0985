package de.example.py2sqf;

import java.util.List;

/** Strict mode: at least one construct could not be translated, so no output is returned. */
public class TranslationFailedException extends RuntimeException {
  private final List<Diagnostic> diagnostics;

  public TranslationFailedException(List<Diagnostic> diagnostics) {
    super(diagnostics.size() + " unsupported construct(s), first: " + diagnostics.get(0));
    this.diagnostics = List.copyOf(diagnostics);
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }
}
