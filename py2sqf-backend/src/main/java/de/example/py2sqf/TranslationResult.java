package de.example.py2sqf;

import java.util.List;

/** Formatted SQF plus everything that was left out of it. */
public record TranslationResult(String code, List<Diagnostic> diagnostics) {

  public TranslationResult {
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public boolean complete() {
    return diagnostics.isEmpty();
  }
}
