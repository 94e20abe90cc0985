package de.example.py2sqf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Per-translation state. Never shared between calls. */
final class TranslationContext {
  private static final Logger log = LoggerFactory.getLogger(TranslationContext.class);

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  void report(UnsupportedConstructException e) {
    report(e.diagnostic());
  }

  void report(Diagnostic d) {
    log.warn("{}", d);
    diagnostics.add(d);
  }

  List<Diagnostic> diagnostics() {
    return List.copyOf(diagnostics);
  }
}
