package de.example.py2sqf.api;

import de.example.py2sqf.Diagnostic;
import de.example.py2sqf.TranslationResult;

import java.util.List;

/** JSON body of a translation: the SQF code and the constructs left out of it. */
public record TranslateResponse(String code, boolean complete, List<Diagnostic> diagnostics) {

  static TranslateResponse of(TranslationResult r) {
    return new TranslateResponse(r.code(), r.complete(), r.diagnostics());
  }
}
