package de.example.py2sqf.api;

import de.example.py2sqf.Diagnostic;

import java.util.List;

public record ApiError(String error, String message, List<Diagnostic> diagnostics) {

  static ApiError of(String error, String message) {
    return new ApiError(error, message, List.of());
  }
}
