package de.example.py2sqf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/** {@code py2sqf.*} settings from application.properties. */
@ConfigurationProperties(prefix = "py2sqf")
public record Py2SqfProperties(
    @DefaultValue Translation translation,
    @DefaultValue Api api,
    @DefaultValue Cors cors) {

  /** @param strict reject trees containing unsupported constructs instead of skipping them */
  public record Translation(@DefaultValue("false") boolean strict) {}

  /** @param maxInputLength largest accepted request body, in characters */
  public record Api(@DefaultValue("200000") int maxInputLength) {}

  public record Cors(
      @DefaultValue({"http://localhost:5173", "http://127.0.0.1:5173"}) List<String> allowedOriginPatterns) {}
}
