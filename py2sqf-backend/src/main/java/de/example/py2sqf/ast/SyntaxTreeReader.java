package de.example.py2sqf.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Reads the JSON form of a Python syntax tree ({@code _type} plus the {@code ast} field names).
 *
 * Position attributes, expression contexts and other fields the translator never looks at are
 * skipped. Floating point literals are kept as {@link java.math.BigDecimal} so their decimal
 * text survives unchanged.
 */
@Component
public class SyntaxTreeReader {

  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

  public PyNode read(String json) {
    if (json == null || json.isBlank()) {
      throw new SyntaxTreeFormatException("Empty syntax tree document", null);
    }
    try {
      PyNode node = mapper.readValue(json, PyNode.class);
      if (node == null) throw new SyntaxTreeFormatException("Syntax tree document is null", null);
      return node;
    } catch (JsonProcessingException e) {
      throw new SyntaxTreeFormatException("Invalid syntax tree: " + e.getOriginalMessage(), e);
    }
  }
}
