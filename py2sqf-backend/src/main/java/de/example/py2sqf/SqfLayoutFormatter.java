package de.example.py2sqf;

import org.springframework.stereotype.Component;

/**
 * Re-indents flat SQF by counting braces.
 *
 * Purely textual: braces and semicolons inside string literals are treated like code.
 */
@Component
public class SqfLayoutFormatter {

  static final String INDENT = "    ";

  public String format(String flat) {
    if (flat == null || flat.isEmpty()) return "";

    String split = flat
        .replace("{", "{\n")
        .replace("}", "\n}")
        .replace(";", ";\n");

    IndentWriter out = new IndentWriter();
    for (String line : split.split("\n")) {
      if (line.isBlank()) continue;

      boolean opens = line.contains("{");
      boolean closes = line.contains("}");
      if (opens && closes) {
        // "} else {" sits at the level of the statement it belongs to
        out.line(out.depth - 1, line);
      } else if (opens) {
        out.line(out.depth, line);
        out.depth++;
      } else if (closes) {
        out.depth--;
        out.line(out.depth, line);
      } else {
        out.line(out.depth, line);
      }
    }
    return out.finish();
  }

  /** One per format call. */
  private static final class IndentWriter {
    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;

    void line(int level, String line) {
      if (sb.length() > 0) sb.append("\n");
      sb.append(INDENT.repeat(Math.max(0, level))).append(line);
    }

    String finish() {
      return sb.toString();
    }
  }
}
