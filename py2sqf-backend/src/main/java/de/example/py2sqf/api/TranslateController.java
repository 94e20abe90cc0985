package de.example.py2sqf.api;

import de.example.py2sqf.PythonToSqfTranslator;
import de.example.py2sqf.SqfLayoutFormatter;
import de.example.py2sqf.TranslationResult;
import de.example.py2sqf.ast.PyNode;
import de.example.py2sqf.ast.SyntaxTreeReader;
import de.example.py2sqf.config.Py2SqfProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class TranslateController {
  private static final Logger log = LoggerFactory.getLogger(TranslateController.class);

  private final PythonToSqfTranslator translator;
  private final SyntaxTreeReader reader;
  private final SqfLayoutFormatter formatter;
  private final Py2SqfProperties properties;

  public TranslateController(PythonToSqfTranslator translator, SyntaxTreeReader reader,
                             SqfLayoutFormatter formatter, Py2SqfProperties properties) {
    this.translator = translator;
    this.reader = reader;
    this.formatter = formatter;
    this.properties = properties;
  }

  /** Body: the Python syntax tree as JSON. */
  @PostMapping(value = {"/translate", "/translate/"},
      consumes = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_PLAIN_VALUE})
  public ResponseEntity<?> translate(
      @RequestParam(name = "strict", required = false) Boolean strict,
      @RequestBody String input
  ) {
    ResponseEntity<ApiError> rejected = checkInput(input);
    if (rejected != null) return rejected;

    boolean s = strict == null ? properties.translation().strict() : strict;
    log.info("Translating syntax tree ({} chars, strict={})", input.length(), s);

    PyNode tree = reader.read(input);
    TranslationResult result = translator.translate(tree, s);
    if (!result.complete()) {
      log.info("Translation skipped {} construct(s)", result.diagnostics().size());
    }
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(TranslateResponse.of(result));
  }

  /** Body: flat SQF. Returns it re-indented. */
  @PostMapping(value = {"/format", "/format/"}, consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> format(@RequestBody String input) {
    if (input.length() > properties.api().maxInputLength()) return ResponseEntity.badRequest().body("Input too large.");
    return ResponseEntity.ok(formatter.format(input));
  }

  private ResponseEntity<ApiError> checkInput(String input) {
    if (input == null || input.isBlank()) {
      return ResponseEntity.badRequest().body(ApiError.of("empty-input", "Request body is empty."));
    }
    if (input.length() > properties.api().maxInputLength()) {
      return ResponseEntity.badRequest().body(ApiError.of("input-too-large",
          "Input exceeds " + properties.api().maxInputLength() + " characters."));
    }
    return null;
  }
}
