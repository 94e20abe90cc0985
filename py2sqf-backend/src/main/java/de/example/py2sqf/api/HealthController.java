package de.example.py2sqf.api;

import de.example.py2sqf.PythonToSqfTranslator;
import de.example.py2sqf.ast.PyNode;
import de.example.py2sqf.config.Py2SqfProperties;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness plus the translation settings in effect. */
@RestController
@RequestMapping({"/api", ""})
public class HealthController {

  private static final PyNode SMOKE_TREE = new PyNode.Module(List.of(new PyNode.Break()));
  private static final String SMOKE_EXPECTED = "break;";

  private final PythonToSqfTranslator translator;
  private final Py2SqfProperties properties;

  public HealthController(PythonToSqfTranslator translator, Py2SqfProperties properties) {
    this.translator = translator;
    this.properties = properties;
  }

  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> health() {
    boolean translatorOk = SMOKE_EXPECTED.equals(translator.translate(SMOKE_TREE).code());
    return Map.of(
        "status", translatorOk ? "ok" : "degraded",
        "service", "py2sqf-backend",
        "strict", properties.translation().strict(),
        "maxInputLength", properties.api().maxInputLength(),
        "time", Instant.now().toString()
    );
  }
}
