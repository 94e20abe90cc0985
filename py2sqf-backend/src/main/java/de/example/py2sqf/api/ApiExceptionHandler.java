package de.example.py2sqf.api;

import de.example.py2sqf.MalformedTreeException;
import de.example.py2sqf.TranslationFailedException;
import de.example.py2sqf.ast.SyntaxTreeFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SyntaxTreeFormatException.class)
  public ResponseEntity<ApiError> handleTreeFormat(SyntaxTreeFormatException e) {
    return ResponseEntity.badRequest()
        .contentType(MediaType.APPLICATION_JSON)
        .body(ApiError.of("invalid-tree", e.getMessage()));
  }

  @ExceptionHandler(MalformedTreeException.class)
  public ResponseEntity<ApiError> handleMalformed(MalformedTreeException e) {
    log.error("Malformed syntax tree: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .contentType(MediaType.APPLICATION_JSON)
        .body(ApiError.of("malformed-tree", e.getMessage()));
  }

  @ExceptionHandler(TranslationFailedException.class)
  public ResponseEntity<ApiError> handleUnsupported(TranslationFailedException e) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ApiError("unsupported-construct", e.getMessage(), e.getDiagnostics()));
  }
}
