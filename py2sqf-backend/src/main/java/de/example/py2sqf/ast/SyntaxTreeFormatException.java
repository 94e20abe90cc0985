package de.example.py2sqf.ast;

/** The tree document could not be read as a Python syntax tree. */
public class SyntaxTreeFormatException extends RuntimeException {
  public SyntaxTreeFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
