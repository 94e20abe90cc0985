package de.example.py2sqf;

import de.example.py2sqf.ast.PyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Python -> SQF translator.
 *
 * Single pass over an already parsed tree: each node is lowered to flat SQF text, then the
 * whole text is re-indented once. Constructs without an SQF form are left out and reported in
 * the result; in strict mode they fail the translation instead. Thread-safe: all per-call
 * state lives in a {@link TranslationContext}.
 */
@Service
public class PythonToSqfTranslator {
  private static final Logger log = LoggerFactory.getLogger(PythonToSqfTranslator.class);

  private final ExpressionTranslator expressions;
  private final StatementTranslator statements;
  private final SqfLayoutFormatter formatter;

  public PythonToSqfTranslator(SqfLayoutFormatter formatter) {
    this.expressions = new ExpressionTranslator(new OperatorLexicon());
    this.statements = new StatementTranslator(expressions, new FunctionSignatureBuilder());
    this.formatter = formatter;
  }

  // =========================================================
  // Public API
  // =========================================================
  public TranslationResult translate(PyNode root) {
    return translate(root, false);
  }

  /**
   * @param strict fail with {@link TranslationFailedException} instead of returning partial output
   * @throws MalformedTreeException if the tree breaks a guarantee of the Python parser
   */
  public TranslationResult translate(PyNode root, boolean strict) {
    TranslationContext ctx = new TranslationContext();
    String flat = lower(root, ctx);
    log.debug("Flat SQF: {}", flat);

    List<Diagnostic> diagnostics = ctx.diagnostics();
    if (strict && !diagnostics.isEmpty()) {
      throw new TranslationFailedException(diagnostics);
    }
    return new TranslationResult(formatter.format(flat), diagnostics);
  }

  // =========================================================
  // Dispatch
  // =========================================================
  String lower(PyNode node, TranslationContext ctx) {
    if (node == null) throw new MalformedTreeException("Syntax tree is empty");

    if (node instanceof PyNode.Module m) return statements.translateBlock(m.body(), ctx);
    if (node instanceof PyNode.Interactive i) return statements.translateBlock(i.body(), ctx);
    if (node instanceof PyNode.Expression e) return expression(e.body(), ctx);
    if (node instanceof PyNode.FunctionType) return "";

    // a lone statement, or anything unrecognized
    return statements.translate(node, ctx);
  }

  private String expression(PyNode body, TranslationContext ctx) {
    try {
      return expressions.toSqf(body);
    } catch (UnsupportedConstructException e) {
      ctx.report(e);
      return "";
    }
  }
}
