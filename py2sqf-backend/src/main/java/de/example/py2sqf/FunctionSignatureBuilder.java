package de.example.py2sqf;

import de.example.py2sqf.ast.PyNode.Arg;
import de.example.py2sqf.ast.PyNode.Arguments;
import de.example.py2sqf.ast.PyNode.FunctionDef;

import java.util.ArrayList;
import java.util.List;

/** Builds the {@code params [...];} header of a function code block. */
public final class FunctionSignatureBuilder {

  public String buildParamsLine(FunctionDef f) {
    if (!f.decoratorList().isEmpty()) {
      throw new UnsupportedConstructException("function", "function with decorator is not supported");
    }

    Arguments a = f.args();
    List<String> parts = new ArrayList<>();
    if (a != null) {
      if (!a.kwonlyargs().isEmpty() || !a.defaults().isEmpty()) {
        throw new UnsupportedConstructException("function arguments",
            "keyword only and default arguments are not supported");
      }
      if (a.vararg() != null || a.kwarg() != null) {
        throw new UnsupportedConstructException("function arguments", "variadic arguments are not supported");
      }

      // positional-only parameters come first in the call order
      for (Arg p : a.posonlyargs()) parts.add(quotedParam(p));
      for (Arg p : a.args()) parts.add(quotedParam(p));
    }

    return "params [" + String.join(", ", parts) + "];";
  }

  private String quotedParam(Arg p) {
    String name = ExpressionTranslator.required(p.arg(), "arg.arg");
    return "\"" + ExpressionTranslator.PRIVATE_PREFIX + name + "\"";
  }
}
