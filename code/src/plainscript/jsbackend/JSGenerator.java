/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package plainscript.jsbackend;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import plainscript.ast.FunctionDeclaration;
import plainscript.ast.Parameter;
import plainscript.ast.Program;
import plainscript.ast.Statement;
import plainscript.common.Settings;
import plainscript.frontend.Bindings;
import plainscript.frontend.Declaration;
import plainscript.frontend.GlobalContext;
import plainscript.jsbackend.tree.FunctionDef;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.Sequence;
import plainscript.jsbackend.tree.Token;

/**
 * Generates JavaScript for a program that was analyzed in the given
 * global context.  Use a new generator for each program.
 */
public class JSGenerator {

  private final Logger logger;
  private final GlobalContext globals;
  private final int indentWidth;
  private final JSNamer namer = new JSNamer();

  public JSGenerator(Logger logger, GlobalContext globals) {
    this(logger, globals,
         (int)Settings.getLongUnchecked(Settings.CODEGEN_INDENT_WIDTH));
  }

  public JSGenerator(Logger logger, GlobalContext globals, int indentWidth) {
    this.logger = logger;
    this.globals = globals;
    this.indentWidth = indentWidth;
  }

  /**
   * Library functions come first, then the program's statements in
   * source order.
   * @param program
   * @return JavaScript source text
   */
  public String generate(Program program) {
    Sequence output = new Sequence();
    for (FunctionDeclaration builtin: globals.getBuiltins()) {
      output.add(generateBuiltin(builtin));
    }
    output.append(program.generate(this));
    output.setIndentWidth(indentWidth);

    String result = output.toString();
    if (logger.isDebugEnabled()) {
      logger.debug("Generated " + result.length() + " characters, " +
                   namer.size() + " names");
    }
    return result;
  }

  private FunctionDef generateBuiltin(FunctionDeclaration builtin) {
    List<JSExpr> params = new ArrayList<JSExpr>();
    for (Parameter p: builtin.getParams()) {
      params.add(new Token(p.getName()));
    }
    return new FunctionDef(name(builtin), params,
                           BuiltinOps.builtinBody(builtin.getName()));
  }

  public Sequence generateBlock(List<Statement> block) {
    Sequence seq = new Sequence();
    for (Statement stmt: block) {
      seq.add(stmt.generate(this));
    }
    return seq;
  }

  /**
   * @param decl
   * @return JavaScript name for declaration
   */
  public String name(Declaration decl) {
    return namer.name(decl);
  }

  public Bindings getBindings() {
    return globals.getBindings();
  }
}
