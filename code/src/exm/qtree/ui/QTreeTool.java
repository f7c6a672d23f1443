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
package exm.qtree.ui;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Node;
import exm.qtree.ast.Validation;
import exm.qtree.ast.Validator;
import exm.qtree.common.Logging;
import exm.qtree.common.exceptions.QTreeFatal;
import exm.qtree.common.exceptions.TermSyntaxException;
import exm.qtree.common.exceptions.UserException;
import exm.qtree.expand.BasicEnv;
import exm.qtree.expand.Expander;
import exm.qtree.lang.AtomClassifier;
import exm.qtree.lang.AtomClassifier.Format;
import exm.qtree.pipe.PipeStep;
import exm.qtree.pipe.Pipeline;
import exm.qtree.term.TermReader;
import exm.qtree.term.TermWriter;
import exm.qtree.unparse.Unparser;
import exm.qtree.walk.Walkers;

/**
 * Runs one command of the command-line tool against a tree read from
 * term notation.  Errors are reported on stderr and turned into a
 * {@link QTreeFatal} carrying the exit code.
 */
public class QTreeTool {

  public static enum Command {
    TO_STRING,
    VALIDATE,
    UNPIPE,
    PREWALK,
    POSTWALK,
    EXPAND,
  }

  private final Logger logger;
  private final PrintStream out;

  public QTreeTool(Logger logger, PrintStream out) {
    this.logger = logger;
    this.out = out;
  }

  /**
   * @param inputName file name for error messages
   * @param text input in term notation
   * @param env environment for expansion
   */
  public void run(Command cmd, String inputName, String text, BasicEnv env) {
    try {
      logger.debug("qtree " + cmd + " on " + inputName);
      Node node = new TermReader(inputName, text).readOne();
      if (cmd != Command.VALIDATE) {
        warnIfInvalid(node);
      }
      switch (cmd) {
        case TO_STRING:
          out.println(Unparser.toString(node));
          break;
        case VALIDATE:
          validate(node);
          break;
        case UNPIPE:
          unpipe(node);
          break;
        case PREWALK:
          printAll(Walkers.prewalker(node));
          break;
        case POSTWALK:
          printAll(Walkers.postwalker(node));
          break;
        case EXPAND:
          out.println(Unparser.toString(Expander.expand(node, env)));
          break;
        default:
          throw new IllegalArgumentException("command " + cmd);
      }
      out.flush();
    } catch (QTreeFatal e) {
      throw e;
    } catch (TermSyntaxException e) {
      System.err.println("qtree syntax error:");
      System.err.println(e.getMessage());
      throw new QTreeFatal(ExitCode.ERROR_SYNTAX.code());
    } catch (UserException e) {
      System.err.println("qtree error:");
      System.err.println(e.getMessage());
      throw new QTreeFatal(ExitCode.ERROR_USER.code());
    } catch (Throwable e) {
      reportInternalError(e);
      throw new QTreeFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Print how an atom is classified and how it renders in each position
   */
  public void classify(String atomName) {
    Atom atom = Atom.of(atomName);
    out.println("category: " +
                AtomClassifier.classify(atom).toString().toLowerCase());
    out.println("form: " +
                AtomClassifier.sourceForm(atom).toString().toLowerCase());
    for (Format f: Format.values()) {
      out.println(f.toString().toLowerCase() + ": " +
                  AtomClassifier.inspect(f, atom));
    }
    out.flush();
  }

  private void warnIfInvalid(Node node) {
    Validation v = Validator.validate(node);
    if (!v.isOk()) {
      Logging.uniqueWarn("input is not a valid tree, offending node: " +
                         TermWriter.write(v.offending()));
    }
  }

  private void validate(Node node) {
    Validation v = Validator.validate(node);
    out.println(v);
    if (!v.isOk()) {
      out.flush();
      throw new QTreeFatal(ExitCode.ERROR_USER.code());
    }
  }

  private void unpipe(Node node) throws UserException {
    List<PipeStep> steps = Pipeline.unpipe(node);
    for (PipeStep step: steps) {
      out.println(step.position + "\t" + Unparser.toString(step.node));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("refolded: " + Unparser.toString(Pipeline.fold(steps)));
    }
  }

  private void printAll(Iterator<Node> walker) {
    while (walker.hasNext()) {
      out.println(TermWriter.write(walker.next()));
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("QTREE INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
