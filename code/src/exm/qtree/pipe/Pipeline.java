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
package exm.qtree.pipe;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.common.Logging;
import exm.qtree.common.exceptions.InvalidPipeException;
import exm.qtree.lang.Operators;
import exm.qtree.unparse.Unparser;

/**
 * Splits pipelines into steps and inserts values into calls.
 */
public class Pipeline {

  private static final Logger logger = Logging.getQTreeLogger();

  /**
   * Flatten a chain of |> into its steps, left to right.
   * Every step has insertion position 0.
   */
  public static List<PipeStep> unpipe(Node node) {
    List<PipeStep> steps = new ArrayList<PipeStep>();
    unpipe(node, steps);
    return steps;
  }

  private static void unpipe(Node node, List<PipeStep> steps) {
    if (node.isForm() && ((Form)node).isCall(Operators.PIPE, 2)) {
      NodeList args = ((Form)node).args();
      unpipe(args.get(0), steps);
      unpipe(args.get(1), steps);
    } else {
      steps.add(new PipeStep(node, 0));
    }
  }

  /**
   * Left fold of the steps back into one expression
   */
  public static Node fold(List<PipeStep> steps) throws InvalidPipeException {
    Node acc = steps.get(0).node;
    for (int i = 1; i < steps.size(); i++) {
      PipeStep step = steps.get(i);
      acc = pipe(acc, step.node, step.position);
    }
    return acc;
  }

  /**
   * Insert value as argument number position of call.  A variable
   * target becomes a call with the value as its only argument.
   * @throws InvalidPipeException if call cannot take another argument
   */
  public static Node pipe(Node value, Node call, int position)
                                    throws InvalidPipeException {
    if (!call.isForm()) {
      throw badPipe(value, call);
    }
    Form f = (Form)call;
    String tag = f.tagName();

    if (tag != null) {
      if (tag.equals("&") || tag.equals(Nodes.TUPLE) ||
          tag.equals(Nodes.MAP) || tag.equals(Nodes.ALIASES) ||
          tag.equals(Nodes.BITSTRING)) {
        throw badPipe(value, call);
      }
      if ((tag.equals("unquote") || tag.equals("unquote_splicing")) &&
          f.arity() == 0) {
        throw new InvalidPipeException("cannot pipe " + str(value) +
            " into the special form " + tag + "/1 since " + tag +
            "/1 is used to build the Elixir AST itself");
      }
      if (tag.equals("fn")) {
        throw new InvalidPipeException("cannot pipe " + str(value) +
            " into an anonymous function without calling the function;" +
            " use Kernel.then/2 instead or define the anonymous function" +
            " as a regular private function");
      }
    }

    if (f.isVariable()) {
      return f.withChildren(NodeList.EMPTY.insertAt(position, value));
    }
    if (!f.isCall()) {
      throw badPipe(value, call);
    }

    NodeList args = f.args();
    if (tag != null && args.size() == 1 &&
        (tag.equals("+") || tag.equals("-"))) {
      String arg = str(args.get(0));
      throw new InvalidPipeException("piping into a unary operator is not" +
          " supported, please use the qualified name: Kernel." + tag +
          "(" + arg + "), instead of " + tag + arg);
    }

    if (isAccessGet(f) && args.size() == 2) {
      Form dot = (Form)f.tag();
      if (dot.meta().isTrue(Meta.FROM_BRACKETS)) {
        String v = str(value);
        String first = str(args.get(0));
        String second = str(args.get(1));
        throw new InvalidPipeException(
            "wrong operator precedence when piping into bracket-based access\n\n" +
            " Instead of:\n\n" +
            "     " + v + " |> " + first + "[" + second + "]\n\n" +
            " You should write:\n\n" +
            "     (" + v + " |> " + first + ")[" + second + "]\n");
      }
      return f.withChildren(args.insertAt(position, value));
    }

    if (tag != null) {
      if (Operators.isOperator(tag, 1)) {
        throw new InvalidPipeException("cannot pipe " + str(value) +
            " into " + str(call) + ", the " + str(f.tag()) +
            " operator can only take one argument");
      } else if (Operators.isOperator(tag, 2)) {
        throw new InvalidPipeException("cannot pipe " + str(value) +
            " into " + str(call) + ", the " + str(f.tag()) +
            " operator can only take two arguments");
      }
    }

    Form result = f.withChildren(args.insertAt(position, value));
    if (logger.isTraceEnabled()) {
      logger.trace("pipe: " + str(result));
    }
    return result;
  }

  /**
   * Access.get(x, y) as a qualified call, whatever the dot metadata
   */
  private static boolean isAccessGet(Form f) {
    if (!f.isQualifiedCall()) {
      return false;
    }
    return f.receiver().equals(Atom.alias("Access")) &&
           f.qualifiedName().isAtom("get");
  }

  private static InvalidPipeException badPipe(Node value, Node call) {
    return new InvalidPipeException("cannot pipe " + str(value) + " into " +
        str(call) + ", can only pipe into local calls foo(), remote calls" +
        " Foo.bar() or anonymous function calls foo.()");
  }

  private static String str(Node n) {
    return Unparser.toString(n);
  }
}
