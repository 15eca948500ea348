// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.typeflow.flow;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.typeflow.syntax.AssignmentExpression;
import net.typeflow.syntax.BinaryOperatorExpression;
import net.typeflow.syntax.CallExpression;
import net.typeflow.syntax.DotExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Identifier;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.UnaryOperatorExpression;

/**
 * Finds the references a test expression may narrow.
 *
 * <p>The result is conservative in the other direction from narrowing itself: it lists every
 * reference some rule might refine, and the rules decide later whether they actually can.
 */
public final class NarrowingTargets {

  private NarrowingTargets() {}

  /**
   * Returns the references {@code test} may narrow, in source order, each mapped to the first
   * expression denoting it inside the test.
   */
  public static ImmutableMap<ReferenceKey, Expression> of(Expression test) {
    Map<ReferenceKey, Expression> result = new LinkedHashMap<>();
    collect(test, result);
    return ImmutableMap.copyOf(result);
  }

  /** Strips walrus wrappers: {@code (n := e)} narrows like {@code n}. */
  public static Expression unwrapAssignment(Expression expr) {
    while (expr instanceof AssignmentExpression walrus) {
      expr = walrus.getTarget();
    }
    return expr;
  }

  private static void collect(Expression test, Map<ReferenceKey, Expression> result) {
    switch (test.kind()) {
      case IDENTIFIER:
      case DOT:
      case INDEX:
        addReference(test, result);
        return;
      case ASSIGNMENT_EXPR:
        {
          AssignmentExpression walrus = (AssignmentExpression) test;
          addReference(walrus.getTarget(), result);
          collect(walrus.getValue(), result);
          return;
        }
      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unary = (UnaryOperatorExpression) test;
          if (unary.getOperator() == TokenKind.NOT) {
            collect(unary.getX(), result);
          }
          return;
        }
      case BINARY_OPERATOR:
        collectBinary((BinaryOperatorExpression) test, result);
        return;
      case CALL:
        collectCall((CallExpression) test, result);
        return;
      default:
        return;
    }
  }

  private static void collectBinary(
      BinaryOperatorExpression binop, Map<ReferenceKey, Expression> result) {
    switch (binop.getOperator()) {
      case AND:
      case OR:
        collect(binop.getX(), result);
        collect(binop.getY(), result);
        return;
      case IS:
      case IS_NOT:
      case EQUALS_EQUALS:
      case NOT_EQUALS:
        collectOperand(binop.getX(), result);
        collectOperand(binop.getY(), result);
        return;
      case IN:
      case NOT_IN:
        // x in container narrows x; "k" in td narrows td.
        collectOperand(binop.getX(), result);
        addReference(unwrapAssignment(binop.getY()), result);
        return;
      default:
        return;
    }
  }

  private static void collectOperand(Expression operand, Map<ReferenceKey, Expression> result) {
    if (operand instanceof AssignmentExpression walrus) {
      addReference(walrus.getTarget(), result);
      operand = walrus.getValue();
    }
    if (addReference(operand, result)) {
      // A member access may also discriminate its object: x.tag == "a", x["tag"] == "a".
      if (operand instanceof DotExpression dot) {
        addReference(dot.getObject(), result);
      } else if (operand instanceof IndexExpression index) {
        addReference(index.getObject(), result);
      }
      return;
    }
    if (operand instanceof CallExpression call
        && call.getPositionalArgumentCount() == 1
        && call.getFunction() instanceof Identifier callee
        && (callee.getName().equals("len") || callee.getName().equals("type"))) {
      addReference(unwrapAssignment(call.getPositionalArgument(0)), result);
    }
  }

  private static void collectCall(CallExpression call, Map<ReferenceKey, Expression> result) {
    // isinstance(x, C), issubclass(x, C), callable(x), and user-defined guards f(x).
    if (call.getPositionalArgumentCount() >= 1) {
      Expression arg = call.getPositionalArgument(0);
      if (arg instanceof AssignmentExpression walrus) {
        addReference(walrus.getTarget(), result);
        arg = walrus.getValue();
      }
      addReference(arg, result);
    }
  }

  private static boolean addReference(Expression expr, Map<ReferenceKey, Expression> result) {
    ReferenceKey key = ReferenceKey.of(expr);
    if (key == null) {
      return false;
    }
    result.putIfAbsent(key, expr);
    return true;
  }
}
