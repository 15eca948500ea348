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
package net.typeflow.analysis;

import com.google.common.base.Joiner;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import net.typeflow.flow.AssignmentNode;
import net.typeflow.flow.CallNode;
import net.typeflow.flow.ConditionNode;
import net.typeflow.flow.ExhaustedMatchNode;
import net.typeflow.flow.FlowNode;
import net.typeflow.flow.LoopLabel;
import net.typeflow.flow.PatternNode;
import net.typeflow.flow.PostFinallyNode;
import net.typeflow.flow.UnreachableNode;
import net.typeflow.flow.VariableAnnotationNode;

/**
 * Prints the part of a flow graph that lies backward from a node, one line per node:
 *
 * <pre>
 * #7 branch_label <- #10, #11
 * #10 assignment(x) value <- #5
 * #11 condition(false_never) (x is None) <- #6
 * </pre>
 *
 * Nodes are printed once each, in the order a depth-first walk over antecedents first meets them.
 */
final class FlowGraphPrinter {

  private static final Joiner ANTECEDENT_JOINER = Joiner.on(", ");

  private FlowGraphPrinter() {}

  static String print(FlowNode root) {
    StringBuilder buf = new StringBuilder();
    Set<Integer> seen = new HashSet<>();
    Deque<FlowNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      FlowNode node = stack.pop();
      if (!seen.add(node.getId())) {
        continue;
      }
      printNode(node, buf);
      // Push in reverse so the first antecedent is printed first.
      for (int i = node.getAntecedents().size() - 1; i >= 0; i--) {
        stack.push(node.getAntecedents().get(i));
      }
    }
    return buf.toString();
  }

  private static void printNode(FlowNode node, StringBuilder buf) {
    buf.append('#').append(node.getId()).append(' ').append(lowerCase(node.kind()));
    buf.append(detail(node));
    if (!node.getAntecedents().isEmpty()) {
      buf.append(" <- ");
      ANTECEDENT_JOINER.appendTo(
          buf, node.getAntecedents().stream().map(a -> "#" + a.getId()).iterator());
    }
    buf.append('\n');
  }

  private static String lowerCase(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  private static String detail(FlowNode node) {
    switch (node.kind()) {
      case UNREACHABLE:
        return "(" + lowerCase(((UnreachableNode) node).getReason()) + ")";
      case CONDITION:
        {
          ConditionNode condition = (ConditionNode) node;
          return "(" + lowerCase(condition.getPolarity()) + ") " + condition.getTest();
        }
      case ASSIGNMENT:
        {
          AssignmentNode assignment = (AssignmentNode) node;
          return "(" + assignment.getKey() + ") " + lowerCase(assignment.getOrigin());
        }
      case VARIABLE_ANNOTATION:
        return " " + ((VariableAnnotationNode) node).getTarget();
      case CALL:
        return " " + ((CallNode) node).getCall();
      case PATTERN:
        {
          PatternNode pattern = (PatternNode) node;
          return (pattern.isPositive() ? "(match) case " : "(no match) case ")
              + pattern.getCase().getPattern();
        }
      case EXHAUSTED_MATCH:
        return " " + ((ExhaustedMatchNode) node).getSubject();
      case POST_FINALLY:
        return " gate #" + ((PostFinallyNode) node).getGate().getId();
      case LOOP_LABEL:
        {
          FlowNode entry = ((LoopLabel) node).getEntry();
          return entry == null ? "" : " entry #" + entry.getId();
        }
      default:
        return "";
    }
  }
}
