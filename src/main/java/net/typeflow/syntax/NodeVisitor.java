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
package net.typeflow.syntax;

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields.
 *
 * <p>Patterns are dispatched through the single {@link #visit(Pattern)} overload, which switches on
 * {@link Pattern#kind}.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles all four Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    if (node instanceof Argument.Keyword keyword) {
      visit(keyword.getIdentifier());
    }
    visit(node.getValue());
  }

  public void visit(Parameter node) {
    visit(node.getIdentifier());
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getDefaultValue() != null) {
      visit(node.getDefaultValue());
    }
  }

  public void visit(SourceFile node) {
    visitBlock(node.getStatements());
  }

  public void visit(DictExpression.Entry node) {
    visit(node.getKey());
    visit(node.getValue());
  }

  public void visit(TryStatement.ExceptHandler node) {
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getName() != null) {
      visit(node.getName());
    }
    visitBlock(node.getBody());
  }

  public void visit(WithStatement.Item node) {
    visit(node.getContextManager());
    if (node.getTarget() != null) {
      visit(node.getTarget());
    }
  }

  public void visit(MatchStatement.Case node) {
    visit(node.getPattern());
    if (node.getGuard() != null) {
      visit(node.getGuard());
    }
    visitBlock(node.getBody());
  }

  public void visit(ImportStatement.Item node) {
    visitAll(node.getModulePath());
    if (node.getAlias() != null) {
      visit(node.getAlias());
    }
  }

  /** Handles every kind of pattern. */
  public void visit(Pattern node) {
    switch (node.kind()) {
      case LITERAL -> visit(((Pattern.Literal) node).getValue());
      case CAPTURE -> visit(((Pattern.Capture) node).getName());
      case WILDCARD -> {}
      case VALUE -> visit(((Pattern.Value) node).getValue());
      case CLASS -> {
        Pattern.ClassPattern cls = (Pattern.ClassPattern) node;
        visit(cls.getClassExpression());
        visitAll(cls.getPositionalPatterns());
        visitAll(cls.getKeywordPatterns());
      }
      case SEQUENCE -> visitAll(((Pattern.Sequence) node).getElements());
      case STAR -> {
        Identifier name = ((Pattern.Star) node).getName();
        if (name != null) {
          visit(name);
        }
      }
      case MAPPING -> {
        Pattern.Mapping mapping = (Pattern.Mapping) node;
        visitAll(mapping.getKeys());
        visitAll(mapping.getValues());
        if (mapping.getRest() != null) {
          visit(mapping.getRest());
        }
      }
      case OR -> visitAll(((Pattern.Or) node).getAlternatives());
      case AS -> {
        Pattern.As as = (Pattern.As) node;
        visit(as.getPattern());
        visit(as.getName());
      }
    }
  }

  // ==== Statements ====

  public void visit(AssertStatement node) {
    visit(node.getCondition());
    if (node.getMessage() != null) {
      visit(node.getMessage());
    }
  }

  public void visit(AssignmentStatement node) {
    visit(node.getLHS());
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getRHS() != null) {
      visit(node.getRHS());
    }
  }

  public void visit(DefStatement node) {
    visit(node.getIdentifier());
    visitAll(node.getParameters());
    if (node.getReturnType() != null) {
      visit(node.getReturnType());
    }
    visitBlock(node.getBody());
  }

  public void visit(DelStatement node) {
    visitAll(node.getTargets());
  }

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(@SuppressWarnings("unused") FlowStatement node) {}

  public void visit(ForStatement node) {
    visit(node.getIterable());
    visit(node.getTarget());
    visitBlock(node.getBody());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(FromImportStatement node) {
    for (FromImportStatement.Binding binding : node.getBindings()) {
      visit(binding.getLocalName());
    }
  }

  public void visit(IfStatement node) {
    visit(node.getCondition());
    visitBlock(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(ImportStatement node) {
    visitAll(node.getItems());
  }

  public void visit(MatchStatement node) {
    visit(node.getSubject());
    visitAll(node.getCases());
  }

  public void visit(RaiseStatement node) {
    if (node.getException() != null) {
      visit(node.getException());
    }
    if (node.getCause() != null) {
      visit(node.getCause());
    }
  }

  public void visit(ReturnStatement node) {
    if (node.getResult() != null) {
      visit(node.getResult());
    }
  }

  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    visitAll(node.getHandlers());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
    if (node.getFinallyBlock() != null) {
      visitBlock(node.getFinallyBlock());
    }
  }

  public void visit(WhileStatement node) {
    visit(node.getCondition());
    visitBlock(node.getBody());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(WithStatement node) {
    visitAll(node.getItems());
    visitBlock(node.getBody());
  }

  // ==== Expressions ====

  public void visit(AssignmentExpression node) {
    visit(node.getValue());
    visit(node.getTarget());
  }

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(@SuppressWarnings("unused") BoolLiteral node) {}

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getCondition());
    visit(node.getThenCase());
    visit(node.getElseCase());
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  public void visit(DotExpression node) {
    visit(node.getObject());
    visit(node.getField());
  }

  public void visit(@SuppressWarnings("unused") FloatLiteral node) {}

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(LambdaExpression node) {
    visitAll(node.getParameters());
    visit(node.getBody());
  }

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(@SuppressWarnings("unused") NoneLiteral node) {}

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  // ==== Helpers ====

  /** Visits each node of a list in order. */
  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /**
   * Visits a block of statements.
   *
   * <p>Subclasses may override this to introduce per-block behavior.
   */
  public void visitBlock(List<Statement> statements) {
    visitAll(statements);
  }
}
