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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.typeflow.flow.AssignmentNode.Origin;
import net.typeflow.flow.ConditionNode.Polarity;
import net.typeflow.syntax.Argument;
import net.typeflow.syntax.AssertStatement;
import net.typeflow.syntax.AssignmentExpression;
import net.typeflow.syntax.AssignmentStatement;
import net.typeflow.syntax.BinaryOperatorExpression;
import net.typeflow.syntax.BoolLiteral;
import net.typeflow.syntax.CallExpression;
import net.typeflow.syntax.ConditionalExpression;
import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.DelStatement;
import net.typeflow.syntax.DotExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.FlowStatement;
import net.typeflow.syntax.ForStatement;
import net.typeflow.syntax.FromImportStatement;
import net.typeflow.syntax.Identifier;
import net.typeflow.syntax.IfStatement;
import net.typeflow.syntax.ImportStatement;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.IntLiteral;
import net.typeflow.syntax.LambdaExpression;
import net.typeflow.syntax.ListExpression;
import net.typeflow.syntax.MatchStatement;
import net.typeflow.syntax.Node;
import net.typeflow.syntax.NodeVisitor;
import net.typeflow.syntax.Parameter;
import net.typeflow.syntax.Pattern;
import net.typeflow.syntax.RaiseStatement;
import net.typeflow.syntax.ReturnStatement;
import net.typeflow.syntax.SourceFile;
import net.typeflow.syntax.Statement;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.TryStatement;
import net.typeflow.syntax.UnaryOperatorExpression;
import net.typeflow.syntax.WhileStatement;
import net.typeflow.syntax.WithStatement;

/**
 * Builds the flow graph of a file.
 *
 * <p>The builder walks each scope once, keeping a cursor on the current flow node. Linear
 * constructs append a node after the cursor; branching constructs create labels, route every
 * outgoing path into them, and continue from the label. Once the cursor is an {@link
 * UnreachableNode}, no further nodes are created until a label with a live antecedent is
 * reached.
 *
 * <p>Function and lambda bodies are built after the enclosing scope is complete, so that each
 * scope knows its parent.
 */
public final class FlowGraphBuilder extends NodeVisitor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The set of references assigned or narrowed within a region of code. */
  private static final class Span {
    final Set<ReferenceKey> keys = new HashSet<>();
    // Set if the region binds names that are unknown here.
    boolean opaque;

    @Nullable
    Set<ReferenceKey> affectedKeys() {
      return opaque ? null : keys;
    }
  }

  /** Mutable state of the scope being built. */
  private static final class ScopeState {
    final FlowScope.Kind kind;
    final Node definingNode;
    @Nullable final FlowScope parent;
    StartNode start;
    BranchLabel returnLabel;
    final Set<ReferenceKey> tracked = new LinkedHashSet<>();
    int complexity;
    final Map<String, Integer> bindingCounts = new LinkedHashMap<>();
    final Map<String, Expression> annotations = new LinkedHashMap<>();
    final Map<String, Expression> aliasCandidates = new LinkedHashMap<>();
    boolean hasWildcardImport;
    final Deque<List<LabelNode>> exceptTargets = new ArrayDeque<>();
    final List<LabelNode> finallyTargets = new ArrayList<>();
    final Deque<Span> spans = new ArrayDeque<>();
    @Nullable LabelNode breakTarget;
    @Nullable LabelNode continueTarget;
    @Nullable FlowScope built;

    ScopeState(FlowScope.Kind kind, Node definingNode, @Nullable FlowScope parent) {
      this.kind = kind;
      this.definingNode = definingNode;
      this.parent = parent;
    }
  }

  private final SourceFile file;
  private final List<FlowNode> nodes = new ArrayList<>();
  private final List<ScopeState> nodeStates = new ArrayList<>();
  private final IdentityHashMap<Node, FlowNode> flowNodes = new IdentityHashMap<>();
  private final IdentityHashMap<Node, FlowNode> afterFlowNodes = new IdentityHashMap<>();
  private final IdentityHashMap<Node, FlowScope> scopes = new IdentityHashMap<>();
  private final IdentityHashMap<Node, ScopeState> enclosingStates = new IdentityHashMap<>();
  // For each label, the strongest unreachable antecedent that was dropped from it.
  private final IdentityHashMap<LabelNode, UnreachableNode> droppedUnreachable =
      new IdentityHashMap<>();
  private final Deque<Runnable> deferred = new ArrayDeque<>();

  private final UnreachableNode unreachableStructural;
  private final UnreachableNode unreachableStaticCondition;

  private ScopeState scope;
  private FlowNode current;

  private FlowGraphBuilder(SourceFile file) {
    this.file = file;
    this.unreachableStructural =
        register(new UnreachableNode(nextId(), UnreachableNode.Reason.STRUCTURAL));
    this.unreachableStaticCondition =
        register(new UnreachableNode(nextId(), UnreachableNode.Reason.STATIC_CONDITION));
  }

  /**
   * Builds the flow graph of a file.
   *
   * @throws IllegalArgumentException if the file has syntax errors or its tree is malformed, for
   *     example an assignment to a call or a {@code break} outside a loop
   */
  public static FlowGraph build(SourceFile file) {
    if (!file.ok()) {
      throw new IllegalArgumentException(
          String.format(
              "cannot build the flow graph of a file with syntax errors: %s",
              file.errors().get(0)));
    }
    FlowGraphBuilder builder = new FlowGraphBuilder(file);
    builder.buildModule();

    IdentityHashMap<Node, FlowScope> enclosingScopes = new IdentityHashMap<>();
    for (Map.Entry<Node, ScopeState> e : builder.enclosingStates.entrySet()) {
      enclosingScopes.put(e.getKey(), e.getValue().built);
    }
    List<FlowScope> nodeScopes = new ArrayList<>();
    for (ScopeState state : builder.nodeStates) {
      nodeScopes.add(state == null ? null : state.built);
    }
    FlowGraph graph =
        new FlowGraph(
            file,
            ImmutableList.copyOf(builder.nodes),
            builder.flowNodes,
            builder.afterFlowNodes,
            builder.scopes,
            enclosingScopes,
            nodeScopes);
    logger.atFine().log(
        "built flow graph of %s: %d nodes in %d scopes",
        file.getFile(), graph.getNodeCount(), builder.scopes.size());
    return graph;
  }

  private void buildModule() {
    enterScope(FlowScope.Kind.MODULE, file, null);
    visitBlock(file.getStatements());
    finishScope();
    while (!deferred.isEmpty()) {
      deferred.removeFirst().run();
    }
  }

  // ==== Scopes ====

  private void enterScope(FlowScope.Kind kind, Node definingNode, @Nullable FlowScope parent) {
    scope = new ScopeState(kind, definingNode, parent);
    scope.start = register(new StartNode(nextId(), definingNode));
    scope.returnLabel = newBranchLabel(null);
    current = scope.start;
  }

  private void finishScope() {
    addAntecedent(scope.returnLabel, current);
    FlowNode returnNode = finishLabel(scope.returnLabel, null);
    ImmutableMap.Builder<String, Expression> aliases = ImmutableMap.builder();
    for (Map.Entry<String, Expression> e : scope.aliasCandidates.entrySet()) {
      if (scope.bindingCounts.getOrDefault(e.getKey(), 0) == 1) {
        aliases.put(e);
      }
    }
    FlowScope built =
        new FlowScope(
            scope.kind,
            scope.definingNode,
            scope.parent,
            scope.start,
            returnNode,
            ImmutableSet.copyOf(scope.tracked),
            scope.complexity,
            ImmutableMap.copyOf(scope.bindingCounts),
            ImmutableMap.copyOf(scope.annotations),
            aliases.buildOrThrow(),
            scope.hasWildcardImport);
    scope.built = built;
    scopes.put(scope.definingNode, built);
  }

  private void buildFunction(DefStatement def, FlowScope parent) {
    enterScope(FlowScope.Kind.FUNCTION, def, parent);
    bindParameters(def.getParameters());
    visitBlock(def.getBody());
    finishScope();
  }

  private void buildLambda(LambdaExpression lambda, FlowScope parent) {
    enterScope(FlowScope.Kind.LAMBDA, lambda, parent);
    bindParameters(lambda.getParameters());
    visit(lambda.getBody());
    finishScope();
  }

  private void bindParameters(List<Parameter> parameters) {
    for (Parameter param : parameters) {
      if (param.getName().equals("*")) {
        continue;
      }
      if (param.getType() != null) {
        scope.annotations.put(param.getName(), param.getType());
      }
      bindTarget(param.getIdentifier(), Origin.PARAMETER, param, ImmutableList.of(), null);
    }
  }

  // ==== Nodes and labels ====

  private int nextId() {
    return nodes.size();
  }

  private <T extends FlowNode> T register(T node) {
    Preconditions.checkState(node.getId() == nodes.size(), "flow node %s out of order", node);
    nodes.add(node);
    nodeStates.add(scope);
    if (scope != null) {
      scope.complexity++;
    }
    return node;
  }

  private boolean isUnreachable() {
    return current instanceof UnreachableNode;
  }

  private void attach(Node node) {
    flowNodes.put(node, current);
    enclosingStates.put(node, scope);
  }

  private BranchLabel newBranchLabel(@Nullable FlowNode preBranchAntecedent) {
    return register(new BranchLabel(nextId(), preBranchAntecedent));
  }

  private void addAntecedent(LabelNode label, FlowNode node) {
    if (node instanceof UnreachableNode unreachable) {
      UnreachableNode previous = droppedUnreachable.get(label);
      if (previous == null || unreachable.getReason() == UnreachableNode.Reason.STATIC_CONDITION) {
        droppedUnreachable.put(label, unreachable);
      }
      return;
    }
    if (label.addAntecedent(node)) {
      scope.complexity++;
    }
  }

  /**
   * Seals a label and returns the node to continue from: the label, or an unreachable node if no
   * live path leads into it.
   */
  private FlowNode finishLabel(LabelNode label, @Nullable Span span) {
    label.seal(span == null ? null : span.affectedKeys());
    if (label.getAntecedents().isEmpty()) {
      return droppedUnreachable.getOrDefault(label, unreachableStructural);
    }
    return label;
  }

  private Span openSpan() {
    Span span = new Span();
    scope.spans.push(span);
    return span;
  }

  private void closeSpan(Span span) {
    Span top = scope.spans.pop();
    Preconditions.checkState(top == span, "unbalanced flow spans");
  }

  private void markAffected(ReferenceKey key) {
    scope.tracked.add(key);
    for (Span span : scope.spans) {
      span.keys.add(key);
    }
  }

  private List<LabelNode> currentExceptTargets() {
    List<LabelNode> targets = scope.exceptTargets.peek();
    return targets != null ? targets : ImmutableList.of();
  }

  /** Routes the current path to the handlers and finally blocks an exception would reach. */
  private void addExceptionEdges(FlowNode node) {
    for (LabelNode target : currentExceptTargets()) {
      addAntecedent(target, node);
    }
    for (LabelNode target : scope.finallyTargets) {
      addAntecedent(target, node);
    }
  }

  // ==== Conditions ====

  /**
   * Returns the value of a test whose outcome is fixed by literals, or null. Only literal
   * operands count; names are never assumed constant.
   */
  @Nullable
  static Boolean staticValue(Expression test) {
    switch (test.kind()) {
      case BOOL_LITERAL:
        return ((BoolLiteral) test).getValue();
      case NONE_LITERAL:
        return false;
      case INT_LITERAL:
        return ((IntLiteral) test).isTruthy();
      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unary = (UnaryOperatorExpression) test;
          if (unary.getOperator() == TokenKind.NOT) {
            Boolean operand = staticValue(unary.getX());
            return operand == null ? null : !operand;
          }
          return null;
        }
      default:
        return null;
    }
  }

  /**
   * Returns the references a test narrows. A bare name bound to a narrowing test counts as that
   * test.
   */
  private ImmutableMap<ReferenceKey, Expression> referencesOf(Expression test) {
    ImmutableMap<ReferenceKey, Expression> refs = NarrowingTargets.of(test);
    Expression operand = test;
    while (operand instanceof UnaryOperatorExpression unary
        && unary.getOperator() == TokenKind.NOT) {
      operand = unary.getX();
    }
    if (operand instanceof Identifier id) {
      Expression alias = scope.aliasCandidates.get(id.getName());
      if (alias != null) {
        Map<ReferenceKey, Expression> merged = new LinkedHashMap<>(refs);
        NarrowingTargets.of(alias).forEach(merged::putIfAbsent);
        return ImmutableMap.copyOf(merged);
      }
    }
    return refs;
  }

  private FlowNode createCondition(Polarity polarity, FlowNode antecedent, Expression test) {
    if (antecedent instanceof UnreachableNode) {
      return antecedent;
    }
    Boolean value = staticValue(test);
    if (value != null) {
      return value == polarity.isPositive() ? antecedent : unreachableStaticCondition;
    }
    ImmutableMap<ReferenceKey, Expression> refs = referencesOf(test);
    if (refs.isEmpty()) {
      return antecedent;
    }
    refs.keySet().forEach(this::markAffected);
    return register(new ConditionNode(nextId(), antecedent, test, polarity, refs));
  }

  /**
   * Evaluates a test and routes its true and false outcomes to the given labels. Negations and
   * short-circuit operators are decomposed so that each operand gates its own paths.
   */
  private void bindConditional(Expression test, LabelNode trueTarget, LabelNode falseTarget) {
    attach(test);
    if (test instanceof UnaryOperatorExpression unary && unary.getOperator() == TokenKind.NOT) {
      bindConditional(unary.getX(), falseTarget, trueTarget);
      return;
    }
    if (test instanceof BinaryOperatorExpression binop
        && (binop.getOperator() == TokenKind.AND || binop.getOperator() == TokenKind.OR)) {
      BranchLabel preRight = newBranchLabel(null);
      if (binop.getOperator() == TokenKind.AND) {
        bindConditional(binop.getX(), preRight, falseTarget);
      } else {
        bindConditional(binop.getX(), trueTarget, preRight);
      }
      current = finishLabel(preRight, null);
      bindConditional(binop.getY(), trueTarget, falseTarget);
      return;
    }
    visit(test);
    FlowNode after = current;
    addAntecedent(trueTarget, createCondition(Polarity.TRUE, after, test));
    addAntecedent(falseTarget, createCondition(Polarity.FALSE, after, test));
  }

  /**
   * Adds a never-variant condition on the implied else path of an {@code if}. Only bare names
   * are considered.
   */
  private FlowNode createNeverCondition(Expression test, boolean positive) {
    while (test instanceof UnaryOperatorExpression unary && unary.getOperator() == TokenKind.NOT) {
      test = unary.getX();
      positive = !positive;
    }
    if (isUnreachable()
        || staticValue(test) != null
        || (test instanceof BinaryOperatorExpression binop
            && (binop.getOperator() == TokenKind.AND || binop.getOperator() == TokenKind.OR))) {
      return current;
    }
    ImmutableMap.Builder<ReferenceKey, Expression> names = ImmutableMap.builder();
    referencesOf(test)
        .forEach(
            (key, expr) -> {
              if (key.isName()) {
                names.put(key, expr);
              }
            });
    ImmutableMap<ReferenceKey, Expression> refs = names.buildOrThrow();
    if (refs.isEmpty()) {
      return current;
    }
    return register(
        new ConditionNode(
            nextId(),
            current,
            test,
            positive ? Polarity.TRUE_NEVER : Polarity.FALSE_NEVER,
            refs));
  }

  // ==== Assignments ====

  private void recordBinding(String name) {
    scope.bindingCounts.merge(name, 1, Integer::sum);
  }

  private void bindTarget(
      Expression target,
      Origin origin,
      Node source,
      ImmutableList<Integer> unpackPath,
      @Nullable Pattern capturePattern) {
    switch (target.kind()) {
      case IDENTIFIER:
        {
          String name = ((Identifier) target).getName();
          recordBinding(name);
          createAssignment(
              target, ReferenceKey.forName(name), origin, source, unpackPath, capturePattern);
          return;
        }
      case DOT:
        {
          visit(((DotExpression) target).getObject());
          ReferenceKey key = ReferenceKey.of(target);
          if (key != null) {
            createAssignment(target, key, origin, source, unpackPath, capturePattern);
          } else {
            attach(target);
          }
          return;
        }
      case INDEX:
        {
          IndexExpression index = (IndexExpression) target;
          visit(index.getObject());
          visit(index.getKey());
          ReferenceKey key = ReferenceKey.of(target);
          if (key == null) {
            key = ReferenceKey.forAnySubscript(index.getObject());
          }
          if (key != null) {
            createAssignment(target, key, origin, source, unpackPath, capturePattern);
          } else {
            attach(target);
          }
          return;
        }
      case LIST_EXPR:
        {
          Origin elementOrigin =
              origin == Origin.VALUE || origin == Origin.ANNOTATED ? Origin.UNPACK : origin;
          List<Expression> elements = ((ListExpression) target).getElements();
          for (int i = 0; i < elements.size(); i++) {
            ImmutableList<Integer> path =
                ImmutableList.<Integer>builder().addAll(unpackPath).add(i).build();
            bindTarget(elements.get(i), elementOrigin, source, path, capturePattern);
          }
          attach(target);
          return;
        }
      default:
        throw new IllegalArgumentException(
            String.format(
                "%s: cannot assign to %s expression",
                target.getStartLocation(), target.kind().name().toLowerCase(Locale.ROOT)));
    }
  }

  private void createAssignment(
      Expression target,
      ReferenceKey key,
      Origin origin,
      Node source,
      ImmutableList<Integer> unpackPath,
      @Nullable Pattern capturePattern) {
    markAffected(key);
    if (!isUnreachable()) {
      current =
          register(
              new AssignmentNode(
                  nextId(), current, target, key, origin, source, unpackPath, capturePattern));
    }
    attach(target);
  }

  /** Reports whether an assigned value is a test that an alias of it can stand for. */
  private static boolean isAliasableTest(Expression value) {
    switch (value.kind()) {
      case BINARY_OPERATOR:
      case CALL:
        return !NarrowingTargets.of(value).isEmpty();
      case UNARY_OPERATOR:
        return ((UnaryOperatorExpression) value).getOperator() == TokenKind.NOT
            && !NarrowingTargets.of(value).isEmpty();
      default:
        return false;
    }
  }

  // ==== Statements ====

  @Override
  public void visitBlock(List<Statement> statements) {
    for (Statement stmt : statements) {
      attach(stmt);
      visit(stmt);
      afterFlowNodes.put(stmt, current);
    }
  }

  @Override
  public void visit(AssignmentStatement node) {
    Expression lhs = node.getLHS();
    if (node.getType() != null) {
      visit(node.getType());
      if (lhs instanceof Identifier id) {
        scope.annotations.put(id.getName(), node.getType());
      }
    }
    if (node.isAnnotationOnly()) {
      if (lhs instanceof DotExpression dot) {
        visit(dot.getObject());
      } else if (lhs instanceof IndexExpression index) {
        visit(index.getObject());
        visit(index.getKey());
      }
      if (!isUnreachable()) {
        current = register(new VariableAnnotationNode(nextId(), current, lhs, node.getType()));
      }
      attach(lhs);
      return;
    }
    visit(node.getRHS());
    if (node.isAugmented()) {
      bindTarget(lhs, Origin.AUGMENTED, node, ImmutableList.of(), null);
      return;
    }
    if (node.getType() != null) {
      bindTarget(lhs, Origin.ANNOTATED, node, ImmutableList.of(), null);
    } else {
      bindTarget(lhs, Origin.VALUE, node.getRHS(), ImmutableList.of(), null);
    }
    if (lhs instanceof Identifier id && isAliasableTest(node.getRHS())) {
      scope.aliasCandidates.putIfAbsent(id.getName(), node.getRHS());
    }
  }

  @Override
  public void visit(DelStatement node) {
    for (Expression target : node.getTargets()) {
      bindTarget(target, Origin.DELETION, node, ImmutableList.of(), null);
    }
  }

  @Override
  public void visit(FlowStatement node) {
    switch (node.getJump()) {
      case BREAK -> jumpTo(scope.breakTarget, node);
      case CONTINUE -> jumpTo(scope.continueTarget, node);
      case PASS -> {}
    }
  }

  private void jumpTo(@Nullable LabelNode target, FlowStatement node) {
    if (target == null) {
      throw new IllegalArgumentException(
          String.format("%s: '%s' outside loop", node.getStartLocation(), node.getJump()));
    }
    addAntecedent(target, current);
    current = unreachableStructural;
  }

  @Override
  public void visit(ReturnStatement node) {
    if (scope.kind != FlowScope.Kind.FUNCTION) {
      throw new IllegalArgumentException(node.getStartLocation() + ": 'return' outside function");
    }
    if (node.getResult() != null) {
      visit(node.getResult());
    }
    addAntecedent(scope.returnLabel, current);
    for (LabelNode target : scope.finallyTargets) {
      addAntecedent(target, current);
    }
    current = unreachableStructural;
  }

  @Override
  public void visit(RaiseStatement node) {
    if (node.getException() != null) {
      visit(node.getException());
    }
    if (node.getCause() != null) {
      visit(node.getCause());
    }
    addExceptionEdges(current);
    current = unreachableStructural;
  }

  @Override
  public void visit(AssertStatement node) {
    BranchLabel assertTrue = newBranchLabel(null);
    BranchLabel assertFalse = newBranchLabel(null);
    bindConditional(node.getCondition(), assertTrue, assertFalse);
    current = finishLabel(assertFalse, null);
    if (node.getMessage() != null) {
      visit(node.getMessage());
    }
    addExceptionEdges(current);
    current = finishLabel(assertTrue, null);
  }

  @Override
  public void visit(IfStatement node) {
    FlowNode preIf = current;
    Span span = openSpan();
    BranchLabel thenLabel = newBranchLabel(null);
    BranchLabel elseLabel = newBranchLabel(null);
    BranchLabel postIfLabel = newBranchLabel(preIf);

    bindConditional(node.getCondition(), thenLabel, elseLabel);

    current = finishLabel(thenLabel, null);
    visitBlock(node.getThenBlock());
    addAntecedent(postIfLabel, current);

    current = finishLabel(elseLabel, null);
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    } else {
      current = createNeverCondition(node.getCondition(), false);
    }
    addAntecedent(postIfLabel, current);

    closeSpan(span);
    current = finishLabel(postIfLabel, span);
  }

  private void enterLoop(LoopLabel loopLabel) {
    addAntecedent(loopLabel, current);
    if (!isUnreachable()) {
      loopLabel.setEntry(current);
    }
    current = loopLabel;
  }

  private void visitLoopBody(
      LabelNode continueTarget, LabelNode breakTarget, List<Statement> body) {
    LabelNode savedBreak = scope.breakTarget;
    LabelNode savedContinue = scope.continueTarget;
    scope.breakTarget = breakTarget;
    scope.continueTarget = continueTarget;
    visitBlock(body);
    scope.breakTarget = savedBreak;
    scope.continueTarget = savedContinue;
  }

  @Override
  public void visit(WhileStatement node) {
    LoopLabel preLoop = register(new LoopLabel(nextId()));
    BranchLabel postWhile = newBranchLabel(null);
    Span span = openSpan();
    enterLoop(preLoop);

    BranchLabel thenLabel = newBranchLabel(null);
    BranchLabel elseLabel = newBranchLabel(null);
    bindConditional(node.getCondition(), thenLabel, elseLabel);

    current = finishLabel(thenLabel, null);
    visitLoopBody(preLoop, postWhile, node.getBody());
    addAntecedent(preLoop, current);
    closeSpan(span);
    preLoop.seal(span.affectedKeys());

    current = finishLabel(elseLabel, null);
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
    addAntecedent(postWhile, current);
    current = finishLabel(postWhile, null);
  }

  @Override
  public void visit(ForStatement node) {
    visit(node.getIterable());
    LoopLabel preFor = register(new LoopLabel(nextId()));
    BranchLabel preElse = newBranchLabel(null);
    BranchLabel postFor = newBranchLabel(null);
    Span span = openSpan();
    enterLoop(preFor);
    addAntecedent(preElse, current);

    bindTarget(node.getTarget(), Origin.ITERATION, node.getIterable(), ImmutableList.of(), null);
    visitLoopBody(preFor, postFor, node.getBody());
    addAntecedent(preFor, current);
    closeSpan(span);
    preFor.seal(span.affectedKeys());

    current = finishLabel(preElse, null);
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
    addAntecedent(postFor, current);
    current = finishLabel(postFor, null);
  }

  @Override
  public void visit(TryStatement node) {
    boolean hasFinally = node.getFinallyBlock() != null;
    List<LabelNode> outerExceptTargets = currentExceptTargets();

    // Normal completion of the body, else block and handlers.
    BranchLabel preFinallyLabel = newBranchLabel(null);
    // Paths that enter the finally block by return or exception.
    BranchLabel preFinallyReturnOrRaise = hasFinally ? newBranchLabel(null) : null;

    List<BranchLabel> handlerLabels = new ArrayList<>();
    boolean hasBareExcept = false;
    for (TryStatement.ExceptHandler handler : node.getHandlers()) {
      handlerLabels.add(newBranchLabel(null));
      hasBareExcept |= handler.getType() == null;
    }
    List<LabelNode> bodyTargets = new ArrayList<>(handlerLabels);
    if (hasFinally && !hasBareExcept) {
      bodyTargets.add(preFinallyReturnOrRaise);
    }
    if (!hasFinally && !hasBareExcept) {
      bodyTargets.addAll(outerExceptTargets);
    }
    List<LabelNode> handlerTargets =
        hasFinally ? ImmutableList.of(preFinallyReturnOrRaise) : outerExceptTargets;

    // An exception may be raised before the first statement of the body completes.
    for (LabelNode target : bodyTargets) {
      addAntecedent(target, current);
    }
    if (hasFinally) {
      scope.finallyTargets.add(preFinallyReturnOrRaise);
    }

    scope.exceptTargets.push(bodyTargets);
    visitBlock(node.getBody());
    scope.exceptTargets.pop();

    if (node.getElseBlock() != null) {
      scope.exceptTargets.push(handlerTargets);
      visitBlock(node.getElseBlock());
      scope.exceptTargets.pop();
    }
    addAntecedent(preFinallyLabel, current);

    for (int i = 0; i < handlerLabels.size(); i++) {
      TryStatement.ExceptHandler handler = node.getHandlers().get(i);
      current = finishLabel(handlerLabels.get(i), null);
      attach(handler);
      if (handler.getType() != null) {
        visit(handler.getType());
      }
      Identifier name = handler.getName();
      if (name != null) {
        bindTarget(name, Origin.EXCEPTION, handler, ImmutableList.of(), null);
      }
      scope.exceptTargets.push(handlerTargets);
      visitBlock(handler.getBody());
      scope.exceptTargets.pop();
      if (name != null) {
        // The exception variable is deleted at the end of the clause.
        createAssignment(
            name,
            ReferenceKey.forName(name.getName()),
            Origin.DELETION,
            handler,
            ImmutableList.of(),
            null);
        recordBinding(name.getName());
      }
      addAntecedent(preFinallyLabel, current);
    }

    if (!hasFinally) {
      current = finishLabel(preFinallyLabel, null);
      return;
    }
    scope.finallyTargets.remove(scope.finallyTargets.size() - 1);

    FlowNode returnOrRaise = finishLabel(preFinallyReturnOrRaise, null);
    PreFinallyGate gate = null;
    if (!(returnOrRaise instanceof UnreachableNode)) {
      gate = register(new PreFinallyGate(nextId(), returnOrRaise));
      addAntecedent(preFinallyLabel, gate);
    }
    current = finishLabel(preFinallyLabel, null);
    visitBlock(node.getFinallyBlock());
    if (gate != null && !isUnreachable()) {
      current = register(new PostFinallyNode(nextId(), current, gate));
    }
  }

  @Override
  public void visit(WithStatement node) {
    ImmutableList.Builder<Expression> contextManagers = ImmutableList.builder();
    for (WithStatement.Item item : node.getItems()) {
      visit(item.getContextManager());
      contextManagers.add(item.getContextManager());
      if (item.getTarget() != null) {
        bindTarget(
            item.getTarget(),
            Origin.CONTEXT_ENTER,
            item.getContextManager(),
            ImmutableList.of(),
            null);
      }
    }
    ImmutableList<Expression> managers = contextManagers.build();

    // Exceptions leaving the body reach the enclosing handlers unless a manager swallows them,
    // in which case control continues after the statement.
    PostContextManagerLabel exceptionTarget =
        register(new PostContextManagerLabel(nextId(), managers, true));
    PostContextManagerLabel swallowTarget =
        register(new PostContextManagerLabel(nextId(), managers, false));
    for (LabelNode target : currentExceptTargets()) {
      addAntecedent(target, exceptionTarget);
    }

    scope.exceptTargets.push(ImmutableList.of(swallowTarget, exceptionTarget));
    visitBlock(node.getBody());
    scope.exceptTargets.pop();

    BranchLabel postWith = newBranchLabel(null);
    addAntecedent(postWith, current);
    exceptionTarget.seal(null);
    addAntecedent(postWith, finishLabel(swallowTarget, null));
    current = finishLabel(postWith, null);
  }

  @Override
  public void visit(MatchStatement node) {
    Expression subject = node.getSubject();
    visit(subject);
    BranchLabel postMatch = newBranchLabel(current);
    Span span = openSpan();
    ImmutableMap<ReferenceKey, Expression> refs = subjectReferences(subject);

    boolean foundIrrefutable = false;
    for (MatchStatement.Case matchCase : node.getCases()) {
      attach(matchCase);
      visitPatternOperands(matchCase.getPattern());
      FlowNode beforeCase = current;

      current = createPatternNode(subject, matchCase, true, beforeCase, refs);
      bindCaptures(matchCase.getPattern(), matchCase);
      FlowNode failed =
          matchCase.isIrrefutable()
              ? unreachableStructural
              : createPatternNode(subject, matchCase, false, beforeCase, refs);
      foundIrrefutable |= matchCase.isIrrefutable();

      if (matchCase.getGuard() != null) {
        BranchLabel guardTrue = newBranchLabel(null);
        BranchLabel guardFalse = newBranchLabel(null);
        bindConditional(matchCase.getGuard(), guardTrue, guardFalse);
        FlowNode guardFailed = finishLabel(guardFalse, null);
        current = finishLabel(guardTrue, null);
        BranchLabel nextCase = newBranchLabel(null);
        addAntecedent(nextCase, failed);
        addAntecedent(nextCase, guardFailed);
        failed = finishLabel(nextCase, null);
      }
      visitBlock(matchCase.getBody());
      addAntecedent(postMatch, current);
      current = failed;
    }

    if (!foundIrrefutable && !isUnreachable()) {
      current = register(new ExhaustedMatchNode(nextId(), current, subject, node.getCases()));
    }
    addAntecedent(postMatch, current);
    closeSpan(span);
    current = finishLabel(postMatch, span);
  }

  /**
   * Returns the references a match narrows: the subject, the elements of a tuple subject, and
   * the object a member subject belongs to.
   */
  private static ImmutableMap<ReferenceKey, Expression> subjectReferences(Expression subject) {
    Map<ReferenceKey, Expression> refs = new LinkedHashMap<>();
    if (subject instanceof AssignmentExpression walrus) {
      refs.put(ReferenceKey.forName(walrus.getTarget().getName()), walrus.getTarget());
      subject = walrus.getValue();
    }
    ReferenceKey key = ReferenceKey.of(subject);
    if (key != null) {
      refs.putIfAbsent(key, subject);
      ReferenceKey parent = key.getParent();
      if (parent != null) {
        Expression object =
            subject instanceof DotExpression dot
                ? dot.getObject()
                : ((IndexExpression) subject).getObject();
        refs.putIfAbsent(parent, object);
      }
    } else if (subject instanceof ListExpression tuple && tuple.isTuple()) {
      for (Expression element : tuple.getElements()) {
        ReferenceKey elementKey = ReferenceKey.of(element);
        if (elementKey != null) {
          refs.putIfAbsent(elementKey, element);
        }
      }
    }
    return ImmutableMap.copyOf(refs);
  }

  private FlowNode createPatternNode(
      Expression subject,
      MatchStatement.Case matchCase,
      boolean positive,
      FlowNode antecedent,
      ImmutableMap<ReferenceKey, Expression> refs) {
    if (antecedent instanceof UnreachableNode) {
      return antecedent;
    }
    refs.keySet().forEach(this::markAffected);
    return register(new PatternNode(nextId(), antecedent, subject, matchCase, positive, refs));
  }

  /** Visits the expressions a pattern evaluates: literals, values and class names. */
  private void visitPatternOperands(Pattern pattern) {
    switch (pattern.kind()) {
      case LITERAL -> visit(((Pattern.Literal) pattern).getValue());
      case VALUE -> visit(((Pattern.Value) pattern).getValue());
      case CLASS -> {
        Pattern.ClassPattern cls = (Pattern.ClassPattern) pattern;
        visit(cls.getClassExpression());
        cls.getPositionalPatterns().forEach(this::visitPatternOperands);
        cls.getKeywordPatterns().forEach(this::visitPatternOperands);
      }
      case SEQUENCE ->
          ((Pattern.Sequence) pattern).getElements().forEach(this::visitPatternOperands);
      case MAPPING -> {
        Pattern.Mapping mapping = (Pattern.Mapping) pattern;
        visitAll(mapping.getKeys());
        mapping.getValues().forEach(this::visitPatternOperands);
      }
      case OR -> ((Pattern.Or) pattern).getAlternatives().forEach(this::visitPatternOperands);
      case AS -> visitPatternOperands(((Pattern.As) pattern).getPattern());
      case CAPTURE, WILDCARD, STAR -> {}
    }
  }

  /**
   * Binds the names a pattern captures. An or-pattern binds the same names in every alternative;
   * they are bound once, from the first.
   */
  private void bindCaptures(Pattern pattern, MatchStatement.Case matchCase) {
    switch (pattern.kind()) {
      case CAPTURE ->
          bindTarget(
              ((Pattern.Capture) pattern).getName(),
              Origin.PATTERN_CAPTURE,
              matchCase,
              ImmutableList.of(),
              pattern);
      case AS -> {
        Pattern.As as = (Pattern.As) pattern;
        bindCaptures(as.getPattern(), matchCase);
        bindTarget(as.getName(), Origin.PATTERN_CAPTURE, matchCase, ImmutableList.of(), pattern);
      }
      case STAR -> {
        Identifier name = ((Pattern.Star) pattern).getName();
        if (name != null) {
          bindTarget(name, Origin.PATTERN_CAPTURE, matchCase, ImmutableList.of(), pattern);
        }
      }
      case CLASS -> {
        Pattern.ClassPattern cls = (Pattern.ClassPattern) pattern;
        cls.getPositionalPatterns().forEach(p -> bindCaptures(p, matchCase));
        cls.getKeywordPatterns().forEach(p -> bindCaptures(p, matchCase));
      }
      case SEQUENCE ->
          ((Pattern.Sequence) pattern)
              .getElements()
              .forEach(p -> bindCaptures(p, matchCase));
      case MAPPING -> {
        Pattern.Mapping mapping = (Pattern.Mapping) pattern;
        mapping.getValues().forEach(p -> bindCaptures(p, matchCase));
        if (mapping.getRest() != null) {
          bindTarget(
              mapping.getRest(), Origin.PATTERN_CAPTURE, matchCase, ImmutableList.of(), pattern);
        }
      }
      case OR -> bindCaptures(((Pattern.Or) pattern).getAlternatives().get(0), matchCase);
      case LITERAL, VALUE, WILDCARD -> {}
    }
  }

  @Override
  public void visit(DefStatement node) {
    for (Parameter param : node.getParameters()) {
      if (param.getDefaultValue() != null) {
        visit(param.getDefaultValue());
      }
      if (param.getType() != null) {
        visit(param.getType());
      }
    }
    if (node.getReturnType() != null) {
      visit(node.getReturnType());
    }
    // The body sees free names as they are where the function is defined.
    attach(node);
    ScopeState outer = scope;
    deferred.addLast(() -> buildFunction(node, outer.built));
    bindTarget(node.getIdentifier(), Origin.DEFINITION, node, ImmutableList.of(), null);
  }

  @Override
  public void visit(ImportStatement node) {
    for (ImportStatement.Item item : node.getItems()) {
      bindTarget(item.getBoundName(), Origin.IMPORT, node, ImmutableList.of(), null);
    }
  }

  @Override
  public void visit(FromImportStatement node) {
    if (node.isWildcard()) {
      scope.hasWildcardImport = true;
      for (Span span : scope.spans) {
        span.opaque = true;
      }
      if (!isUnreachable()) {
        current = register(new WildcardImportNode(nextId(), current, node));
      }
      return;
    }
    for (FromImportStatement.Binding binding : node.getBindings()) {
      bindTarget(binding.getLocalName(), Origin.IMPORT, node, ImmutableList.of(), null);
    }
  }

  // ==== Expressions ====

  @Override
  public void visit(Identifier node) {
    attach(node);
  }

  @Override
  public void visit(DotExpression node) {
    visit(node.getObject());
    attach(node);
  }

  @Override
  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
    attach(node);
  }

  @Override
  public void visit(Argument node) {
    visit(node.getValue());
  }

  @Override
  public void visit(CallExpression node) {
    visit(node.getFunction());
    for (Argument arg : node.getArguments()) {
      visit(arg);
    }
    attach(node);
    if (!isUnreachable()) {
      // The callee may raise before returning.
      for (LabelNode target : currentExceptTargets()) {
        addAntecedent(target, current);
      }
      current = register(new CallNode(nextId(), current, node));
    }
    afterFlowNodes.put(node, current);
  }

  @Override
  public void visit(AssignmentExpression node) {
    visit(node.getValue());
    bindTarget(node.getTarget(), Origin.VALUE, node.getValue(), ImmutableList.of(), null);
    attach(node);
  }

  @Override
  public void visit(BinaryOperatorExpression node) {
    if (node.getOperator() != TokenKind.AND && node.getOperator() != TokenKind.OR) {
      super.visit(node);
      attach(node);
      return;
    }
    // The right operand runs only if the left one does not decide the result.
    BranchLabel postLabel = newBranchLabel(current);
    Span span = openSpan();
    BranchLabel preRight = newBranchLabel(null);
    if (node.getOperator() == TokenKind.AND) {
      bindConditional(node.getX(), preRight, postLabel);
    } else {
      bindConditional(node.getX(), postLabel, preRight);
    }
    current = finishLabel(preRight, null);
    visit(node.getY());
    addAntecedent(postLabel, current);
    closeSpan(span);
    current = finishLabel(postLabel, span);
    attach(node);
  }

  @Override
  public void visit(ConditionalExpression node) {
    BranchLabel postLabel = newBranchLabel(current);
    Span span = openSpan();
    BranchLabel trueLabel = newBranchLabel(null);
    BranchLabel falseLabel = newBranchLabel(null);
    bindConditional(node.getCondition(), trueLabel, falseLabel);

    current = finishLabel(trueLabel, null);
    visit(node.getThenCase());
    addAntecedent(postLabel, current);

    current = finishLabel(falseLabel, null);
    visit(node.getElseCase());
    addAntecedent(postLabel, current);

    closeSpan(span);
    current = finishLabel(postLabel, span);
    attach(node);
  }

  @Override
  public void visit(LambdaExpression node) {
    for (Parameter param : node.getParameters()) {
      if (param.getDefaultValue() != null) {
        visit(param.getDefaultValue());
      }
    }
    attach(node);
    ScopeState outer = scope;
    deferred.addLast(() -> buildLambda(node, outer.built));
  }
}
