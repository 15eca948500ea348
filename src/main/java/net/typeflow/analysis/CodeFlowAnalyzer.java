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

import com.google.auto.value.AutoValue;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import net.typeflow.analysis.TraversalContext.LoopState;
import net.typeflow.analysis.TraversalContext.Query;
import net.typeflow.flow.AssignmentNode;
import net.typeflow.flow.BranchLabel;
import net.typeflow.flow.CallNode;
import net.typeflow.flow.ConditionNode;
import net.typeflow.flow.ExhaustedMatchNode;
import net.typeflow.flow.FlowGraph;
import net.typeflow.flow.FlowNode;
import net.typeflow.flow.FlowScope;
import net.typeflow.flow.LabelNode;
import net.typeflow.flow.LinearFlowNode;
import net.typeflow.flow.LoopLabel;
import net.typeflow.flow.PatternNode;
import net.typeflow.flow.PostContextManagerLabel;
import net.typeflow.flow.PostFinallyNode;
import net.typeflow.flow.ReferenceKey;
import net.typeflow.flow.UnreachableNode;
import net.typeflow.flow.WildcardImportNode;
import net.typeflow.narrowing.NarrowingCallback;
import net.typeflow.narrowing.NarrowingRules;
import net.typeflow.narrowing.PatternNarrowing;
import net.typeflow.syntax.AssignmentExpression;
import net.typeflow.syntax.CallExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.ListExpression;
import net.typeflow.syntax.MatchStatement;
import net.typeflow.syntax.Node;
import net.typeflow.syntax.Pattern;
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypeVariableType;

/**
 * Answers narrowing and reachability queries over the flow graph of one file.
 *
 * <p>A narrowing query walks backward from a flow node to the assignments and tests that
 * determine the type of a reference there. Joins take the union of their inputs; loop heads are
 * evaluated to a fixed point. Complete results are cached per node and query for the lifetime of
 * the analyzer, which is the lifetime of its graph.
 *
 * <p>A reachability query walks backward to the start of the scope, or to a given source node,
 * looking for a live path.
 *
 * <p>The analyzer is not thread-safe. Nested queries issued by the type evaluator while a query
 * runs share its traversal state.
 */
public final class CodeFlowAnalyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The arguments of a reachability query. */
  @AutoValue
  abstract static class ReachabilityQuery {
    abstract int getNodeId();

    abstract int getSourceId();

    abstract boolean isIgnoreNoReturn();

    static ReachabilityQuery create(FlowNode node, @Nullable FlowNode source, boolean ignore) {
      return new AutoValue_CodeFlowAnalyzer_ReachabilityQuery(
          node.getId(), source == null ? -1 : source.getId(), ignore);
    }
  }

  /** A type-dependent fact about one node, optionally concerning one reference. */
  @AutoValue
  abstract static class Check {
    abstract int getNodeId();

    @Nullable
    abstract ReferenceKey getKey();

    static Check create(FlowNode node, @Nullable ReferenceKey key) {
      return new AutoValue_CodeFlowAnalyzer_Check(node.getId(), key);
    }
  }

  private final FlowGraph graph;
  private final FlowOptions options;
  private final CancellationToken token;
  private final TypeEvaluator evaluator;

  // Complete results of queries made with every finally gate open.
  private final Table<Integer, Query, FlowNodeTypeResult> cache = HashBasedTable.create();
  private final Map<ReachabilityQuery, Reachability> reachabilityCache = new HashMap<>();
  private final Set<ReachabilityQuery> reachabilityInProgress = new HashSet<>();
  // Settled answers of the type-dependent checks: non-returning calls, impossible conditions,
  // impossible patterns and exhausted matches.
  private final Map<Check, Boolean> settledChecks = new HashMap<>();
  private final Set<Check> checksInProgress = new HashSet<>();
  private final Set<FlowScope> reportedScopes = new HashSet<>();

  @Nullable private TraversalContext active;
  // Counts answers that were guessed to break a cycle; results depending on one are not cached.
  private int guesses;

  public CodeFlowAnalyzer(
      FlowGraph graph,
      TypeEvaluator.Factory evaluatorFactory,
      FlowOptions options,
      CancellationToken token) {
    this.graph = graph;
    this.options = options;
    this.token = token;
    this.evaluator = evaluatorFactory.create(this);
  }

  public FlowGraph getGraph() {
    return graph;
  }

  public FlowOptions getOptions() {
    return options;
  }

  public TypeEvaluator getEvaluator() {
    return evaluator;
  }

  // ==== Narrowing ====

  /**
   * Returns the narrowed type of {@code reference} at {@code node}, given its type at the start
   * of the enclosing scope.
   *
   * <p>The result is Never if the node is unreachable. It is aborted if the scope is too complex
   * to analyze, or if the query ran out of its visit budget or was cancelled.
   */
  public FlowNodeTypeResult narrow(FlowNode node, ReferenceKey reference, StaticType typeAtStart) {
    FlowScope scope = graph.getScopeOf(node);
    if (scope != null && ComplexityGuard.exceedsCeiling(scope, options)) {
      if (reportedScopes.add(scope)) {
        logger.atInfo().log(
            "skipping flow analysis of %s: complexity %d exceeds %d",
            scope, scope.getComplexity(), options.maxCodeComplexity());
      }
      return FlowNodeTypeResult.aborted(Types.UNKNOWN);
    }
    boolean outermost = active == null;
    if (outermost && reachabilityInProgress.isEmpty() && !reachable(node).isReachable()) {
      return FlowNodeTypeResult.complete(Types.NEVER);
    }
    if (scope != null && !scope.isTracked(reference.withoutDisambiguator())) {
      return FlowNodeTypeResult.complete(typeAtStart);
    }
    Query query = Query.create(reference, typeAtStart);
    if (!outermost) {
      return visit(node, query, active);
    }
    TraversalContext ctx = new TraversalContext(new ComplexityGuard(options, token));
    active = ctx;
    try {
      FlowNodeTypeResult result = visit(node, query, ctx);
      if (ctx.guard.isAborted() && !result.isAborted()) {
        // A nested reachability walk ran out of budget and guessed.
        result = FlowNodeTypeResult.aborted(result.getType());
      }
      if (result.isAborted()) {
        logger.atFine().log(
            "narrowing of %s at %s aborted after %d visits (%s)",
            reference, node, ctx.guard.getVisits(), ctx.guard.abortReason());
      }
      return result;
    } finally {
      active = null;
    }
  }

  @Nullable
  private FlowNodeTypeResult lookup(FlowNode node, Query query, TraversalContext ctx) {
    return ctx.isSpeculative()
        ? ctx.getSpeculative(node.getId(), query)
        : cache.get(node.getId(), query);
  }

  private FlowNodeTypeResult store(
      FlowNode node, Query query, TraversalContext ctx, FlowNodeTypeResult result) {
    if (!result.isIncomplete()) {
      if (ctx.isSpeculative()) {
        ctx.putSpeculative(node.getId(), query, result);
      } else {
        cache.put(node.getId(), query, result);
      }
    }
    return result;
  }

  private FlowNodeTypeResult visit(FlowNode start, Query query, TraversalContext ctx) {
    ReferenceKey key = query.getKey().withoutDisambiguator();
    FlowNode node = start;
    while (true) {
      if (!ctx.guard.tryVisit()) {
        return FlowNodeTypeResult.aborted(Types.UNKNOWN);
      }
      FlowNodeTypeResult cached = lookup(node, query, ctx);
      if (cached != null) {
        return cached;
      }
      FlowNode current = node;
      // A null result continues the walk at the antecedent of a linear node.
      FlowNodeTypeResult result =
          switch (node.kind()) {
            case START ->
                store(current, query, ctx, FlowNodeTypeResult.complete(query.getTypeAtStart()));
            case UNREACHABLE ->
                store(current, query, ctx, FlowNodeTypeResult.complete(Types.NEVER));
            case VARIABLE_ANNOTATION -> null;
            case WILDCARD_IMPORT -> visitWildcardImport((WildcardImportNode) node, key, query, ctx);
            case CALL ->
                isCallNoReturn((CallNode) node)
                    ? store(current, query, ctx, FlowNodeTypeResult.complete(Types.NEVER))
                    : null;
            case ASSIGNMENT -> visitAssignment((AssignmentNode) node, key, query, ctx);
            case CONDITION -> visitCondition((ConditionNode) node, key, query, ctx);
            case PATTERN -> visitPattern((PatternNode) node, key, query, ctx);
            case EXHAUSTED_MATCH ->
                isMatchExhausted((ExhaustedMatchNode) node)
                    ? store(current, query, ctx, FlowNodeTypeResult.complete(Types.NEVER))
                    : null;
            case BRANCH_LABEL -> visitBranchLabel((BranchLabel) node, key, query, ctx);
            case LOOP_LABEL -> visitLoopLabel((LoopLabel) node, key, query, ctx);
            case POST_CONTEXT_MANAGER ->
                isContextManagerPathBlocked((PostContextManagerLabel) node)
                    ? store(current, query, ctx, FlowNodeTypeResult.complete(Types.NEVER))
                    : store(current, query, ctx, join((LabelNode) current, query, ctx));
            case PRE_FINALLY_GATE ->
                // Not cached: the answer depends on the gate.
                ctx.isGateClosed(node.getId()) ? FlowNodeTypeResult.complete(Types.NEVER) : null;
            case POST_FINALLY -> visitPostFinally((PostFinallyNode) node, query, ctx);
          };
      if (result != null) {
        return result;
      }
      node = ((LinearFlowNode) node).getAntecedent();
    }
  }

  @Nullable
  private FlowNodeTypeResult visitWildcardImport(
      WildcardImportNode node, ReferenceKey key, Query query, TraversalContext ctx) {
    if (!key.isName()) {
      return null;
    }
    StaticType imported = evaluator.getTypeOfWildcardImport(node, key.getRootName());
    return imported == null
        ? null
        : store(node, query, ctx, FlowNodeTypeResult.complete(imported));
  }

  @Nullable
  private FlowNodeTypeResult visitAssignment(
      AssignmentNode node, ReferenceKey key, Query query, TraversalContext ctx) {
    if (node.getKey().equals(key)) {
      return store(node, query, ctx, assignedType(node, key, query));
    }
    if (node.getKey().isPartialMatchOf(key)) {
      // The object the reference belongs to was rebound: earlier narrowing no longer holds.
      return store(node, query, ctx, FlowNodeTypeResult.complete(query.getTypeAtStart()));
    }
    return null;
  }

  private FlowNodeTypeResult assignedType(AssignmentNode node, ReferenceKey key, Query query) {
    // An assignment on a dead path, e.g. after a call that never returns, binds nothing.
    if (!reachable(node).isReachable()) {
      return FlowNodeTypeResult.complete(Types.NEVER);
    }
    if (node.isUnbind()) {
      // Deleting a member or an element does not make the path unbound.
      return FlowNodeTypeResult.complete(key.isName() ? Types.UNBOUND : query.getTypeAtStart());
    }
    return evaluator.getTypeOfAssignment(node);
  }

  @Nullable
  private FlowNodeTypeResult visitCondition(
      ConditionNode node, ReferenceKey key, Query query, TraversalContext ctx) {
    if (node.getPolarity().isNeverVariant()) {
      return isConditionImpossible(node, key)
          ? store(node, query, ctx, FlowNodeTypeResult.complete(Types.NEVER))
          : null;
    }
    if (!node.getReferences().containsKey(key)) {
      return null;
    }
    NarrowingCallback callback =
        NarrowingRules.getCallback(node.getTest(), key, node.isPositive(), evaluator);
    if (callback == null) {
      return null;
    }
    FlowNodeTypeResult before = visit(node.getAntecedent(), query, ctx);
    if (before.isAborted()) {
      return before;
    }
    StaticType narrowed = callback.narrow(before.getType());
    return store(
        node, query, ctx, before.withType(narrowed != null ? narrowed : before.getType()));
  }

  @Nullable
  private FlowNodeTypeResult visitPattern(
      PatternNode node, ReferenceKey key, Query query, TraversalContext ctx) {
    if (!node.getReferences().containsKey(key)) {
      return null;
    }
    FlowNodeTypeResult before = visit(node.getAntecedent(), query, ctx);
    if (before.isAborted()) {
      return before;
    }
    return store(node, query, ctx, before.withType(projectPattern(node, key, before.getType())));
  }

  /**
   * Applies the narrowing of a case to a reference: the subject itself, an element of a tuple
   * subject, or the object a member subject belongs to.
   */
  private StaticType projectPattern(PatternNode node, ReferenceKey key, StaticType type) {
    Expression subject = node.getSubject();
    Pattern pattern = node.getCase().getPattern();
    boolean positive = node.isPositive();
    if (subject instanceof AssignmentExpression walrus) {
      if (key.equals(ReferenceKey.of(walrus.getTarget()))) {
        return PatternNarrowing.narrowForPattern(type, pattern, positive, evaluator);
      }
      subject = walrus.getValue();
    }
    ReferenceKey subjectKey = ReferenceKey.of(subject);
    if (key.equals(subjectKey)) {
      return PatternNarrowing.narrowForPattern(type, pattern, positive, evaluator);
    }
    StaticType narrowed = null;
    if (subject instanceof ListExpression tuple && tuple.isTuple()) {
      List<Expression> elements = tuple.getElements();
      for (int i = 0; i < elements.size(); i++) {
        if (key.equals(ReferenceKey.of(elements.get(i)))) {
          narrowed =
              PatternNarrowing.narrowSubjectElement(
                  type, pattern, i, elements.size(), positive, evaluator);
          break;
        }
      }
    } else if (subjectKey != null && key.equals(subjectKey.getParent())) {
      narrowed = PatternNarrowing.narrowSubjectParent(type, subject, pattern, positive, evaluator);
    }
    return narrowed != null ? narrowed : type;
  }

  private FlowNodeTypeResult visitBranchLabel(
      BranchLabel label, ReferenceKey key, Query query, TraversalContext ctx) {
    FlowNode preBranch = label.getPreBranchAntecedent();
    if (preBranch != null && label.isUnaffected(key)) {
      if (!reachable(label).isReachable()) {
        return store(label, query, ctx, FlowNodeTypeResult.complete(Types.NEVER));
      }
      return visit(preBranch, query, ctx);
    }
    return store(label, query, ctx, join(label, query, ctx));
  }

  /** Returns the union of the results of a label's antecedents. */
  private FlowNodeTypeResult join(LabelNode label, Query query, TraversalContext ctx) {
    List<StaticType> types = new ArrayList<>();
    boolean incomplete = false;
    for (FlowNode antecedent : label.getAntecedents()) {
      FlowNodeTypeResult result = visit(antecedent, query, ctx);
      if (result.isAborted()) {
        return result;
      }
      types.add(result.getType());
      incomplete |= result.isIncomplete();
    }
    StaticType union = Types.union(types);
    return incomplete ? FlowNodeTypeResult.incomplete(union) : FlowNodeTypeResult.complete(union);
  }

  /**
   * Evaluates a loop head to a fixed point. While the loop is under evaluation, revisiting its
   * head yields the union accumulated so far as an incomplete placeholder; the head is
   * re-evaluated until its union stops changing.
   */
  private FlowNodeTypeResult visitLoopLabel(
      LoopLabel loop, ReferenceKey key, Query query, TraversalContext ctx) {
    LoopState state = ctx.getLoop(loop.getId(), query);
    if (state != null) {
      ctx.notePlaceholder(state);
      return FlowNodeTypeResult.incomplete(
          state.accumulated != null ? state.accumulated : Types.UNKNOWN);
    }
    if (loop.isUnaffected(key)) {
      FlowNode entry = loop.getEntry();
      if (entry == null || !reachable(loop).isReachable()) {
        return store(loop, query, ctx, FlowNodeTypeResult.complete(Types.NEVER));
      }
      return visit(entry, query, ctx);
    }

    state = ctx.enterLoop(loop.getId(), query);
    try {
      StaticType previous = null;
      for (int attempt = 1; ; attempt++) {
        state.selfReferenced = false;
        boolean incomplete = false;
        List<StaticType> types = new ArrayList<>();
        for (FlowNode antecedent : loop.getAntecedents()) {
          FlowNodeTypeResult result = visit(antecedent, query, ctx);
          if (result.isAborted()) {
            return result;
          }
          types.add(result.getType());
          incomplete |= result.isIncomplete();
          state.accumulated =
              state.accumulated == null
                  ? result.getType()
                  : Types.union(state.accumulated, result.getType());
        }
        StaticType union = Types.union(types);
        if (!incomplete) {
          return store(loop, query, ctx, FlowNodeTypeResult.complete(union));
        }
        if (!state.selfReferenced) {
          // Incomplete only because of an enclosing computation; iterating would not help.
          return FlowNodeTypeResult.incomplete(union);
        }
        if (union.equals(previous)) {
          StaticType converged = dropPlaceholders(union);
          return state.dependsOnOuter
              ? FlowNodeTypeResult.incomplete(converged)
              : store(loop, query, ctx, FlowNodeTypeResult.complete(converged));
        }
        if (attempt >= options.maxLoopConvergenceAttempts()) {
          logger.atFine().log(
              "%s did not converge for %s after %d attempts", loop, query.getKey(), attempt);
          return FlowNodeTypeResult.incomplete(dropPlaceholders(union));
        }
        previous = union;
        state.accumulated = union;
      }
    } finally {
      ctx.exitLoop(loop.getId(), query, state);
    }
  }

  private static StaticType dropPlaceholders(StaticType type) {
    if (!TypeRelations.containsUnknown(type)) {
      return type;
    }
    StaticType rest = TypeRelations.removeUnknown(type);
    return TypeRelations.isNever(rest) ? type : rest;
  }

  /**
   * Evaluates the code before a {@code finally} block with its gate closed, so that only the
   * normal completion of the protected region is seen.
   */
  private FlowNodeTypeResult visitPostFinally(
      PostFinallyNode node, Query query, TraversalContext ctx) {
    int gate = node.getGate().getId();
    if (ctx.isGateClosed(gate)) {
      return visit(node.getAntecedent(), query, ctx);
    }
    ctx.closeGate(gate);
    FlowNodeTypeResult result;
    try {
      result = visit(node.getAntecedent(), query, ctx);
    } finally {
      ctx.openGate(gate);
    }
    return store(node, query, ctx, result);
  }

  // ==== Type-dependent checks ====

  /**
   * Runs a check once; its answer is kept if it was settled, i.e. it did not depend on an
   * incomplete type or a guess. A check that is re-entered while it runs answers false.
   */
  private boolean settle(Check check, Supplier<Boolean> computation) {
    Boolean settled = settledChecks.get(check);
    if (settled != null) {
      return settled;
    }
    if (!checksInProgress.add(check)) {
      guesses++;
      return false;
    }
    int guessesBefore = guesses;
    boolean answer;
    try {
      Boolean computed = computation.get();
      if (computed == null) {
        guesses++;
        return false;
      }
      answer = computed;
    } finally {
      checksInProgress.remove(check);
    }
    if (guesses == guessesBefore) {
      settledChecks.put(check, answer);
    }
    return answer;
  }

  private boolean isCallNoReturn(CallNode node) {
    return settle(Check.create(node, null), () -> evaluator.isCallNoReturn(node));
  }

  /**
   * Reports whether the test of a condition is impossible on its path for some reference other
   * than {@code skip}: narrowing the reference's type before the test by the test leaves nothing.
   * Only references with declared types are considered.
   */
  private boolean isConditionImpossible(ConditionNode node, @Nullable ReferenceKey skip) {
    for (Map.Entry<ReferenceKey, Expression> e : node.getReferences().entrySet()) {
      if (!e.getKey().equals(skip) && isReferenceImpossible(node, e.getKey(), e.getValue())) {
        return true;
      }
    }
    return false;
  }

  private boolean isReferenceImpossible(
      ConditionNode node, ReferenceKey key, Expression reference) {
    return settle(
        Check.create(node, key),
        () -> {
          if (evaluator.getDeclaredType(reference) == null) {
            return false;
          }
          NarrowingCallback callback =
              NarrowingRules.getCallback(node.getTest(), key, node.isPositive(), evaluator);
          if (callback == null) {
            return false;
          }
          FlowNodeTypeResult before =
              evaluator.getTypeOfReferenceAt(reference, node.getAntecedent());
          if (before.isIncomplete()) {
            return null;
          }
          StaticType narrowed = callback.narrow(before.getType());
          return TypeRelations.isNever(narrowed != null ? narrowed : before.getType());
        });
  }

  /** Reports whether a case can never be taken, or never be passed over. */
  private boolean isPatternImpossible(PatternNode node) {
    return settle(
        Check.create(node, null),
        () -> {
          Expression subject = node.getSubject();
          Expression reference =
              subject instanceof AssignmentExpression walrus ? walrus.getTarget() : subject;
          if (ReferenceKey.of(reference) != null) {
            FlowNodeTypeResult narrowed = evaluator.getTypeOfReferenceAt(reference, node);
            return narrowed.isIncomplete() ? null : TypeRelations.isNever(narrowed.getType());
          }
          StaticType type = evaluator.getTypeOfExpression(subject);
          return TypeRelations.isNever(
              PatternNarrowing.narrowForPattern(
                  type, node.getCase().getPattern(), node.isPositive(), evaluator));
        });
  }

  /** Reports whether the cases of a match leave nothing of its subject. */
  private boolean isMatchExhausted(ExhaustedMatchNode node) {
    return settle(
        Check.create(node, null),
        () -> {
          Expression subject = node.getSubject();
          Expression reference =
              subject instanceof AssignmentExpression walrus ? walrus.getTarget() : subject;
          if (ReferenceKey.of(reference) != null) {
            FlowNodeTypeResult remaining =
                evaluator.getTypeOfReferenceAt(reference, node.getAntecedent());
            return remaining.isIncomplete() ? null : TypeRelations.isNever(remaining.getType());
          }
          StaticType remaining = evaluator.getTypeOfExpression(subject);
          for (MatchStatement.Case matchCase : node.getCases()) {
            if (matchCase.getGuard() == null) {
              remaining =
                  PatternNarrowing.narrowForPattern(
                      remaining, matchCase.getPattern(), false, evaluator);
            }
          }
          return TypeRelations.isNever(remaining);
        });
  }

  /**
   * Reports whether the path through a context manager label is impossible: the exceptional
   * path when some manager swallows exceptions, the swallowed path when none does.
   */
  private boolean isContextManagerPathBlocked(PostContextManagerLabel label) {
    boolean swallows = false;
    for (Expression manager : label.getContextManagers()) {
      swallows |= evaluator.isExceptionContextManager(manager);
    }
    return swallows == label.isBlockedIfSwallowsExceptions();
  }

  // ==== Reachability ====

  /** Reports whether a node is reachable from the start of its scope. */
  public Reachability reachable(FlowNode node) {
    return reachable(node, null, false);
  }

  /**
   * Reports whether {@code node} is reachable from {@code source}, or from the start of its scope
   * if {@code source} is null. If {@code ignoreNoReturn} is set, calls that never return do not
   * end paths.
   *
   * <p>An aborted query answers {@link Reachability#REACHABLE}.
   */
  public Reachability reachable(
      FlowNode node, @Nullable FlowNode source, boolean ignoreNoReturn) {
    ReachabilityQuery query = ReachabilityQuery.create(node, source, ignoreNoReturn);
    Reachability cached = reachabilityCache.get(query);
    if (cached != null) {
      return cached;
    }
    if (!reachabilityInProgress.add(query)) {
      guesses++;
      return Reachability.REACHABLE;
    }
    ComplexityGuard guard = active != null ? active.guard : new ComplexityGuard(options, token);
    int guessesBefore = guesses;
    Reachability result;
    try {
      result = new ReachabilityWalk(source, ignoreNoReturn, guard).walk(node);
    } finally {
      reachabilityInProgress.remove(query);
    }
    if (guard.isAborted()) {
      guesses++;
      logger.atFine().log("reachability of %s aborted (%s)", node, guard.abortReason());
      return Reachability.REACHABLE;
    }
    if (guesses == guessesBefore) {
      reachabilityCache.put(query, result);
    }
    return result;
  }

  /**
   * Reports whether control can continue after a statement or call completes; for a function
   * definition or lambda, whether its body can complete normally.
   */
  public boolean isAfterNodeReachable(Node node) {
    FlowScope scope = graph.getScope(node);
    FlowNode after = scope != null ? scope.getReturnNode() : graph.getAfterFlowNode(node);
    return after != null && reachable(after).isReachable();
  }

  /** One backward reachability walk. */
  private final class ReachabilityWalk {
    @Nullable private final FlowNode source;
    private final boolean ignoreNoReturn;
    private final ComplexityGuard guard;
    private final Set<Integer> visited = new HashSet<>();
    private final Set<Integer> closedGates = new HashSet<>();

    ReachabilityWalk(@Nullable FlowNode source, boolean ignoreNoReturn, ComplexityGuard guard) {
      this.source = source;
      this.ignoreNoReturn = ignoreNoReturn;
      this.guard = guard;
    }

    Reachability walk(FlowNode start) {
      FlowNode node = start;
      while (true) {
        if (!guard.tryVisit() || node == source) {
          return Reachability.REACHABLE;
        }
        if (!visited.add(node.getId())) {
          // Already explored on another path.
          return Reachability.UNREACHABLE_STRUCTURAL;
        }
        // A null result continues the walk at the antecedent of a linear node.
        Reachability result =
            switch (node.kind()) {
              case START ->
                  source == null ? Reachability.REACHABLE : Reachability.UNREACHABLE_STRUCTURAL;
              case UNREACHABLE ->
                  ((UnreachableNode) node).getReason() == UnreachableNode.Reason.STATIC_CONDITION
                      ? Reachability.UNREACHABLE_STATIC_CONDITION
                      : Reachability.UNREACHABLE_STRUCTURAL;
              case VARIABLE_ANNOTATION, ASSIGNMENT, WILDCARD_IMPORT -> null;
              case CALL ->
                  !ignoreNoReturn && isCallNoReturn((CallNode) node)
                      ? Reachability.UNREACHABLE_BY_ANALYSIS
                      : null;
              case CONDITION ->
                  isConditionImpossible((ConditionNode) node, null)
                      ? Reachability.UNREACHABLE_BY_ANALYSIS
                      : null;
              case PATTERN ->
                  isPatternImpossible((PatternNode) node)
                      ? Reachability.UNREACHABLE_BY_ANALYSIS
                      : null;
              case EXHAUSTED_MATCH ->
                  isMatchExhausted((ExhaustedMatchNode) node)
                      ? Reachability.UNREACHABLE_BY_ANALYSIS
                      : null;
              case PRE_FINALLY_GATE ->
                  closedGates.contains(node.getId()) ? Reachability.UNREACHABLE_STRUCTURAL : null;
              case POST_FINALLY -> walkPostFinally((PostFinallyNode) node);
              case POST_CONTEXT_MANAGER ->
                  isContextManagerPathBlocked((PostContextManagerLabel) node)
                      ? Reachability.UNREACHABLE_BY_ANALYSIS
                      : walkLabel((LabelNode) node);
              case BRANCH_LABEL, LOOP_LABEL -> walkLabel((LabelNode) node);
            };
        if (result != null) {
          return result;
        }
        node = ((LinearFlowNode) node).getAntecedent();
      }
    }

    private Reachability walkLabel(LabelNode label) {
      Reachability strongest = null;
      for (FlowNode antecedent : label.getAntecedents()) {
        Reachability result = walk(antecedent);
        if (result.isReachable()) {
          return result;
        }
        strongest = strongest == null ? result : options.strongest(strongest, result);
      }
      return strongest != null ? strongest : Reachability.UNREACHABLE_STRUCTURAL;
    }

    private Reachability walkPostFinally(PostFinallyNode node) {
      int gate = node.getGate().getId();
      if (!closedGates.add(gate)) {
        return walk(node.getAntecedent());
      }
      try {
        return walk(node.getAntecedent());
      } finally {
        closedGates.remove(gate);
      }
    }
  }

  // ==== Constrained type variables ====

  /**
   * Returns the constraints of a constrained type variable that remain possible at {@code node},
   * given the {@code isinstance} tests on references declared with the variable that dominate it.
   * Returns all constraints if nothing is known.
   */
  public ImmutableList<StaticType> narrowConstrainedTypeVariable(
      FlowNode node, TypeVariableType typeVariable) {
    List<StaticType> remaining =
        new ConstraintWalk(typeVariable).walk(node, new HashSet<>(), new HashSet<>());
    return remaining == null ? typeVariable.getConstraints() : ImmutableList.copyOf(remaining);
  }

  /** One backward walk collecting the constraints of a type variable that remain possible. */
  private final class ConstraintWalk {
    private final TypeVariableType typeVariable;
    private final Set<Integer> visited = new HashSet<>();

    ConstraintWalk(TypeVariableType typeVariable) {
      this.typeVariable = typeVariable;
    }

    /**
     * Returns the remaining constraints, or null if the path says nothing about them. {@code
     * assigned} holds the references rebound between the query node and the current node;
     * tests of them no longer apply.
     */
    @Nullable
    List<StaticType> walk(FlowNode start, Set<ReferenceKey> assigned, Set<Integer> onPath) {
      FlowNode node = start;
      while (true) {
        if (!onPath.add(node.getId())) {
          return null;
        }
        switch (node.kind()) {
          case START, UNREACHABLE, PRE_FINALLY_GATE:
            return null;
          case BRANCH_LABEL, LOOP_LABEL, POST_CONTEXT_MANAGER:
            return walkLabel((LabelNode) node, assigned, onPath);
          case ASSIGNMENT:
            assigned = new HashSet<>(assigned);
            assigned.add(((AssignmentNode) node).getKey());
            break;
          case CONDITION:
            {
              List<StaticType> narrowed = walkCondition((ConditionNode) node, assigned, onPath);
              if (narrowed != null) {
                return narrowed;
              }
              break;
            }
          case VARIABLE_ANNOTATION,
              WILDCARD_IMPORT,
              CALL,
              PATTERN,
              EXHAUSTED_MATCH,
              POST_FINALLY:
            break;
        }
        node = ((LinearFlowNode) node).getAntecedent();
      }
    }

    @Nullable
    private List<StaticType> walkLabel(
        LabelNode label, Set<ReferenceKey> assigned, Set<Integer> onPath) {
      if (label.getAntecedents().isEmpty()) {
        return null;
      }
      Set<StaticType> union = new LinkedHashSet<>();
      for (FlowNode antecedent : label.getAntecedents()) {
        List<StaticType> remaining = walk(antecedent, assigned, new HashSet<>(onPath));
        if (remaining == null) {
          return null;
        }
        union.addAll(remaining);
      }
      // Keep declaration order.
      List<StaticType> result = new ArrayList<>();
      for (StaticType constraint : typeVariable.getConstraints()) {
        if (union.contains(constraint)) {
          result.add(constraint);
        }
      }
      return result;
    }

    @Nullable
    private List<StaticType> walkCondition(
        ConditionNode node, Set<ReferenceKey> assigned, Set<Integer> onPath) {
      if (node.getPolarity().isNeverVariant()
          || !(node.getTest() instanceof CallExpression call)
          || !"isinstance".equals(call.getCalleeName())
          || call.getPositionalArgumentCount() != 2) {
        return null;
      }
      Expression subject = call.getPositionalArgument(0);
      ReferenceKey key = ReferenceKey.of(subject);
      if (key == null
          || assigned.contains(key)
          || !typeVariable.equals(evaluator.getDeclaredType(subject))
          || !visited.add(node.getId())) {
        return null;
      }
      List<StaticType> filters = new ArrayList<>();
      StaticType classInfo = evaluator.getTypeOfExpression(call.getPositionalArgument(1));
      for (StaticType member :
          classInfo instanceof TupleType tuple
              ? tuple.getElementTypes()
              : Types.unfoldUnion(classInfo)) {
        if (!(member instanceof ClassObjectType cls)) {
          visited.remove(node.getId());
          return null;
        }
        filters.add(cls.getInstanceType());
      }
      List<StaticType> prior;
      try {
        prior = walk(node.getAntecedent(), assigned, onPath);
      } finally {
        visited.remove(node.getId());
      }
      List<StaticType> result = new ArrayList<>();
      for (StaticType constraint : prior != null ? prior : typeVariable.getConstraints()) {
        boolean matches = false;
        for (StaticType filter : filters) {
          matches |= TypeRelations.isAssignable(filter, constraint);
        }
        if (matches == node.isPositive()) {
          result.add(constraint);
        }
      }
      return result;
    }
  }

  // ==== Debugging ====

  /** Returns a readable dump of the graph reachable backward from {@code node}. */
  public String printGraph(FlowNode node) {
    return FlowGraphPrinter.print(node);
  }
}
