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
package net.typeflow.evaluator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.typeflow.analysis.CodeFlowAnalyzer;
import net.typeflow.analysis.FlowNodeTypeResult;
import net.typeflow.analysis.TypeEvaluator;
import net.typeflow.flow.AssignmentNode;
import net.typeflow.flow.CallNode;
import net.typeflow.flow.FlowGraph;
import net.typeflow.flow.FlowNode;
import net.typeflow.flow.FlowScope;
import net.typeflow.flow.LinearFlowNode;
import net.typeflow.flow.NarrowingTargets;
import net.typeflow.flow.PatternNode;
import net.typeflow.flow.ReferenceKey;
import net.typeflow.flow.WildcardImportNode;
import net.typeflow.narrowing.ContainerNarrowing;
import net.typeflow.narrowing.PatternNarrowing;
import net.typeflow.syntax.AssignmentExpression;
import net.typeflow.syntax.AssignmentStatement;
import net.typeflow.syntax.BinaryOperatorExpression;
import net.typeflow.syntax.BoolLiteral;
import net.typeflow.syntax.CallExpression;
import net.typeflow.syntax.ConditionalExpression;
import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.DictExpression;
import net.typeflow.syntax.DotExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.FromImportStatement;
import net.typeflow.syntax.Identifier;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.IntLiteral;
import net.typeflow.syntax.LambdaExpression;
import net.typeflow.syntax.ListExpression;
import net.typeflow.syntax.MatchStatement;
import net.typeflow.syntax.Parameter;
import net.typeflow.syntax.StringLiteral;
import net.typeflow.syntax.SyntaxError;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.TryStatement;
import net.typeflow.syntax.UnaryOperatorExpression;
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.DictType;
import net.typeflow.types.Types.ListType;
import net.typeflow.types.Types.LiteralType;
import net.typeflow.types.Types.OverloadedType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypedDictType;

/**
 * A type evaluator for the expressions of one file, built on the narrowing queries of a {@link
 * CodeFlowAnalyzer}.
 *
 * <p>A reference expression (a name, or an attribute or subscript chain over one) evaluates to its
 * type narrowed at the flow node the expression is attached to. Other expressions are evaluated
 * bottom-up from their operands. The type of a name at the start of its scope is Unbound if the
 * scope binds it; otherwise it is the type of the name in the enclosing scope where the scope is
 * defined, or its type in the {@link TypeEnvironment}.
 *
 * <p>Values the evaluator knows nothing about have type {@code Any}.
 */
public final class SimpleTypeEvaluator implements TypeEvaluator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final CodeFlowAnalyzer analyzer;
  private final FlowGraph graph;
  private final TypeEnvironment env;
  private final TypeExpressionResolver resolver;
  // Functions whose no-return inference is under way.
  private final Set<DefStatement> inferring = Collections.newSetFromMap(new IdentityHashMap<>());

  private SimpleTypeEvaluator(CodeFlowAnalyzer analyzer, TypeEnvironment env) {
    this.analyzer = analyzer;
    this.graph = analyzer.getGraph();
    this.env = env;
    this.resolver = new TypeExpressionResolver(env);
  }

  /** Returns a factory creating evaluators against the given environment. */
  public static TypeEvaluator.Factory factory(TypeEnvironment env) {
    return analyzer -> new SimpleTypeEvaluator(analyzer, env);
  }

  /** Returns the problems found in the annotations resolved so far. */
  public ImmutableList<SyntaxError> getAnnotationErrors() {
    return resolver.getErrors();
  }

  /** Collects whether an evaluation depended on an incomplete or aborted flow query. */
  private static final class Evaluation {
    boolean incomplete;
    boolean aborted;

    StaticType absorb(FlowNodeTypeResult result) {
      incomplete |= result.isIncomplete();
      aborted |= result.isAborted();
      return result.getType();
    }

    FlowNodeTypeResult result(StaticType type) {
      if (aborted) {
        return FlowNodeTypeResult.aborted(type);
      }
      return incomplete ? FlowNodeTypeResult.incomplete(type) : FlowNodeTypeResult.complete(type);
    }
  }

  // ==== Entry points ====

  /** Evaluates an expression of the analyzed file. */
  public FlowNodeTypeResult evaluate(Expression expr) {
    Evaluation ev = new Evaluation();
    StaticType type = eval(expr, ev);
    return ev.result(type);
  }

  @Override
  public StaticType getTypeOfExpression(Expression expr) {
    return eval(expr, new Evaluation());
  }

  @Override
  public FlowNodeTypeResult getTypeOfReferenceAt(Expression reference, FlowNode node) {
    Evaluation ev = new Evaluation();
    StaticType type = evalReferenceAt(reference, node, ev);
    return ev.result(type);
  }

  @Override
  public FlowNodeTypeResult getTypeOfAssignment(AssignmentNode node) {
    Evaluation ev = new Evaluation();
    StaticType type = evalAssignment(node, ev);
    return ev.result(type);
  }

  @Override
  @Nullable
  public StaticType getDeclaredType(Expression reference) {
    switch (reference.kind()) {
      case IDENTIFIER:
        return getDeclaredTypeOfName(((Identifier) reference).getName(), scopeOf(reference));
      case DOT:
        {
          DotExpression dot = (DotExpression) reference;
          StaticType base = getDeclaredType(dot.getObject());
          if (base == null) {
            return null;
          }
          for (StaticType member : Types.unfoldUnion(base)) {
            if (member.getField(dot.getField().getName()) == null) {
              return null;
            }
          }
          return fieldType(base, dot.getField().getName());
        }
      case INDEX:
        {
          IndexExpression index = (IndexExpression) reference;
          StaticType base = getDeclaredType(index.getObject());
          return base == null ? null : elementType(base, literalKey(index.getKey()));
        }
      default:
        return null;
    }
  }

  @Nullable
  private StaticType getDeclaredTypeOfName(String name, FlowScope scope) {
    for (FlowScope s = scope; s != null; s = s.getParent()) {
      if (s.isLocal(name)) {
        Expression annotation = s.getAnnotation(name);
        return annotation == null ? null : resolveAnnotation(annotation);
      }
    }
    return env.getValueType(name);
  }

  @Override
  @Nullable
  public Expression getAlias(Identifier name) {
    FlowScope scope = scopeOf(name);
    Expression alias = scope.getAlias(name.getName());
    if (alias == null) {
      return null;
    }
    // The test must denote the same values wherever the alias is used.
    for (ReferenceKey key : NarrowingTargets.of(alias).keySet()) {
      if (scope.getBindingCount(key.getRootName()) > 1) {
        return null;
      }
    }
    return alias;
  }

  @Override
  public boolean isCallNoReturn(CallNode node) {
    Expression function = node.getCall().getFunction();
    if (!(function instanceof Identifier) && !(function instanceof DotExpression)) {
      return false;
    }
    ImmutableList<StaticType> members =
        ImmutableList.copyOf(Types.unfoldUnion(getTypeOfExpression(function)));
    for (StaticType member : members) {
      if (!isNoReturnCallable(member)) {
        return false;
      }
    }
    return !members.isEmpty();
  }

  private static boolean isNoReturnCallable(StaticType type) {
    if (type instanceof CallableType callable) {
      return TypeRelations.isNever(callable.getReturnType());
    }
    if (type instanceof OverloadedType overloaded) {
      for (CallableType overload : overloaded.getOverloads()) {
        if (!TypeRelations.isNever(overload.getReturnType())) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  @Override
  public boolean isExceptionContextManager(Expression contextManager) {
    for (StaticType member : Types.unfoldUnion(getTypeOfExpression(contextManager))) {
      if (member instanceof ClassType cls && cls.isExitSwallowingExceptions()) {
        return true;
      }
    }
    return false;
  }

  @Override
  @Nullable
  public StaticType getTypeOfWildcardImport(WildcardImportNode node, String name) {
    ImmutableMap<String, StaticType> exports = env.getModule(node.getModule());
    return exports == null ? null : exports.get(name);
  }

  // ==== References ====

  private FlowScope scopeOf(Expression expr) {
    return graph.getFlowNode(expr) != null
        ? graph.getEnclosingScope(expr)
        : graph.getModuleScope();
  }

  /** Returns the type of a reference as a value: an unbound name has no useful type. */
  private static StaticType valueOf(StaticType type) {
    return TypeRelations.isUnbound(type) ? Types.ANY : TypeRelations.removeUnbound(type);
  }

  private StaticType evalReference(Expression reference, Evaluation ev) {
    FlowNode node = graph.getFlowNode(reference);
    if (node != null) {
      return valueOf(evalReferenceAt(reference, node, ev));
    }
    // Not part of the analyzed code, e.g. an operand of a forward reference.
    if (reference instanceof Identifier id) {
      StaticType type = env.getValueType(id.getName());
      return type != null ? type : Types.ANY;
    }
    return structuralMember(reference, eval(baseOf(reference), ev), ev);
  }

  /** Returns the narrowed type of a reference at a node, which may include Unbound. */
  private StaticType evalReferenceAt(Expression reference, FlowNode node, Evaluation ev) {
    ReferenceKey key = ReferenceKey.of(reference);
    if (key == null) {
      if (reference instanceof DotExpression || reference instanceof IndexExpression) {
        return structuralMember(reference, valueOf(evalAt(baseOf(reference), node, ev)), ev);
      }
      return eval(reference, ev);
    }
    FlowScope scope = graph.getScopeOf(node);
    if (scope == null) {
      return Types.NEVER;
    }
    StaticType start;
    if (reference instanceof Identifier id) {
      start = scope.isLocal(id.getName()) ? Types.UNBOUND : freeNameType(id.getName(), scope, ev);
    } else {
      StaticType base = valueOf(evalReferenceAt(baseOf(reference), node, ev));
      start = structuralMember(reference, base, ev);
    }
    return ev.absorb(analyzer.narrow(node, key, start));
  }

  private StaticType evalAt(Expression expr, FlowNode node, Evaluation ev) {
    return ReferenceKey.of(expr) != null ? evalReferenceAt(expr, node, ev) : eval(expr, ev);
  }

  private static Expression baseOf(Expression reference) {
    return reference instanceof DotExpression dot
        ? dot.getObject()
        : ((IndexExpression) reference).getObject();
  }

  /**
   * Returns the type of a name that {@code scope} does not bind: its type where the scope is
   * defined, or at the end of the enclosing scope if it is not bound yet at that point.
   */
  private StaticType freeNameType(String name, FlowScope scope, Evaluation ev) {
    FlowScope parent = scope.getParent();
    if (parent == null) {
      StaticType type = env.getValueType(name);
      return type != null ? type : Types.ANY;
    }
    StaticType start =
        parent.isLocal(name) ? Types.UNBOUND : freeNameType(name, parent, ev);
    ReferenceKey key = ReferenceKey.forName(name);
    FlowNode definition = graph.getFlowNode(scope.getDefiningNode());
    StaticType type =
        definition == null ? Types.UNBOUND : ev.absorb(analyzer.narrow(definition, key, start));
    if (TypeRelations.isUnbound(type) || TypeRelations.isNever(type)) {
      type = ev.absorb(analyzer.narrow(parent.getReturnNode(), key, start));
    }
    return valueOf(type);
  }

  /** Returns the type of an attribute or subscript of a value of type {@code base}. */
  private StaticType structuralMember(Expression reference, StaticType base, Evaluation ev) {
    if (reference instanceof DotExpression dot) {
      return fieldType(base, dot.getField().getName());
    }
    IndexExpression index = (IndexExpression) reference;
    StaticType key = literalKey(index.getKey());
    return elementType(base, key != null ? key : eval(index.getKey(), ev));
  }

  @Nullable
  private static StaticType literalKey(Expression key) {
    if (key instanceof StringLiteral str) {
      return Types.literal(str.getValue());
    }
    if (key instanceof IntLiteral i) {
      return Types.literal(i.getValue().longValue());
    }
    if (key instanceof UnaryOperatorExpression unary
        && unary.getOperator() == TokenKind.MINUS
        && unary.getX() instanceof IntLiteral i) {
      return Types.literal(-i.getValue().longValue());
    }
    return null;
  }

  private static StaticType fieldType(StaticType base, String name) {
    return Types.mapSubtypes(
        base,
        member -> {
          if (TypeRelations.isNever(member)) {
            return Types.NEVER;
          }
          StaticType field = member.getField(name);
          return field != null ? field : Types.ANY;
        });
  }

  private static StaticType elementType(StaticType base, @Nullable StaticType key) {
    return Types.mapSubtypes(base, member -> elementTypeOfMember(member, key));
  }

  private static StaticType elementTypeOfMember(StaticType member, @Nullable StaticType key) {
    if (TypeRelations.isNever(member)) {
      return Types.NEVER;
    }
    Object value = key instanceof LiteralType literal ? literal.getValue() : null;
    if (member instanceof ListType list) {
      return list.getElementType();
    }
    if (member instanceof TupleType tuple) {
      ImmutableList<StaticType> elements = tuple.getElementTypes();
      if (value instanceof Long index) {
        int i = (int) (index < 0 ? index + elements.size() : index);
        return i >= 0 && i < elements.size() ? elements.get(i) : Types.ANY;
      }
      return Types.union(elements);
    }
    if (member instanceof DictType dict) {
      return dict.getValueType();
    }
    if (member instanceof TypedDictType dict) {
      if (value instanceof String k) {
        StaticType type = dict.getKeyType(k);
        return type != null ? type : Types.ANY;
      }
      List<StaticType> values = new ArrayList<>(dict.getRequiredKeys().values());
      values.addAll(dict.getNotRequiredKeys().values());
      return Types.union(values);
    }
    if (TypeRelations.stripLiterals(member).equals(Types.STR)) {
      return Types.STR;
    }
    return Types.ANY;
  }

  // ==== Expressions ====

  private StaticType eval(Expression expr, Evaluation ev) {
    switch (expr.kind()) {
      case NONE_LITERAL -> {
        return Types.NONE;
      }
      case BOOL_LITERAL -> {
        return Types.literal(((BoolLiteral) expr).getValue());
      }
      case INT_LITERAL -> {
        return Types.literal(((IntLiteral) expr).getValue().longValue());
      }
      case FLOAT_LITERAL -> {
        return Types.FLOAT;
      }
      case STRING_LITERAL -> {
        return Types.literal(((StringLiteral) expr).getValue());
      }
      case IDENTIFIER, DOT, INDEX -> {
        return evalReference(expr, ev);
      }
      case CALL -> {
        return evalCall((CallExpression) expr, ev);
      }
      case LIST_EXPR -> {
        ListExpression list = (ListExpression) expr;
        List<StaticType> elements = new ArrayList<>();
        for (Expression element : list.getElements()) {
          elements.add(eval(element, ev));
        }
        if (list.isTuple()) {
          return Types.tuple(ImmutableList.copyOf(elements));
        }
        return Types.list(elements.isEmpty() ? Types.ANY : widen(elements));
      }
      case DICT_EXPR -> {
        List<StaticType> keys = new ArrayList<>();
        List<StaticType> values = new ArrayList<>();
        for (DictExpression.Entry entry : ((DictExpression) expr).getEntries()) {
          keys.add(eval(entry.getKey(), ev));
          values.add(eval(entry.getValue(), ev));
        }
        return keys.isEmpty()
            ? Types.dict(Types.ANY, Types.ANY)
            : Types.dict(widen(keys), widen(values));
      }
      case UNARY_OPERATOR -> {
        return evalUnary((UnaryOperatorExpression) expr, ev);
      }
      case BINARY_OPERATOR -> {
        return evalBinary((BinaryOperatorExpression) expr, ev);
      }
      case CONDITIONAL -> {
        // Each branch is attached after the condition narrowed it.
        ConditionalExpression cond = (ConditionalExpression) expr;
        return Types.union(eval(cond.getThenCase(), ev), eval(cond.getElseCase(), ev));
      }
      case ASSIGNMENT_EXPR -> {
        // The target is attached to its assignment.
        return eval(((AssignmentExpression) expr).getTarget(), ev);
      }
      case LAMBDA -> {
        ImmutableList.Builder<StaticType> params = ImmutableList.builder();
        for (Parameter param : ((LambdaExpression) expr).getParameters()) {
          if (param.getKind() == Parameter.Kind.MANDATORY
              || param.getKind() == Parameter.Kind.OPTIONAL) {
            params.add(Types.ANY);
          }
        }
        return Types.callable(params.build(), Types.ANY);
      }
    }
    throw new IllegalStateException("unexpected expression kind " + expr.kind());
  }

  // The declared type of a display's elements: literals widen to their class.
  private static StaticType widen(List<StaticType> types) {
    return TypeRelations.stripLiterals(Types.union(types));
  }

  private StaticType evalCall(CallExpression call, Evaluation ev) {
    if ("type".equals(call.getCalleeName())
        && call.getArguments().size() == 1
        && call.getPositionalArgumentCount() == 1) {
      StaticType arg = eval(call.getPositionalArgument(0), ev);
      return Types.mapSubtypes(
          TypeRelations.stripLiterals(arg),
          member -> TypeRelations.isNever(member) ? Types.NEVER : Types.classObject(member));
    }
    StaticType function = eval(call.getFunction(), ev);
    return Types.mapSubtypes(function, SimpleTypeEvaluator::returnTypeOf);
  }

  private static StaticType returnTypeOf(StaticType callee) {
    if (TypeRelations.isNever(callee)) {
      return Types.NEVER;
    }
    if (callee instanceof CallableType callable) {
      return callable.getReturnType();
    }
    if (callee instanceof OverloadedType overloaded) {
      List<StaticType> returns = new ArrayList<>();
      for (CallableType overload : overloaded.getOverloads()) {
        returns.add(overload.getReturnType());
      }
      return Types.union(returns);
    }
    if (callee instanceof ClassObjectType cls) {
      return cls.getInstanceType();
    }
    return Types.ANY;
  }

  private StaticType evalUnary(UnaryOperatorExpression unary, Evaluation ev) {
    StaticType x = eval(unary.getX(), ev);
    switch (unary.getOperator()) {
      case NOT:
        if (!TypeRelations.canBeFalsy(x)) {
          return Types.FALSE;
        }
        return TypeRelations.canBeTruthy(x) ? Types.BOOL : Types.TRUE;
      case MINUS:
        return Types.mapSubtypes(
            x,
            member -> {
              if (member instanceof LiteralType literal && literal.getValue() instanceof Long v) {
                return Types.literal(-v);
              }
              return arithmetic(TokenKind.MINUS, Types.INT, member);
            });
      default:
        return arithmetic(TokenKind.PLUS, Types.INT, x);
    }
  }

  private StaticType evalBinary(BinaryOperatorExpression binop, Evaluation ev) {
    StaticType x = eval(binop.getX(), ev);
    StaticType y = eval(binop.getY(), ev);
    switch (binop.getOperator()) {
      case AND:
        return Types.union(
            TypeRelations.removeTruthiness(x), TypeRelations.canBeTruthy(x) ? y : Types.NEVER);
      case OR:
        return Types.union(
            TypeRelations.removeFalsiness(x), TypeRelations.canBeFalsy(x) ? y : Types.NEVER);
      case EQUALS_EQUALS:
      case NOT_EQUALS:
      case LESS:
      case LESS_EQUALS:
      case GREATER:
      case GREATER_EQUALS:
      case IN:
      case NOT_IN:
      case IS:
      case IS_NOT:
        return Types.BOOL;
      case PIPE:
        if (isClassObjects(x) && isClassObjects(y)) {
          // Operands of isinstance, as in isinstance(v, int | str).
          return Types.union(x, y);
        }
        return binaryArithmetic(binop.getOperator(), x, y);
      default:
        return binaryArithmetic(binop.getOperator(), x, y);
    }
  }

  private static boolean isClassObjects(StaticType type) {
    for (StaticType member : Types.unfoldUnion(type)) {
      if (!(member instanceof ClassObjectType)) {
        return false;
      }
    }
    return true;
  }

  private static StaticType binaryArithmetic(TokenKind op, StaticType x, StaticType y) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType l : Types.unfoldUnion(TypeRelations.stripLiterals(x))) {
      for (StaticType r : Types.unfoldUnion(TypeRelations.stripLiterals(y))) {
        result.add(arithmetic(op, l, r));
      }
    }
    return Types.union(result);
  }

  private static StaticType arithmetic(TokenKind op, StaticType x, StaticType y) {
    x = TypeRelations.stripLiterals(x);
    y = TypeRelations.stripLiterals(y);
    if (TypeRelations.isNever(x) || TypeRelations.isNever(y)) {
      return Types.NEVER;
    }
    boolean xInt = x.equals(Types.INT) || x.equals(Types.BOOL);
    boolean yInt = y.equals(Types.INT) || y.equals(Types.BOOL);
    boolean xNum = xInt || x.equals(Types.FLOAT);
    boolean yNum = yInt || y.equals(Types.FLOAT);
    if (xNum && yNum) {
      return op == TokenKind.SLASH || !xInt || !yInt ? Types.FLOAT : Types.INT;
    }
    if (x.equals(Types.STR)
        && (op == TokenKind.PERCENT
            || (op == TokenKind.PLUS && y.equals(Types.STR))
            || (op == TokenKind.STAR && yInt))) {
      return Types.STR;
    }
    if (op == TokenKind.PLUS && x instanceof ListType l && y instanceof ListType r) {
      return Types.list(Types.union(l.getElementType(), r.getElementType()));
    }
    return Types.ANY;
  }

  // ==== Assignments ====

  private StaticType evalAssignment(AssignmentNode node, Evaluation ev) {
    switch (node.getOrigin()) {
      case VALUE:
        return narrowToDeclared(
            getDeclaredType(node.getTarget()), eval((Expression) node.getSource(), ev));
      case ANNOTATED:
        {
          AssignmentStatement stmt = (AssignmentStatement) node.getSource();
          return narrowToDeclared(resolveAnnotation(stmt.getType()), eval(stmt.getRHS(), ev));
        }
      case AUGMENTED:
        {
          AssignmentStatement stmt = (AssignmentStatement) node.getSource();
          StaticType before = valueOf(evalReferenceAt(stmt.getLHS(), node.getAntecedent(), ev));
          StaticType value = binaryArithmetic(stmt.getOperator(), before, eval(stmt.getRHS(), ev));
          return narrowToDeclared(getDeclaredType(node.getTarget()), value);
        }
      case UNPACK:
        return unpack(eval((Expression) node.getSource(), ev), node.getUnpackPath());
      case ITERATION:
        {
          StaticType collection = eval((Expression) node.getSource(), ev);
          StaticType element =
              TypeRelations.isNever(collection) ? Types.NEVER : iteratedType(collection);
          return unpack(element, node.getUnpackPath());
        }
      case CONTEXT_ENTER:
        {
          StaticType manager = eval((Expression) node.getSource(), ev);
          StaticType entered =
              Types.mapSubtypes(
                  manager,
                  member -> {
                    StaticType enter = member.getField("__enter__");
                    return enter instanceof CallableType callable
                        ? callable.getReturnType()
                        : member;
                  });
          return unpack(entered, node.getUnpackPath());
        }
      case EXCEPTION:
        {
          Expression type = ((TryStatement.ExceptHandler) node.getSource()).getType();
          return type == null ? Types.ANY : instancesOf(eval(type, ev));
        }
      case IMPORT:
        return importedType(node);
      case DEFINITION:
        {
          DefStatement def = (DefStatement) node.getSource();
          return resolver.resolveSignature(
              def.getParameters(),
              def.getReturnType(),
              def.getReturnType() == null && isNoReturnFunction(def) ? Types.NEVER : Types.ANY);
        }
      case PARAMETER:
        return resolver.resolveParameter((Parameter) node.getSource());
      case PATTERN_CAPTURE:
        return captureType(node, ev);
      case DELETION:
        return Types.UNBOUND;
    }
    throw new IllegalStateException("unexpected assignment origin " + node.getOrigin());
  }

  private StaticType resolveAnnotation(Expression annotation) {
    int before = resolver.getErrors().size();
    StaticType type = resolver.resolve(annotation);
    ImmutableList<SyntaxError> errors = resolver.getErrors();
    for (int i = before; i < errors.size(); i++) {
      logger.atFine().log("%s", errors.get(i));
    }
    return type;
  }

  /**
   * Returns the type a reference declared as {@code declared} has after being assigned a value of
   * type {@code assigned}: the members of the value that the declaration admits, widened to their
   * class unless the declaration itself mentions literals.
   */
  private static StaticType narrowToDeclared(@Nullable StaticType declared, StaticType assigned) {
    if (declared == null || TypeRelations.isNever(assigned)) {
      return assigned;
    }
    boolean keepLiterals = false;
    for (StaticType member : Types.unfoldUnion(declared)) {
      keepLiterals |= member instanceof LiteralType;
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(assigned)) {
      if (member.equals(Types.ANY)) {
        return declared;
      }
      StaticType candidate = keepLiterals ? member : TypeRelations.stripLiterals(member);
      if (TypeRelations.isAssignable(declared, candidate)) {
        result.add(candidate);
      } else if (TypeRelations.isAssignable(declared, member)) {
        result.add(member);
      }
    }
    return result.isEmpty() ? declared : Types.union(result);
  }

  private static StaticType unpack(StaticType type, List<Integer> path) {
    StaticType result = type;
    for (int index : path) {
      result = elementType(result, Types.literal(index));
    }
    return result;
  }

  private static StaticType iteratedType(StaticType collection) {
    StaticType element = ContainerNarrowing.elementTypeOf(collection);
    return element != null ? element : Types.ANY;
  }

  private static StaticType instancesOf(StaticType classInfo) {
    if (classInfo instanceof TupleType tuple) {
      List<StaticType> result = new ArrayList<>();
      for (StaticType element : tuple.getElementTypes()) {
        result.add(instancesOf(element));
      }
      return Types.union(result);
    }
    return Types.mapSubtypes(
        classInfo,
        member -> member instanceof ClassObjectType cls ? cls.getInstanceType() : Types.ANY);
  }

  private StaticType importedType(AssignmentNode node) {
    if (!(node.getSource() instanceof FromImportStatement stmt)) {
      // Modules are not typed.
      return Types.ANY;
    }
    ImmutableMap<String, StaticType> exports = env.getModule(stmt.getModule());
    if (exports == null) {
      return Types.ANY;
    }
    for (FromImportStatement.Binding binding : stmt.getBindings()) {
      if (binding.getLocalName() == node.getTarget()) {
        StaticType type = exports.get(binding.getName().getName());
        return type != null ? type : Types.ANY;
      }
    }
    return Types.ANY;
  }

  /**
   * Reports whether a function without a return annotation never returns: no path reaches the end
   * of its body or a return statement.
   */
  private boolean isNoReturnFunction(DefStatement def) {
    if (!inferring.add(def)) {
      // Recursive: assume it returns.
      return false;
    }
    try {
      return !analyzer.isAfterNodeReachable(def);
    } finally {
      inferring.remove(def);
    }
  }

  /**
   * Returns the type a case pattern binds to a captured name: the capture's part of the subject
   * as narrowed by the successful match of the case.
   */
  private StaticType captureType(AssignmentNode node, Evaluation ev) {
    MatchStatement.Case matchCase = (MatchStatement.Case) node.getSource();
    FlowNode current = node.getAntecedent();
    while (!(current instanceof PatternNode pattern
        && pattern.getCase() == matchCase
        && pattern.isPositive())) {
      if (!(current instanceof LinearFlowNode linear)) {
        return Types.ANY;
      }
      current = linear.getAntecedent();
    }
    PatternNode match = (PatternNode) current;
    Expression subject = match.getSubject();
    Expression reference =
        subject instanceof AssignmentExpression walrus ? walrus.getTarget() : subject;
    StaticType subjectType;
    if (ReferenceKey.of(reference) != null) {
      subjectType = valueOf(evalReferenceAt(reference, match, ev));
    } else {
      subjectType =
          PatternNarrowing.narrowForPattern(
              eval(subject, ev), matchCase.getPattern(), true, this);
    }
    return PatternNarrowing.captureType(
        matchCase.getPattern(), node.getCapturePattern(), subjectType, this);
  }
}
