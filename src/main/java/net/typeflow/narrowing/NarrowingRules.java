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
package net.typeflow.narrowing;

import javax.annotation.Nullable;
import net.typeflow.flow.NarrowingTargets;
import net.typeflow.flow.ReferenceKey;
import net.typeflow.syntax.AssignmentExpression;
import net.typeflow.syntax.BinaryOperatorExpression;
import net.typeflow.syntax.CallExpression;
import net.typeflow.syntax.DotExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Identifier;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.StringLiteral;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.UnaryOperatorExpression;
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.LiteralType;

/**
 * Maps a test expression and a reference to the narrowing the test applies to that reference.
 *
 * <p>The supported forms are truthiness of the reference, {@code not}, {@code and}/{@code or},
 * comparisons with {@code None} and with literals, discriminating member comparisons, {@code
 * type(x) is C}, {@code len(x) == n}, {@code in}, {@code isinstance}, {@code issubclass}, {@code
 * callable}, {@code bool}, calls of user-defined type guards, walrus targets and aliased
 * conditions. Anything else has no callback.
 */
public final class NarrowingRules {

  private NarrowingRules() {}

  /**
   * Returns the narrowing {@code test} applies to {@code reference} on the path where the test
   * evaluated to {@code positive}, or null if the test does not narrow the reference.
   */
  @Nullable
  public static NarrowingCallback getCallback(
      Expression test, ReferenceKey reference, boolean positive, NarrowingContext ctx) {
    return getCallback(test, reference, positive, ctx, true);
  }

  @Nullable
  private static NarrowingCallback getCallback(
      Expression test,
      ReferenceKey reference,
      boolean positive,
      NarrowingContext ctx,
      boolean allowAlias) {
    if (test instanceof AssignmentExpression walrus) {
      if (reference.equals(ReferenceKey.of(walrus.getTarget()))) {
        return type -> TruthinessNarrowing.narrow(type, positive);
      }
      return getCallback(walrus.getValue(), reference, positive, ctx, allowAlias);
    }
    if (reference.equals(ReferenceKey.of(test))) {
      return type -> TruthinessNarrowing.narrow(type, positive);
    }
    if (test instanceof Identifier id && allowAlias) {
      // Aliases are resolved one level deep.
      Expression alias = ctx.getAlias(id);
      return alias == null ? null : getCallback(alias, reference, positive, ctx, false);
    }
    if (test instanceof UnaryOperatorExpression unary) {
      return unary.getOperator() == TokenKind.NOT
          ? getCallback(unary.getX(), reference, !positive, ctx, allowAlias)
          : null;
    }
    if (test instanceof BinaryOperatorExpression binop) {
      return getBinaryCallback(binop, reference, positive, ctx, allowAlias);
    }
    if (test instanceof CallExpression call) {
      return getCallCallback(call, reference, positive, ctx, allowAlias);
    }
    return null;
  }

  @Nullable
  private static NarrowingCallback getBinaryCallback(
      BinaryOperatorExpression binop,
      ReferenceKey reference,
      boolean positive,
      NarrowingContext ctx,
      boolean allowAlias) {
    TokenKind op = binop.getOperator();
    switch (op) {
      case AND:
      case OR:
        {
          NarrowingCallback left = getCallback(binop.getX(), reference, positive, ctx, allowAlias);
          NarrowingCallback right =
              getCallback(binop.getY(), reference, positive, ctx, allowAlias);
          if (left == null && right == null) {
            return null;
          }
          // "a and b" true, or "a or b" false, means both operands had that outcome.
          boolean both = (op == TokenKind.AND) == positive;
          return both ? compose(left, right) : unionOf(left, right);
        }
      case IS:
      case IS_NOT:
      case EQUALS_EQUALS:
      case NOT_EQUALS:
        {
          boolean identity = op == TokenKind.IS || op == TokenKind.IS_NOT;
          boolean equal = (op == TokenKind.IS || op == TokenKind.EQUALS_EQUALS) == positive;
          NarrowingCallback callback =
              getComparisonCallback(binop.getX(), binop.getY(), reference, equal, identity, ctx);
          return callback != null
              ? callback
              : getComparisonCallback(binop.getY(), binop.getX(), reference, equal, identity, ctx);
        }
      case IN:
      case NOT_IN:
        return getInCallback(binop, reference, (op == TokenKind.IN) == positive, ctx);
      default:
        return null;
    }
  }

  private static NarrowingCallback compose(
      @Nullable NarrowingCallback first, @Nullable NarrowingCallback second) {
    return type -> {
      StaticType narrowed = apply(first, type);
      return TypeRelations.isNever(narrowed) ? narrowed : apply(second, narrowed);
    };
  }

  private static NarrowingCallback unionOf(
      @Nullable NarrowingCallback first, @Nullable NarrowingCallback second) {
    return type -> Types.union(apply(first, type), apply(second, type));
  }

  private static StaticType apply(@Nullable NarrowingCallback callback, StaticType type) {
    if (callback == null) {
      return type;
    }
    StaticType narrowed = callback.narrow(type);
    return narrowed != null ? narrowed : type;
  }

  /**
   * Returns the narrowing of a comparison {@code operand OP value} for the reference, where
   * {@code equal} says whether the operands compared equal (or identical) on this path.
   */
  @Nullable
  private static NarrowingCallback getComparisonCallback(
      Expression operand,
      Expression valueExpr,
      ReferenceKey reference,
      boolean equal,
      boolean identity,
      NarrowingContext ctx) {
    Expression subject = NarrowingTargets.unwrapAssignment(operand);
    if (operand instanceof AssignmentExpression walrus
        && !reference.equals(ReferenceKey.of(walrus.getTarget()))) {
      subject = walrus.getValue();
    }
    if (reference.equals(ReferenceKey.of(subject))) {
      StaticType value = ctx.getTypeOfExpression(valueExpr);
      if (value.equals(Types.NONE)) {
        return type -> EqualityNarrowing.narrowForNone(type, equal);
      }
      if (value instanceof LiteralType literal) {
        return type -> EqualityNarrowing.narrowForLiteral(type, literal, equal, identity);
      }
      return null;
    }
    if (subject instanceof CallExpression call
        && call.getPositionalArgumentCount() == 1
        && call.getFunction() instanceof Identifier callee
        && reference.equals(
            ReferenceKey.of(NarrowingTargets.unwrapAssignment(call.getPositionalArgument(0))))) {
      if (callee.getName().equals("type")) {
        StaticType value = ctx.getTypeOfExpression(valueExpr);
        if (value instanceof ClassObjectType cls && cls.getInstanceType() instanceof ClassType c) {
          return type -> TypeOfNarrowing.narrow(type, c, equal);
        }
        return null;
      }
      if (callee.getName().equals("len") && !identity) {
        Integer length = PatternNarrowing.intValue(valueExpr);
        if (length != null && length >= 0) {
          return type -> LenNarrowing.narrowForLength(type, length, equal);
        }
      }
      return null;
    }
    return getDiscriminantCallback(subject, valueExpr, reference, equal, ctx);
  }

  @Nullable
  private static NarrowingCallback getDiscriminantCallback(
      Expression member,
      Expression valueExpr,
      ReferenceKey reference,
      boolean equal,
      NarrowingContext ctx) {
    if (member instanceof DotExpression dot
        && reference.equals(ReferenceKey.of(dot.getObject()))) {
      StaticType value = discriminantValue(valueExpr, ctx);
      String field = dot.getField().getName();
      return value == null
          ? null
          : type -> DiscriminantNarrowing.narrowForMember(type, field, value, equal);
    }
    if (member instanceof IndexExpression index
        && reference.equals(ReferenceKey.of(index.getObject()))) {
      StaticType value = discriminantValue(valueExpr, ctx);
      if (value == null) {
        return null;
      }
      if (index.getKey() instanceof StringLiteral key) {
        return type -> DiscriminantNarrowing.narrowForKey(type, key.getValue(), value, equal);
      }
      Integer i = PatternNarrowing.intValue(index.getKey());
      if (i != null) {
        return type -> DiscriminantNarrowing.narrowForTupleIndex(type, i, value, equal);
      }
    }
    return null;
  }

  @Nullable
  private static StaticType discriminantValue(Expression valueExpr, NarrowingContext ctx) {
    StaticType value = ctx.getTypeOfExpression(valueExpr);
    return value instanceof LiteralType || value.equals(Types.NONE) ? value : null;
  }

  @Nullable
  private static NarrowingCallback getInCallback(
      BinaryOperatorExpression binop,
      ReferenceKey reference,
      boolean contained,
      NarrowingContext ctx) {
    Expression element = NarrowingTargets.unwrapAssignment(binop.getX());
    if (reference.equals(ReferenceKey.of(element))) {
      StaticType container = ctx.getTypeOfExpression(binop.getY());
      return type -> ContainerNarrowing.narrowForIn(type, container, contained);
    }
    if (element instanceof StringLiteral key
        && reference.equals(ReferenceKey.of(NarrowingTargets.unwrapAssignment(binop.getY())))) {
      return type -> TypedDictNarrowing.narrowForKey(type, key.getValue(), contained);
    }
    return null;
  }

  @Nullable
  private static NarrowingCallback getCallCallback(
      CallExpression call,
      ReferenceKey reference,
      boolean positive,
      NarrowingContext ctx,
      boolean allowAlias) {
    if (call.getPositionalArgumentCount() < 1) {
      return null;
    }
    Expression argument = call.getPositionalArgument(0);
    String callee = call.getCalleeName();
    if ("bool".equals(callee) && call.getPositionalArgumentCount() == 1) {
      return getCallback(argument, reference, positive, ctx, allowAlias);
    }
    if (!reference.equals(ReferenceKey.of(NarrowingTargets.unwrapAssignment(argument)))) {
      return null;
    }
    if (("isinstance".equals(callee) || "issubclass".equals(callee))
        && call.getPositionalArgumentCount() == 2) {
      StaticType classInfo = ctx.getTypeOfExpression(call.getPositionalArgument(1));
      boolean instanceCheck = "isinstance".equals(callee);
      return type -> ClassNarrowing.narrowForIsInstance(type, classInfo, instanceCheck, positive);
    }
    if ("callable".equals(callee) && call.getPositionalArgumentCount() == 1) {
      return type -> CallableNarrowing.narrow(type, positive);
    }
    StaticType calleeType = ctx.getTypeOfExpression(call.getFunction());
    if (calleeType instanceof CallableType guard
        && guard.getGuardKind() != Types.GuardKind.NONE) {
      return type -> ClassNarrowing.narrowForTypeGuard(type, guard, positive);
    }
    return null;
  }
}
