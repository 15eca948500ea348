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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.typeflow.syntax.DotExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Identifier;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.IntLiteral;
import net.typeflow.syntax.StringLiteral;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.UnaryOperatorExpression;

/**
 * The canonical key of a reference: a name, or a chain of attribute and subscript accesses over a
 * name, such as {@code a.b[0]['k']}.
 *
 * <p>Keys compare structurally, so two unrelated expressions that denote the same path share cache
 * entries. A key may carry a disambiguator that separates otherwise identical paths, e.g. one
 * member of an overloaded binding.
 *
 * <p>A key whose last segment is {@link #ANY_SUBSCRIPT} denotes an assignment through a
 * subscript that is not a literal; it is never queried, but it invalidates narrowing of every
 * literal subscript of the same object.
 */
@AutoValue
public abstract class ReferenceKey {

  /** The segment used for a subscript whose index is not a literal. */
  public static final String ANY_SUBSCRIPT = "[*]";

  public abstract ImmutableList<String> getSegments();

  @Nullable
  public abstract Integer getDisambiguator();

  private static ReferenceKey create(ImmutableList<String> segments, @Nullable Integer id) {
    Preconditions.checkArgument(!segments.isEmpty(), "empty reference key");
    return new AutoValue_ReferenceKey(segments, id);
  }

  /** Returns the key of a bare name. */
  public static ReferenceKey forName(String name) {
    return create(ImmutableList.of(name), null);
  }

  /**
   * Returns the key of an expression, or null if the expression is not a reference eligible for
   * narrowing. Eligible expressions are names, and attribute or subscript accesses on eligible
   * expressions whose subscripts are int (possibly negated) or string literals.
   */
  @Nullable
  public static ReferenceKey of(Expression expr) {
    ImmutableList.Builder<String> segments = ImmutableList.builder();
    return appendSegments(expr, segments) ? create(segments.build(), null) : null;
  }

  /**
   * Returns the key of an assignment through a subscript of {@code object} whose index is not a
   * literal, or null if {@code object} is not eligible.
   */
  @Nullable
  public static ReferenceKey forAnySubscript(Expression object) {
    ImmutableList.Builder<String> segments = ImmutableList.builder();
    if (!appendSegments(object, segments)) {
      return null;
    }
    segments.add(ANY_SUBSCRIPT);
    return create(segments.build(), null);
  }

  private static boolean appendSegments(Expression expr, ImmutableList.Builder<String> segments) {
    switch (expr.kind()) {
      case IDENTIFIER:
        segments.add(((Identifier) expr).getName());
        return true;
      case DOT:
        {
          DotExpression dot = (DotExpression) expr;
          if (!appendSegments(dot.getObject(), segments)) {
            return false;
          }
          segments.add("." + dot.getField().getName());
          return true;
        }
      case INDEX:
        {
          IndexExpression index = (IndexExpression) expr;
          String subscript = subscriptSegment(index.getKey());
          if (subscript == null || !appendSegments(index.getObject(), segments)) {
            return false;
          }
          segments.add(subscript);
          return true;
        }
      default:
        return false;
    }
  }

  @Nullable
  private static String subscriptSegment(Expression key) {
    if (key instanceof IntLiteral literal) {
      return "[" + literal.getValue() + "]";
    }
    if (key instanceof UnaryOperatorExpression unary
        && unary.getOperator() == TokenKind.MINUS
        && unary.getX() instanceof IntLiteral literal) {
      return "[-" + literal.getValue() + "]";
    }
    if (key instanceof StringLiteral literal) {
      return "['" + literal.getValue() + "']";
    }
    return null;
  }

  public ReferenceKey withDisambiguator(int id) {
    return create(getSegments(), id);
  }

  /** Returns the key with the same path and no disambiguator. */
  public ReferenceKey withoutDisambiguator() {
    return getDisambiguator() == null ? this : create(getSegments(), null);
  }

  /** Returns the name at the root of the path. */
  public String getRootName() {
    return getSegments().get(0);
  }

  /** Reports whether the key is a bare name. */
  public boolean isName() {
    return getSegments().size() == 1;
  }

  /** Returns the key of the object this key accesses a member of, or null for a bare name. */
  @Nullable
  public ReferenceKey getParent() {
    if (isName()) {
      return null;
    }
    return create(getSegments().subList(0, getSegments().size() - 1), null);
  }

  public boolean isAnySubscript() {
    return getSegments().get(getSegments().size() - 1).equals(ANY_SUBSCRIPT);
  }

  /** Reports whether this key's path is a strict prefix of {@code other}'s path. */
  public boolean isStrictPrefixOf(ReferenceKey other) {
    int n = getSegments().size();
    return n < other.getSegments().size()
        && other.getSegments().subList(0, n).equals(getSegments());
  }

  /**
   * Reports whether an assignment to this key invalidates the narrowing of {@code reference}
   * without determining its new value: this key is a strict prefix of the reference, or a
   * non-literal subscript of an object the reference subscripts.
   */
  public boolean isPartialMatchOf(ReferenceKey reference) {
    if (isAnySubscript()) {
      ReferenceKey object = getParent();
      int n = object.getSegments().size();
      return object.isStrictPrefixOf(reference)
          && reference.getSegments().get(n).startsWith("[");
    }
    return isStrictPrefixOf(reference);
  }

  /** Reports whether an assignment to this key affects the value of {@code reference}. */
  public boolean affects(ReferenceKey reference) {
    return getSegments().equals(reference.getSegments()) || isPartialMatchOf(reference);
  }

  @Override
  public final String toString() {
    String path = String.join("", getSegments());
    return getDisambiguator() == null ? path : path + "@" + getDisambiguator();
  }
}
