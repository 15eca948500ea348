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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.typeflow.syntax.DotExpression;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.IntLiteral;
import net.typeflow.syntax.Pattern;
import net.typeflow.syntax.StringLiteral;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.UnaryOperatorExpression;
import net.typeflow.types.StaticType;
import net.typeflow.types.TypeRelations;
import net.typeflow.types.Types;
import net.typeflow.types.Types.ClassObjectType;
import net.typeflow.types.Types.ClassType;
import net.typeflow.types.Types.DictType;
import net.typeflow.types.Types.ListType;
import net.typeflow.types.Types.LiteralType;
import net.typeflow.types.Types.TupleType;
import net.typeflow.types.Types.TypedDictType;

/**
 * Narrowing by {@code case} patterns.
 *
 * <p>{@link #narrowForPattern} computes the type of a subject on the path where a pattern
 * matched (positive) or did not (negative). The negative result removes only what the pattern is
 * certain to match, so a chain of negative results reaches Never exactly when the cases are
 * exhaustive for the subject type.
 */
public final class PatternNarrowing {

  private PatternNarrowing() {}

  public static StaticType narrowForPattern(
      StaticType subject, Pattern pattern, boolean positive, NarrowingContext ctx) {
    switch (pattern.kind()) {
      case WILDCARD:
      case CAPTURE:
        return positive ? subject : Types.NEVER;
      case STAR:
        return subject;
      case AS:
        return narrowForPattern(subject, ((Pattern.As) pattern).getPattern(), positive, ctx);
      case OR:
        {
          List<Pattern> alternatives = ((Pattern.Or) pattern).getAlternatives();
          if (positive) {
            List<StaticType> result = new ArrayList<>();
            for (Pattern alternative : alternatives) {
              result.add(narrowForPattern(subject, alternative, true, ctx));
            }
            return Types.union(result);
          }
          StaticType remaining = subject;
          for (Pattern alternative : alternatives) {
            remaining = narrowForPattern(remaining, alternative, false, ctx);
          }
          return remaining;
        }
      case LITERAL:
        return narrowForValue(
            subject, ctx.getTypeOfExpression(((Pattern.Literal) pattern).getValue()), positive);
      case VALUE:
        return narrowForValue(
            subject, ctx.getTypeOfExpression(((Pattern.Value) pattern).getValue()), positive);
      case CLASS:
        return narrowForClass(subject, (Pattern.ClassPattern) pattern, positive, ctx);
      case SEQUENCE:
        return narrowForSequence(subject, (Pattern.Sequence) pattern, positive, ctx);
      case MAPPING:
        return narrowForMapping(subject, (Pattern.Mapping) pattern, positive, ctx);
    }
    throw new IllegalStateException("unexpected pattern kind: " + pattern.kind());
  }

  private static StaticType narrowForValue(StaticType subject, StaticType value, boolean positive) {
    if (value.equals(Types.NONE)) {
      return EqualityNarrowing.narrowForNone(subject, positive);
    }
    if (value instanceof LiteralType literal) {
      return EqualityNarrowing.narrowForLiteral(subject, literal, positive, false);
    }
    return subject;
  }

  private static boolean isOpen(StaticType type) {
    return type.equals(Types.ANY) || type.equals(Types.UNKNOWN) || type.equals(Types.OBJECT);
  }

  private static boolean allIrrefutable(List<Pattern> patterns) {
    for (Pattern p : patterns) {
      if (!p.isIrrefutable() && p.kind() != Pattern.Kind.STAR) {
        return false;
      }
    }
    return true;
  }

  // ==== Class patterns ====

  private static StaticType narrowForClass(
      StaticType subject, Pattern.ClassPattern pattern, boolean positive, NarrowingContext ctx) {
    StaticType classType = ctx.getTypeOfExpression(pattern.getClassExpression());
    if (!(classType instanceof ClassObjectType)) {
      return subject;
    }
    boolean hasArguments =
        !pattern.getPositionalPatterns().isEmpty() || !pattern.getKeywordPatterns().isEmpty();
    if (!positive) {
      if (hasArguments
          && !(allIrrefutable(pattern.getPositionalPatterns())
              && allIrrefutable(pattern.getKeywordPatterns()))) {
        return subject;
      }
      StaticType narrowed = ClassNarrowing.narrowForIsInstance(subject, classType, true, false);
      return narrowed != null ? narrowed : subject;
    }
    StaticType narrowed = ClassNarrowing.narrowForIsInstance(subject, classType, true, true);
    if (narrowed == null) {
      return subject;
    }
    if (!hasArguments) {
      return narrowed;
    }
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(narrowed)) {
      if (canMatchArguments(member, pattern, ctx)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  private static boolean canMatchArguments(
      StaticType member, Pattern.ClassPattern pattern, NarrowingContext ctx) {
    for (int i = 0; i < pattern.getPositionalPatterns().size(); i++) {
      StaticType argument = positionalSubject(member, i);
      if (argument != null
          && TypeRelations.isNever(
              narrowForPattern(argument, pattern.getPositionalPatterns().get(i), true, ctx))) {
        return false;
      }
    }
    for (int i = 0; i < pattern.getKeywordPatterns().size(); i++) {
      StaticType field = member.getField(pattern.getKeywordNames().get(i).getName());
      if (field != null
          && TypeRelations.isNever(
              narrowForPattern(field, pattern.getKeywordPatterns().get(i), true, ctx))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the value the {@code i}th positional sub-pattern of a class pattern is matched
   * against, or null if unknown. Builtin classes match their single positional pattern against
   * the subject itself.
   */
  @Nullable
  private static StaticType positionalSubject(StaticType member, int i) {
    ClassType cls = TypeRelations.nominalClass(member);
    if (i == 0
        && cls != null
        && (cls.equals(Types.BOOL)
            || cls.equals(Types.INT)
            || cls.equals(Types.FLOAT)
            || cls.equals(Types.STR)
            || cls.equals(Types.LIST_CLASS)
            || cls.equals(Types.TUPLE_CLASS)
            || cls.equals(Types.DICT_CLASS))) {
      return member;
    }
    return null;
  }

  // ==== Sequence patterns ====

  /** Returns the tuple element that element {@code i} of a sequence pattern matches. */
  private static int elementIndex(Pattern.Sequence pattern, int i, int tupleLength) {
    int star = pattern.getStarIndex();
    return star < 0 || i < star ? i : tupleLength - (pattern.getElements().size() - i);
  }

  private static boolean lengthMatches(Pattern.Sequence pattern, int tupleLength) {
    int size = pattern.getElements().size();
    return pattern.getStarIndex() < 0 ? tupleLength == size : tupleLength >= size - 1;
  }

  private static StaticType narrowForSequence(
      StaticType subject, Pattern.Sequence pattern, boolean positive, NarrowingContext ctx) {
    List<Pattern> elements = pattern.getElements();
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : TypeRelations.subtypes(subject)) {
      if (member instanceof TupleType tuple) {
        StaticType narrowed =
            positive
                ? matchTuple(tuple, pattern, ctx)
                : excludeTuple(tuple, pattern, ctx);
        result.add(narrowed);
      } else if (member instanceof ListType list) {
        if (positive) {
          boolean possible = true;
          for (Pattern element : elements) {
            if (element.kind() != Pattern.Kind.STAR
                && TypeRelations.isNever(
                    narrowForPattern(list.getElementType(), element, true, ctx))) {
              possible = false;
            }
          }
          if (possible) {
            result.add(member);
          }
        } else if (!(elements.size() == 1 && pattern.getStarIndex() == 0)) {
          result.add(member);
        }
      } else if (isOpen(member) || isUserSequence(member)) {
        result.add(member);
      } else if (!positive) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  private static boolean isUserSequence(StaticType member) {
    return member instanceof ClassType cls
        && !cls.equals(Types.STR)
        && cls.getField("__getitem__") != null;
  }

  private static StaticType matchTuple(
      TupleType tuple, Pattern.Sequence pattern, NarrowingContext ctx) {
    int n = tuple.getElementTypes().size();
    if (!lengthMatches(pattern, n)) {
      return Types.NEVER;
    }
    List<StaticType> elementTypes = new ArrayList<>(tuple.getElementTypes());
    for (int i = 0; i < pattern.getElements().size(); i++) {
      Pattern element = pattern.getElements().get(i);
      if (element.kind() == Pattern.Kind.STAR) {
        continue;
      }
      int index = elementIndex(pattern, i, n);
      StaticType narrowed = narrowForPattern(elementTypes.get(index), element, true, ctx);
      if (TypeRelations.isNever(narrowed)) {
        return Types.NEVER;
      }
      elementTypes.set(index, narrowed);
    }
    return Types.tuple(ImmutableList.copyOf(elementTypes));
  }

  /**
   * Returns what remains of a tuple after a sequence pattern failed to match it: nothing if every
   * element pattern is irrefutable, the tuple with one element narrowed if exactly one element
   * pattern is refutable, and the tuple unchanged otherwise.
   */
  private static StaticType excludeTuple(
      TupleType tuple, Pattern.Sequence pattern, NarrowingContext ctx) {
    int n = tuple.getElementTypes().size();
    if (!lengthMatches(pattern, n)) {
      return tuple;
    }
    int refutable = -1;
    for (int i = 0; i < pattern.getElements().size(); i++) {
      Pattern element = pattern.getElements().get(i);
      if (element.kind() == Pattern.Kind.STAR || element.isIrrefutable()) {
        continue;
      }
      if (refutable >= 0) {
        return tuple;
      }
      refutable = i;
    }
    if (refutable < 0) {
      return Types.NEVER;
    }
    int index = elementIndex(pattern, refutable, n);
    StaticType remaining =
        narrowForPattern(
            tuple.getElementTypes().get(index), pattern.getElements().get(refutable), false, ctx);
    if (TypeRelations.isNever(remaining)) {
      return Types.NEVER;
    }
    List<StaticType> elementTypes = new ArrayList<>(tuple.getElementTypes());
    elementTypes.set(index, remaining);
    return Types.tuple(ImmutableList.copyOf(elementTypes));
  }

  // ==== Mapping patterns ====

  private static StaticType narrowForMapping(
      StaticType subject, Pattern.Mapping pattern, boolean positive, NarrowingContext ctx) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(subject)) {
      if (positive) {
        if (isOpen(member) || (member instanceof ClassType cls && !isBuiltinNonMapping(cls))) {
          result.add(member);
        } else if ((member instanceof DictType || member instanceof TypedDictType)
            && canMatchEntries(member, pattern, ctx)) {
          result.add(member);
        }
      } else if (!isCertainMatch(member, pattern, ctx)) {
        result.add(member);
      }
    }
    return Types.union(result);
  }

  private static boolean isBuiltinNonMapping(ClassType cls) {
    return cls.equals(Types.INT)
        || cls.equals(Types.BOOL)
        || cls.equals(Types.FLOAT)
        || cls.equals(Types.STR)
        || cls.equals(Types.LIST_CLASS)
        || cls.equals(Types.TUPLE_CLASS);
  }

  /** Returns the type of a mapping pattern entry's value, or null if unknown. */
  @Nullable
  private static StaticType entryType(StaticType member, Expression key) {
    if (member instanceof DictType dict) {
      return dict.getValueType();
    }
    if (member instanceof TypedDictType dict && key instanceof StringLiteral literal) {
      return dict.getKeyType(literal.getValue());
    }
    return null;
  }

  private static boolean canMatchEntries(
      StaticType member, Pattern.Mapping pattern, NarrowingContext ctx) {
    for (int i = 0; i < pattern.getKeys().size(); i++) {
      Expression key = pattern.getKeys().get(i);
      StaticType valueType = entryType(member, key);
      if (valueType == null) {
        if (member instanceof TypedDictType && key instanceof StringLiteral) {
          return false; // undeclared key
        }
        continue;
      }
      if (TypeRelations.isNever(
          narrowForPattern(valueType, pattern.getValues().get(i), true, ctx))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isCertainMatch(
      StaticType member, Pattern.Mapping pattern, NarrowingContext ctx) {
    if (!(member instanceof DictType) && !(member instanceof TypedDictType)) {
      return false;
    }
    if (pattern.getKeys().isEmpty()) {
      return true;
    }
    // A typed dict whose single tested key is required and whose value cannot escape the pattern.
    if (member instanceof TypedDictType dict
        && pattern.getKeys().size() == 1
        && pattern.getKeys().get(0) instanceof StringLiteral key
        && dict.getRequiredKeys().containsKey(key.getValue())) {
      StaticType remaining =
          narrowForPattern(
              dict.getRequiredKeys().get(key.getValue()), pattern.getValues().get(0), false, ctx);
      return TypeRelations.isNever(remaining);
    }
    return false;
  }

  // ==== Captures ====

  /**
   * Returns the type bound to a name captured by {@code capture}, a capture, as-, star- or
   * mapping pattern within {@code root}, when {@code root} matched a subject of the given type.
   */
  public static StaticType captureType(
      Pattern root, Pattern capture, StaticType subject, NarrowingContext ctx) {
    StaticType type = captureIn(root, capture, subject, ctx);
    return type != null ? type : Types.ANY;
  }

  @Nullable
  private static StaticType captureIn(
      Pattern pattern, Pattern capture, StaticType subject, NarrowingContext ctx) {
    switch (pattern.kind()) {
      case CAPTURE:
        return pattern == capture ? subject : null;
      case AS:
        {
          Pattern inner = ((Pattern.As) pattern).getPattern();
          if (pattern == capture) {
            return narrowForPattern(subject, inner, true, ctx);
          }
          return captureIn(inner, capture, subject, ctx);
        }
      case OR:
        for (Pattern alternative : ((Pattern.Or) pattern).getAlternatives()) {
          StaticType type = captureIn(alternative, capture, subject, ctx);
          if (type != null) {
            return type;
          }
        }
        return null;
      case SEQUENCE:
        return captureInSequence((Pattern.Sequence) pattern, capture, subject, ctx);
      case CLASS:
        {
          Pattern.ClassPattern cls = (Pattern.ClassPattern) pattern;
          StaticType matched = narrowForPattern(subject, pattern, true, ctx);
          for (int i = 0; i < cls.getPositionalPatterns().size(); i++) {
            StaticType argument = positionalSubjectOfUnion(matched, i);
            StaticType type =
                captureIn(cls.getPositionalPatterns().get(i), capture, argument, ctx);
            if (type != null) {
              return type;
            }
          }
          for (int i = 0; i < cls.getKeywordPatterns().size(); i++) {
            String name = cls.getKeywordNames().get(i).getName();
            StaticType type =
                captureIn(
                    cls.getKeywordPatterns().get(i), capture, fieldOfUnion(matched, name), ctx);
            if (type != null) {
              return type;
            }
          }
          return null;
        }
      case MAPPING:
        {
          Pattern.Mapping mapping = (Pattern.Mapping) pattern;
          StaticType matched = narrowForPattern(subject, pattern, true, ctx);
          if (pattern == capture) {
            return restOfMapping(matched);
          }
          for (int i = 0; i < mapping.getKeys().size(); i++) {
            StaticType type =
                captureIn(
                    mapping.getValues().get(i),
                    capture,
                    entryOfUnion(matched, mapping.getKeys().get(i)),
                    ctx);
            if (type != null) {
              return type;
            }
          }
          return null;
        }
      case LITERAL:
      case VALUE:
      case WILDCARD:
      case STAR:
        return null;
    }
    throw new IllegalStateException("unexpected pattern kind: " + pattern.kind());
  }

  @Nullable
  private static StaticType captureInSequence(
      Pattern.Sequence pattern, Pattern capture, StaticType subject, NarrowingContext ctx) {
    StaticType matched = narrowForPattern(subject, pattern, true, ctx);
    for (int i = 0; i < pattern.getElements().size(); i++) {
      Pattern element = pattern.getElements().get(i);
      List<StaticType> elementTypes = new ArrayList<>();
      for (StaticType member : Types.unfoldUnion(matched)) {
        if (member instanceof TupleType tuple) {
          int n = tuple.getElementTypes().size();
          if (element == capture) {
            // The star element captures a list of the elements it spans.
            int from = i;
            int to = n - (pattern.getElements().size() - 1 - i);
            elementTypes.add(
                Types.list(TypeRelations.stripLiterals(
                    Types.union(tuple.getElementTypes().subList(from, Math.max(from, to))))));
          } else {
            elementTypes.add(tuple.getElementTypes().get(elementIndex(pattern, i, n)));
          }
        } else if (member instanceof ListType list) {
          elementTypes.add(element == capture ? list : list.getElementType());
        } else {
          elementTypes.add(element == capture ? Types.list(Types.ANY) : Types.ANY);
        }
      }
      StaticType elementType = Types.union(elementTypes);
      if (element == capture) {
        return elementType;
      }
      StaticType type = captureIn(element, capture, elementType, ctx);
      if (type != null) {
        return type;
      }
    }
    return null;
  }

  private static StaticType positionalSubjectOfUnion(StaticType type, int i) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      StaticType argument = positionalSubject(member, i);
      result.add(argument != null ? argument : Types.ANY);
    }
    return Types.union(result);
  }

  private static StaticType fieldOfUnion(StaticType type, String name) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      StaticType field = member.getField(name);
      result.add(field != null ? field : Types.ANY);
    }
    return Types.union(result);
  }

  private static StaticType entryOfUnion(StaticType type, Expression key) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      StaticType entry = entryType(member, key);
      result.add(entry != null ? entry : Types.ANY);
    }
    return Types.union(result);
  }

  private static StaticType restOfMapping(StaticType type) {
    List<StaticType> result = new ArrayList<>();
    for (StaticType member : Types.unfoldUnion(type)) {
      if (member instanceof DictType) {
        result.add(member);
      } else if (member instanceof TypedDictType dict) {
        List<StaticType> values = new ArrayList<>(dict.getRequiredKeys().values());
        values.addAll(dict.getNotRequiredKeys().values());
        result.add(Types.dict(Types.STR, Types.union(values)));
      } else {
        result.add(Types.dict(Types.ANY, Types.ANY));
      }
    }
    return Types.union(result);
  }

  // ==== Subject projection ====

  /**
   * Narrows element {@code index} of a tuple subject {@code (a, b, ...)} of the given length.
   * Returns null if the pattern says nothing about that element.
   */
  @Nullable
  public static StaticType narrowSubjectElement(
      StaticType elementType,
      Pattern pattern,
      int index,
      int length,
      boolean positive,
      NarrowingContext ctx) {
    if (pattern.kind() == Pattern.Kind.AS) {
      return narrowSubjectElement(
          elementType, ((Pattern.As) pattern).getPattern(), index, length, positive, ctx);
    }
    if (pattern.kind() == Pattern.Kind.OR) {
      List<Pattern> alternatives = ((Pattern.Or) pattern).getAlternatives();
      if (positive) {
        List<StaticType> result = new ArrayList<>();
        for (Pattern alternative : alternatives) {
          StaticType narrowed =
              narrowSubjectElement(elementType, alternative, index, length, true, ctx);
          result.add(narrowed != null ? narrowed : elementType);
        }
        return Types.union(result);
      }
      StaticType remaining = elementType;
      for (Pattern alternative : alternatives) {
        StaticType narrowed =
            narrowSubjectElement(remaining, alternative, index, length, false, ctx);
        if (narrowed != null) {
          remaining = narrowed;
        }
      }
      return remaining;
    }
    if (pattern.kind() != Pattern.Kind.SEQUENCE) {
      return null;
    }
    Pattern.Sequence sequence = (Pattern.Sequence) pattern;
    if (sequence.getStarIndex() >= 0 || sequence.getElements().size() != length) {
      return null;
    }
    Pattern element = sequence.getElements().get(index);
    if (positive) {
      return narrowForPattern(elementType, element, true, ctx);
    }
    for (int i = 0; i < length; i++) {
      if (i != index && !sequence.getElements().get(i).isIrrefutable()) {
        return null;
      }
    }
    return narrowForPattern(elementType, element, false, ctx);
  }

  /**
   * Narrows the object {@code x} of a subject {@code x.tag}, {@code x["tag"]} or {@code x[0]}
   * matched against literal patterns. Returns null if the pattern is not a literal pattern.
   */
  @Nullable
  public static StaticType narrowSubjectParent(
      StaticType parentType,
      Expression subject,
      Pattern pattern,
      boolean positive,
      NarrowingContext ctx) {
    switch (pattern.kind()) {
      case AS:
        return narrowSubjectParent(
            parentType, subject, ((Pattern.As) pattern).getPattern(), positive, ctx);
      case OR:
        {
          List<Pattern> alternatives = ((Pattern.Or) pattern).getAlternatives();
          List<StaticType> result = new ArrayList<>();
          StaticType remaining = parentType;
          for (Pattern alternative : alternatives) {
            StaticType narrowed =
                narrowSubjectParent(
                    positive ? parentType : remaining, subject, alternative, positive, ctx);
            if (narrowed == null) {
              return null;
            }
            result.add(narrowed);
            remaining = narrowed;
          }
          return positive ? Types.union(result) : remaining;
        }
      case LITERAL:
      case VALUE:
        {
          Expression valueExpr =
              pattern.kind() == Pattern.Kind.LITERAL
                  ? ((Pattern.Literal) pattern).getValue()
                  : ((Pattern.Value) pattern).getValue();
          StaticType value = ctx.getTypeOfExpression(valueExpr);
          if (!(value instanceof LiteralType) && !value.equals(Types.NONE)) {
            return null;
          }
          return narrowDiscriminant(parentType, subject, value, positive);
        }
      default:
        return null;
    }
  }

  @Nullable
  private static StaticType narrowDiscriminant(
      StaticType parentType, Expression subject, StaticType value, boolean positive) {
    if (subject instanceof DotExpression dot) {
      return DiscriminantNarrowing.narrowForMember(
          parentType, dot.getField().getName(), value, positive);
    }
    if (subject instanceof IndexExpression index) {
      Expression key = index.getKey();
      if (key instanceof StringLiteral literal) {
        return DiscriminantNarrowing.narrowForKey(parentType, literal.getValue(), value, positive);
      }
      Integer i = intValue(key);
      if (i != null) {
        return DiscriminantNarrowing.narrowForTupleIndex(parentType, i, value, positive);
      }
    }
    return null;
  }

  /** Returns the value of an int literal, possibly negated, or null. */
  @Nullable
  static Integer intValue(Expression expr) {
    if (expr instanceof IntLiteral literal) {
      return literal.getValue().intValue();
    }
    if (expr instanceof UnaryOperatorExpression unary
        && unary.getOperator() == TokenKind.MINUS
        && unary.getX() instanceof IntLiteral literal) {
      return -literal.getValue().intValue();
    }
    return null;
  }
}
