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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for a pattern in a {@code case} clause.
 *
 * <p>Patterns may be of ten forms, represented by the nested subclasses and distinguished by
 * {@link #kind}.
 */
public abstract class Pattern extends Node {

  /** Kind of the pattern. */
  public enum Kind {
    AS,
    CAPTURE,
    CLASS,
    LITERAL,
    MAPPING,
    OR,
    SEQUENCE,
    STAR,
    VALUE,
    WILDCARD,
  }

  private final Kind kind;

  Pattern(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** Reports whether this pattern matches every subject. */
  public boolean isIrrefutable() {
    return false;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** A literal pattern such as {@code 1}, {@code -2}, {@code "s"}, {@code None} or {@code True}. */
  public static final class Literal extends Pattern {
    private final Expression value;

    Literal(FileLocations locs, Expression value) {
      super(locs, Kind.LITERAL);
      this.value = value;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public int getStartOffset() {
      return value.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return value.getEndOffset();
    }
  }

  /** A capture pattern, which binds the subject to a name. */
  public static final class Capture extends Pattern {
    private final Identifier name;

    Capture(FileLocations locs, Identifier name) {
      super(locs, Kind.CAPTURE);
      this.name = name;
    }

    public Identifier getName() {
      return name;
    }

    @Override
    public boolean isIrrefutable() {
      return true;
    }

    @Override
    public int getStartOffset() {
      return name.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return name.getEndOffset();
    }
  }

  /** The wildcard pattern {@code _}. */
  public static final class Wildcard extends Pattern {
    private final int offset;

    Wildcard(FileLocations locs, int offset) {
      super(locs, Kind.WILDCARD);
      this.offset = offset;
    }

    @Override
    public boolean isIrrefutable() {
      return true;
    }

    @Override
    public int getStartOffset() {
      return offset;
    }

    @Override
    public int getEndOffset() {
      return offset + 1;
    }
  }

  /** A value pattern: a dotted name compared by equality, e.g. {@code Color.RED}. */
  public static final class Value extends Pattern {
    private final DotExpression value;

    Value(FileLocations locs, DotExpression value) {
      super(locs, Kind.VALUE);
      this.value = value;
    }

    public DotExpression getValue() {
      return value;
    }

    @Override
    public int getStartOffset() {
      return value.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return value.getEndOffset();
    }
  }

  /** A class pattern {@code C(p1, p2, attr=p3)}. */
  public static final class ClassPattern extends Pattern {
    private final Expression cls;
    private final ImmutableList<Pattern> positional;
    private final ImmutableList<Identifier> keywordNames;
    private final ImmutableList<Pattern> keywordPatterns;
    private final int rparenOffset;

    ClassPattern(
        FileLocations locs,
        Expression cls,
        ImmutableList<Pattern> positional,
        ImmutableList<Identifier> keywordNames,
        ImmutableList<Pattern> keywordPatterns,
        int rparenOffset) {
      super(locs, Kind.CLASS);
      this.cls = cls;
      this.positional = positional;
      this.keywordNames = keywordNames;
      this.keywordPatterns = keywordPatterns;
      this.rparenOffset = rparenOffset;
    }

    public Expression getClassExpression() {
      return cls;
    }

    public ImmutableList<Pattern> getPositionalPatterns() {
      return positional;
    }

    public ImmutableList<Identifier> getKeywordNames() {
      return keywordNames;
    }

    public ImmutableList<Pattern> getKeywordPatterns() {
      return keywordPatterns;
    }

    @Override
    public int getStartOffset() {
      return cls.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return rparenOffset + 1;
    }
  }

  /** A sequence pattern {@code [p1, *rest]} or {@code (p1, p2)}. */
  public static final class Sequence extends Pattern {
    private final int startOffset;
    private final ImmutableList<Pattern> elements;
    private final int endOffset;

    Sequence(
        FileLocations locs, int startOffset, ImmutableList<Pattern> elements, int endOffset) {
      super(locs, Kind.SEQUENCE);
      this.startOffset = startOffset;
      this.elements = elements;
      this.endOffset = endOffset;
    }

    public ImmutableList<Pattern> getElements() {
      return elements;
    }

    /** Returns the index of the star element, or -1 if there is none. */
    public int getStarIndex() {
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i).kind() == Kind.STAR) {
          return i;
        }
      }
      return -1;
    }

    @Override
    public int getStartOffset() {
      return startOffset;
    }

    @Override
    public int getEndOffset() {
      return endOffset;
    }
  }

  /** A star element {@code *name} or {@code *_} within a sequence pattern. */
  public static final class Star extends Pattern {
    private final int starOffset;
    @Nullable private final Identifier name;

    Star(FileLocations locs, int starOffset, @Nullable Identifier name) {
      super(locs, Kind.STAR);
      this.starOffset = starOffset;
      this.name = name;
    }

    /** Returns the captured name, or null for {@code *_}. */
    @Nullable
    public Identifier getName() {
      return name;
    }

    @Override
    public int getStartOffset() {
      return starOffset;
    }

    @Override
    public int getEndOffset() {
      return name != null ? name.getEndOffset() : starOffset + 2;
    }
  }

  /** A mapping pattern {@code {"k": p, **rest}}. */
  public static final class Mapping extends Pattern {
    private final int lbraceOffset;
    private final ImmutableList<Expression> keys;
    private final ImmutableList<Pattern> values;
    @Nullable private final Identifier rest;
    private final int rbraceOffset;

    Mapping(
        FileLocations locs,
        int lbraceOffset,
        ImmutableList<Expression> keys,
        ImmutableList<Pattern> values,
        @Nullable Identifier rest,
        int rbraceOffset) {
      super(locs, Kind.MAPPING);
      this.lbraceOffset = lbraceOffset;
      this.keys = keys;
      this.values = values;
      this.rest = rest;
      this.rbraceOffset = rbraceOffset;
    }

    public ImmutableList<Expression> getKeys() {
      return keys;
    }

    public ImmutableList<Pattern> getValues() {
      return values;
    }

    @Nullable
    public Identifier getRest() {
      return rest;
    }

    @Override
    public int getStartOffset() {
      return lbraceOffset;
    }

    @Override
    public int getEndOffset() {
      return rbraceOffset + 1;
    }
  }

  /** An or-pattern {@code p1 | p2}. */
  public static final class Or extends Pattern {
    private final ImmutableList<Pattern> alternatives;

    Or(FileLocations locs, ImmutableList<Pattern> alternatives) {
      super(locs, Kind.OR);
      this.alternatives = alternatives;
    }

    public ImmutableList<Pattern> getAlternatives() {
      return alternatives;
    }

    @Override
    public boolean isIrrefutable() {
      for (Pattern p : alternatives) {
        if (p.isIrrefutable()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public int getStartOffset() {
      return alternatives.get(0).getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return alternatives.get(alternatives.size() - 1).getEndOffset();
    }
  }

  /** An as-pattern {@code p as name}. */
  public static final class As extends Pattern {
    private final Pattern pattern;
    private final Identifier name;

    As(FileLocations locs, Pattern pattern, Identifier name) {
      super(locs, Kind.AS);
      this.pattern = pattern;
      this.name = name;
    }

    public Pattern getPattern() {
      return pattern;
    }

    public Identifier getName() {
      return name;
    }

    @Override
    public boolean isIrrefutable() {
      return pattern.isIrrefutable();
    }

    @Override
    public int getStartOffset() {
      return pattern.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return name.getEndOffset();
    }
  }
}
