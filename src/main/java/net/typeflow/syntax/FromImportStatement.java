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
 * Syntax node for a {@code from module import name [as alias], ...} statement, or for the
 * wildcard form {@code from module import *}, whose bound names are unknown to the parser.
 */
public final class FromImportStatement extends Statement {

  /** One imported name and its optional local alias. */
  public static final class Binding {

    private final Identifier name;
    @Nullable private final Identifier alias;

    Binding(Identifier name, @Nullable Identifier alias) {
      this.name = name;
      this.alias = alias;
    }

    /** Returns the name as declared in the imported module. */
    public Identifier getName() {
      return name;
    }

    /** Returns the identifier bound in the importing scope. */
    public Identifier getLocalName() {
      return alias != null ? alias : name;
    }
  }

  private final int fromOffset;
  private final String module;
  private final ImmutableList<Binding> bindings;
  private final boolean wildcard;
  private final int endOffset;

  FromImportStatement(
      FileLocations locs,
      int fromOffset,
      String module,
      ImmutableList<Binding> bindings,
      boolean wildcard,
      int endOffset) {
    super(locs);
    this.fromOffset = fromOffset;
    this.module = module;
    this.bindings = bindings;
    this.wildcard = wildcard;
    this.endOffset = endOffset;
  }

  /** Returns the dotted name of the imported module. */
  public String getModule() {
    return module;
  }

  /** Returns the imported names; empty for a wildcard import. */
  public ImmutableList<Binding> getBindings() {
    return bindings;
  }

  public boolean isWildcard() {
    return wildcard;
  }

  @Override
  public int getStartOffset() {
    return fromOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.FROM_IMPORT;
  }
}
