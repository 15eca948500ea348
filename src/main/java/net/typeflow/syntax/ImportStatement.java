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

/** Syntax node for an {@code import a.b [as c], ...} statement. */
public final class ImportStatement extends Statement {

  /** One imported module and the name it binds. */
  public static final class Item extends Node {

    private final ImmutableList<Identifier> modulePath;
    @Nullable private final Identifier alias;

    Item(FileLocations locs, ImmutableList<Identifier> modulePath, @Nullable Identifier alias) {
      super(locs);
      this.modulePath = modulePath;
      this.alias = alias;
    }

    /** Returns the dotted module name, e.g. "a.b". */
    public String getModuleName() {
      StringBuilder buf = new StringBuilder();
      for (Identifier id : modulePath) {
        if (buf.length() > 0) {
          buf.append('.');
        }
        buf.append(id.getName());
      }
      return buf.toString();
    }

    public ImmutableList<Identifier> getModulePath() {
      return modulePath;
    }

    /** Returns the identifier bound in the importing scope: the alias, or the first component. */
    public Identifier getBoundName() {
      return alias != null ? alias : modulePath.get(0);
    }

    @Nullable
    public Identifier getAlias() {
      return alias;
    }

    @Override
    public int getStartOffset() {
      return modulePath.get(0).getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return alias != null
          ? alias.getEndOffset()
          : modulePath.get(modulePath.size() - 1).getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int importOffset;
  private final ImmutableList<Item> items;

  ImportStatement(FileLocations locs, int importOffset, ImmutableList<Item> items) {
    super(locs);
    this.importOffset = importOffset;
    this.items = items;
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  @Override
  public int getStartOffset() {
    return importOffset;
  }

  @Override
  public int getEndOffset() {
    return items.isEmpty()
        ? importOffset + "import".length()
        : items.get(items.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.IMPORT;
  }
}
