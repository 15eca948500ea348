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

/** A floating-point literal. Float literals never produce literal types, only {@code float}. */
public final class FloatLiteral extends Expression {

  private final int startOffset;
  private final String text;
  private final double value;

  FloatLiteral(FileLocations locs, int startOffset, String text, double value) {
    super(locs, Kind.FLOAT_LITERAL);
    this.startOffset = startOffset;
    this.text = text;
    this.value = value;
  }

  public double getValue() {
    return value;
  }

  public String getSourceText() {
    return text;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return startOffset + text.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
