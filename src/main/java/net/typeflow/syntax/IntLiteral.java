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

import java.math.BigInteger;

/**
 * An integer literal such as {@code 42}, {@code 0x2A} or {@code 1_000}. The value is unbounded;
 * callers that model it as a machine integer decide how to treat values outside that range.
 */
public final class IntLiteral extends Expression {

  private final int startOffset;
  private final String text;
  private final BigInteger value;

  IntLiteral(FileLocations locs, int startOffset, String text, BigInteger value) {
    super(locs, Kind.INT_LITERAL);
    this.startOffset = startOffset;
    this.text = text;
    this.value = value;
  }

  public BigInteger getValue() {
    return value;
  }

  /** Reports whether the literal is nonzero, i.e. true in a test. */
  public boolean isTruthy() {
    return value.signum() != 0;
  }

  /** The literal as written, preserving radix prefix and digit separators. */
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
