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

/** A one-word statement: {@code break}, {@code continue} or {@code pass}. */
public final class FlowStatement extends Statement {

  /** The statement's keyword. */
  public enum Jump {
    BREAK("break"),
    CONTINUE("continue"),
    PASS("pass");

    private final String keyword;

    Jump(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }

    static Jump of(TokenKind kind) {
      return switch (kind) {
        case BREAK -> BREAK;
        case CONTINUE -> CONTINUE;
        case PASS -> PASS;
        default -> throw new IllegalArgumentException("not a flow keyword: " + kind);
      };
    }
  }

  private final Jump jump;
  private final int keywordOffset;

  FlowStatement(FileLocations locs, Jump jump, int keywordOffset) {
    super(locs);
    this.jump = jump;
    this.keywordOffset = keywordOffset;
  }

  public Jump getJump() {
    return jump;
  }

  @Override
  public int getStartOffset() {
    return keywordOffset;
  }

  @Override
  public int getEndOffset() {
    return keywordOffset + jump.keyword.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.FLOW;
  }
}
