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

import net.typeflow.syntax.FromImportStatement;

/**
 * A {@code from m import *} statement. It binds whichever names the module exports, which are
 * known only to the type evaluator.
 */
public final class WildcardImportNode extends LinearFlowNode {

  private final FromImportStatement statement;

  WildcardImportNode(int id, FlowNode antecedent, FromImportStatement statement) {
    super(id, Kind.WILDCARD_IMPORT, antecedent);
    this.statement = statement;
  }

  public FromImportStatement getStatement() {
    return statement;
  }

  public String getModule() {
    return statement.getModule();
  }
}
