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
package net.typeflow.analysis;

import net.typeflow.flow.FlowScope;

/**
 * Bounds the cost of analysis: whole scopes above a complexity ceiling, and the number of node
 * visits of one query. A query whose guard trips stops where it is and reports an aborted
 * result.
 */
public final class ComplexityGuard {

  private final FlowOptions options;
  private final CancellationToken token;
  private int visits;
  private boolean aborted;

  ComplexityGuard(FlowOptions options, CancellationToken token) {
    this.options = options;
    this.token = token;
  }

  /** Reports whether a scope is too complex to analyze under the given options. */
  public static boolean exceedsCeiling(FlowScope scope, FlowOptions options) {
    return scope.getComplexity() > options.maxCodeComplexity();
  }

  /**
   * Counts one node visit. Returns false, now and on every later call, once the visit budget is
   * spent or the query is cancelled.
   */
  boolean tryVisit() {
    if (aborted) {
      return false;
    }
    if (++visits > options.maxNodeVisits() || token.isCancelled()) {
      aborted = true;
      return false;
    }
    return true;
  }

  boolean isAborted() {
    return aborted;
  }

  int getVisits() {
    return visits;
  }

  /** Returns the reason for an abort, for logging. */
  String abortReason() {
    return token.isCancelled() ? "cancelled" : "visit budget of " + options.maxNodeVisits();
  }
}
