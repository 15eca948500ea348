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

/** Whether a program point can execute, and if not, why. */
public enum Reachability {
  REACHABLE,
  /** Every path to the point passes a return, raise, break or continue. */
  UNREACHABLE_STRUCTURAL,
  /** Every path to the point passes a test whose literal value rules it out. */
  UNREACHABLE_STATIC_CONDITION,
  /**
   * Every path to the point passes a call that never returns, a narrowing that leaves nothing, or
   * an exhausted match.
   */
  UNREACHABLE_BY_ANALYSIS;

  public boolean isReachable() {
    return this == REACHABLE;
  }
}
