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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cooperative cancellation signal. Queries poll it between node visits and return aborted
 * results once it is set. It may be set from any thread.
 */
public final class CancellationToken {

  /** A token that is never cancelled. */
  public static final CancellationToken NONE = new CancellationToken();

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    if (this == NONE) {
      throw new UnsupportedOperationException("the NONE token cannot be cancelled");
    }
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
