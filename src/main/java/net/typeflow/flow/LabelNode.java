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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A join point with any number of antecedents.
 *
 * <p>Antecedents are added while the graph is built and frozen when the label is sealed; adding to
 * a sealed label is an error. A label may record the set of references assigned or narrowed
 * anywhere within the code it joins, which lets queries for other references skip the whole
 * region.
 */
public abstract class LabelNode extends FlowNode {

  private final List<FlowNode> pending = new ArrayList<>();
  @Nullable private ImmutableList<FlowNode> antecedents;
  @Nullable private ImmutableSet<ReferenceKey> affectedKeys;

  LabelNode(int id, Kind kind) {
    super(id, kind);
  }

  /** Adds an antecedent, ignoring duplicates. Returns false if it was already present. */
  boolean addAntecedent(FlowNode node) {
    Preconditions.checkState(antecedents == null, "%s is already sealed", this);
    if (pending.contains(node)) {
      return false;
    }
    pending.add(node);
    return true;
  }

  int getPendingCount() {
    return pending.size();
  }

  /**
   * Freezes the antecedent list. {@code affectedKeys}, if non-null, is the complete set of
   * references the region may assign or narrow; null means the set is unknown.
   */
  void seal(@Nullable Set<ReferenceKey> affectedKeys) {
    Preconditions.checkState(antecedents == null, "%s is already sealed", this);
    this.antecedents = ImmutableList.copyOf(pending);
    this.affectedKeys = affectedKeys == null ? null : ImmutableSet.copyOf(affectedKeys);
  }

  public boolean isSealed() {
    return antecedents != null;
  }

  @Override
  public ImmutableList<FlowNode> getAntecedents() {
    return antecedents != null ? antecedents : ImmutableList.copyOf(pending);
  }

  /** Returns the references affected within the joined region, or null if unknown. */
  @Nullable
  public ImmutableSet<ReferenceKey> getAffectedKeys() {
    return affectedKeys;
  }

  /**
   * Reports whether {@code key} is known to be unaffected within the joined region: neither the
   * key nor anything that invalidates it is in the affected set.
   */
  public boolean isUnaffected(ReferenceKey key) {
    if (affectedKeys == null) {
      return false;
    }
    for (ReferenceKey affected : affectedKeys) {
      if (affected.affects(key)) {
        return false;
      }
    }
    return true;
  }
}
