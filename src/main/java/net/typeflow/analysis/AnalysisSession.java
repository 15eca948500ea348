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

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import net.typeflow.flow.FlowGraph;
import net.typeflow.flow.FlowGraphBuilder;
import net.typeflow.syntax.SourceFile;

/**
 * The analysis of one file: its flow graph and the analyzer answering queries over it.
 *
 * <p>Caches live exactly as long as the graph they describe. When the file changes, {@link
 * #update} builds a new graph and a new analyzer, discarding every cached result.
 */
public final class AnalysisSession {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final TypeEvaluator.Factory evaluatorFactory;
  private final FlowOptions options;
  private final CancellationToken token;
  private int generation;
  private CodeFlowAnalyzer analyzer;

  private AnalysisSession(
      SourceFile file,
      TypeEvaluator.Factory evaluatorFactory,
      FlowOptions options,
      CancellationToken token) {
    this.evaluatorFactory = evaluatorFactory;
    this.options = options;
    this.token = token;
    this.analyzer = newAnalyzer(file);
  }

  /**
   * Creates a session for a file. Throws {@link IllegalArgumentException} if the file has syntax
   * errors.
   */
  public static AnalysisSession create(
      SourceFile file,
      TypeEvaluator.Factory evaluatorFactory,
      FlowOptions options,
      CancellationToken token) {
    Preconditions.checkNotNull(options);
    return new AnalysisSession(file, evaluatorFactory, options, token);
  }

  /** Creates a session with default options that cannot be cancelled. */
  public static AnalysisSession create(SourceFile file, TypeEvaluator.Factory evaluatorFactory) {
    return create(file, evaluatorFactory, FlowOptions.DEFAULT, CancellationToken.NONE);
  }

  private CodeFlowAnalyzer newAnalyzer(SourceFile file) {
    FlowGraph graph = FlowGraphBuilder.build(file);
    return new CodeFlowAnalyzer(graph, evaluatorFactory, options, token);
  }

  /** Replaces the analyzed file, dropping all results computed for the previous one. */
  public void update(SourceFile file) {
    CodeFlowAnalyzer next = newAnalyzer(file);
    generation++;
    logger.atFine().log(
        "rebuilt flow graph of %s (generation %d, %d nodes); caches dropped",
        file.getFile(), generation, next.getGraph().getNodeCount());
    analyzer = next;
  }

  public CodeFlowAnalyzer getAnalyzer() {
    return analyzer;
  }

  public FlowGraph getGraph() {
    return analyzer.getGraph();
  }

  public FlowOptions getOptions() {
    return options;
  }

  /** Returns the number of times the file was replaced. */
  public int getGeneration() {
    return generation;
  }
}
