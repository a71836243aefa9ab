/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.assetscan.metrics;

/**
 * Metric name constants for assetscan instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Registration (2 metrics)</b> - Patterns registered and duplicates folded into aliases
 *   <li><b>Automaton (4 metrics)</b> - Builds, build latency, size of the last built automaton
 *   <li><b>Scanning (4 metrics)</b> - Documents and characters scanned, per-document latency,
 *       early terminations
 *   <li><b>Corpus (3 metrics)</b> - Corpus scans, their latency and documents per corpus
 *   <li><b>Errors (2 metrics)</b> - Rejected empty patterns, scans before build
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * ScanConfig config = ScanMetricsConfig.withMetrics(registry, "myapp.assets", true);
 *
 * Automaton automaton = AutomatonBuilder.create(config).registerAll(images).build();
 * automaton.scan(content);
 *
 * Counter scanned = registry.counter(
 *     MetricRegistry.name("myapp.assets", MetricNames.SCAN_DOCUMENTS));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Registration Metrics (2)
  // ========================================

  /**
   * Patterns registered, duplicates included.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_REGISTERED = "patterns.registered.total.count";

  /**
   * Registrations that repeated an already registered pattern and were folded into its id.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_DUPLICATE = "patterns.duplicate.total.count";

  // ========================================
  // Automaton Metrics (4)
  // ========================================

  /**
   * Automatons built.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String AUTOMATON_BUILDS = "automaton.builds.total.count";

  /**
   * Time spent in trie insertion plus failure-link and output-set computation.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> Grows with the total length of all patterns, not with corpus size
   */
  public static final String AUTOMATON_BUILD_LATENCY = "automaton.build.latency";

  /**
   * Trie nodes of the most recently built automaton, root included.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String AUTOMATON_NODES = "automaton.nodes.current.count";

  /**
   * Distinct patterns of the most recently built automaton.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String AUTOMATON_PATTERNS = "automaton.patterns.current.count";

  // ========================================
  // Scanning Metrics (4)
  // ========================================

  /**
   * Documents scanned.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SCAN_DOCUMENTS = "scan.documents.total.count";

  /**
   * Characters consumed by scans. Lower than the corpus size when scans terminate early.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SCAN_CHARACTERS = "scan.characters.total.count";

  /**
   * Per-document scan latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> Linear in document length; independent of pattern count
   */
  public static final String SCAN_LATENCY = "scan.latency";

  /**
   * Scans that stopped before the end of the document because every pattern had already matched.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SCAN_EARLY_TERMINATIONS = "scan.early_terminations.total.count";

  // ========================================
  // Corpus Metrics (3)
  // ========================================

  /**
   * Corpus scans (fan-out over a document collection).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CORPUS_SCANS = "corpus.scans.total.count";

  /**
   * Wall-clock time of a corpus scan including fan-in.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String CORPUS_SCAN_LATENCY = "corpus.scan.latency";

  /**
   * Documents submitted through corpus scans.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CORPUS_DOCUMENTS = "corpus.documents.total.count";

  // ========================================
  // Error Metrics (2)
  // ========================================

  /**
   * Empty patterns rejected at registration.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Usually an asset enumeration that yields blank names
   */
  public static final String ERRORS_EMPTY_PATTERN = "errors.empty_pattern.total.count";

  /**
   * Scans attempted on an index that was never built.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_BUILD_NOT_INVOKED = "errors.build_not_invoked.total.count";
}
