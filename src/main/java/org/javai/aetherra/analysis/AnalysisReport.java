package org.javai.aetherra.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.javai.aetherra.ast.NodeKind;

/**
 * Read-only statistics and validation findings for one program.
 *
 * @param nodeCounts number of nodes per kind, the program root included
 * @param maxDepth depth of the deepest node; the program root is at depth 0
 * @param totalNodes number of nodes reachable from the root
 * @param complexityScore weighted count of control-flow, function and side-effecting nodes
 * @param errors structural problems; nodes named here compile to error markers
 * @param warnings suspicious but compilable constructs
 */
public record AnalysisReport(
		Map<NodeKind, Integer> nodeCounts,
		int maxDepth,
		int totalNodes,
		int complexityScore,
		List<String> errors,
		List<String> warnings
) {

	public AnalysisReport {
		EnumMap<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
		if (nodeCounts != null) {
			counts.putAll(nodeCounts);
		}
		nodeCounts = Collections.unmodifiableMap(counts);
		errors = errors != null ? List.copyOf(errors) : List.of();
		warnings = warnings != null ? List.copyOf(warnings) : List.of();
	}

	public int count(NodeKind kind) {
		return nodeCounts.getOrDefault(kind, 0);
	}

	public boolean isValid() {
		return errors.isEmpty();
	}
}
