package org.javai.mathtex.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.TreeSet;
import org.javai.mathtex.diag.FormulaDiagnostic;

/**
 * Renders conversion results as a JSON report for tooling: per formula its diagnostics, plus the
 * packages the whole batch needs.
 */
public final class DiagnosticsJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DiagnosticsJsonMapper() {
	}

	public static ObjectNode toJson(FormulaResult result) {
		ObjectNode node = mapper.createObjectNode();
		node.put("index", result.index());
		node.put("display", result.display());
		node.put("degraded", result.degraded());
		ArrayNode diagnostics = node.putArray("diagnostics");
		for (FormulaDiagnostic d : result.diagnostics()) {
			ObjectNode dNode = diagnostics.addObject();
			dNode.put("kind", d.kind().name());
			dNode.put("reason", d.reason());
		}
		ArrayNode packages = node.putArray("packages");
		result.requiredPackages().forEach(packages::add);
		return node;
	}

	public static ObjectNode toReport(List<FormulaResult> results) {
		ObjectNode report = mapper.createObjectNode();
		report.put("formulas", results.size());
		report.put("degraded", results.stream().filter(FormulaResult::degraded).count());
		TreeSet<String> packages = new TreeSet<>();
		ArrayNode entries = report.putArray("results");
		for (FormulaResult result : results) {
			packages.addAll(result.requiredPackages());
			if (result.degraded()) {
				entries.add(toJson(result));
			}
		}
		ArrayNode packageArray = report.putArray("packages");
		packages.forEach(packageArray::add);
		return report;
	}

	public static String toReportString(List<FormulaResult> results) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toReport(results));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render diagnostics report", e);
		}
	}
}
