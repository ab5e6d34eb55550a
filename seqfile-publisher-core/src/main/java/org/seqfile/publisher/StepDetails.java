package org.seqfile.publisher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The input-output maps of a step, in the order the LIMS returned them.
 */
public record StepDetails(String stepUri, List<IoMapping> mappings) {

	public StepDetails {
		RecordParseException.requireText(stepUri, "uri", "Step details");
		mappings = List.copyOf(mappings);
	}

	/**
	 * Distinct inputs by LIMS id, in first-seen order.
	 * @return map from input LIMS id to input URI
	 */
	public Map<String, String> distinctInputs() {
		Map<String, String> inputs = new LinkedHashMap<>();
		for (IoMapping mapping : mappings) {
			inputs.putIfAbsent(mapping.inputId(), mapping.inputUri());
		}
		return inputs;
	}

	/**
	 * Distinct URIs of result files shared by all inputs, in first-seen order.
	 */
	public List<String> sharedResultFileUris() {
		Set<String> uris = new LinkedHashSet<>();
		for (IoMapping mapping : mappings) {
			if (mapping.isSharedResultFile()) {
				uris.add(mapping.outputUri());
			}
		}
		return new ArrayList<>(uris);
	}

}
