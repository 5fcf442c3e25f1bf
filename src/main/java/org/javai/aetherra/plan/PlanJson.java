package org.javai.aetherra.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of an {@link ExecutablePlan} for tools that inspect compiled programs.
 *
 * <p>Example:
 * <pre>
 * {
 *   "calls" : [ {
 *     "call" : "execute_conditional",
 *     "condition" : "error_rate > 5%",
 *     "thenPlan" : { "calls" : [ { "call" : "suggest_fix", "target" : "fix for \"performance\"" } ] },
 *     "elsePlan" : { "calls" : [ ] }
 *   } ]
 * }
 * </pre>
 * Absent optional fields are omitted.
 */
public final class PlanJson {

	private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
			.setSerializationInclusion(JsonInclude.Include.NON_NULL)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	private PlanJson() {
	}

	public static String toJson(ExecutablePlan plan) throws JsonProcessingException {
		return DEFAULT_MAPPER.writeValueAsString(plan);
	}

	public static String toPrettyJson(ExecutablePlan plan) throws JsonProcessingException {
		return DEFAULT_MAPPER.copy()
				.enable(SerializationFeature.INDENT_OUTPUT)
				.writeValueAsString(plan);
	}

	/**
	 * Reads a plan written by {@link #toJson(ExecutablePlan)}.
	 *
	 * @throws JsonProcessingException if the text is not valid plan JSON
	 */
	public static ExecutablePlan fromJson(String json) throws JsonProcessingException {
		return fromJson(json, DEFAULT_MAPPER);
	}

	public static ExecutablePlan fromJson(String json, ObjectMapper mapper) throws JsonProcessingException {
		return mapper.readValue(json, ExecutablePlan.class);
	}
}
