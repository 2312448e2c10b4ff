package io.github.drompincen.sreflow.client.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns whatever the solution agent produced into a {@link SolutionState}. Never throws.
 *
 * <p>Fields are probed in this order:
 * <ol>
 *   <li>remediation steps: {@code steps}, {@code remediation_steps}, {@code actions}</li>
 *   <li>fix as text: {@code recommended_fix} (string), {@code recommendation} (string)</li>
 *   <li>fix as object: {@code recommended_fix} with {@code steps} and {@code notes}</li>
 *   <li>escalation: {@code escalation}, {@code escalation_email}, {@code email}; either a
 *       string draft or an object with {@code reason}, {@code severity} and
 *       {@code email_draft} or {@code body}</li>
 *   <li>summary for the summary-only variant: {@code summary}, {@code description},
 *       {@code detail}, {@code message}, else "Solution details provided."</li>
 * </ol>
 * A recommended fix wins over an escalation, and any escalation object, even {@code {}},
 * marks the solution as an escalation. Input that is not a JSON object is
 * treated as {@code {"summary": text}}.
 */
public class SolutionDecoder {

    static final String FIX_SUMMARY = "Recommended fix is provided.";
    static final String ESCALATION_SUMMARY = "Escalation is recommended.";
    static final String FALLBACK_SUMMARY = "Solution details provided.";

    private static final String[] STEP_FIELDS = {"steps", "remediation_steps", "actions"};
    private static final String[] ESCALATION_FIELDS = {"escalation", "escalation_email", "email"};
    private static final String[] SUMMARY_FIELDS = {"summary", "description", "detail", "message"};

    private final FrameCodec codec;

    public SolutionDecoder(FrameCodec codec) {
        this.codec = codec;
    }

    /** Decodes free text from a solution thread message; {@code null} for blank text. */
    public SolutionState decodeText(String text) {
        if (text == null || text.isBlank()) return null;
        JsonNode node = codec.readObject(text);
        return decode(node != null ? node : JsonNodeFactory.instance.textNode(text));
    }

    /** Decodes a {@code handoff} state; {@code null} or JSON null yields {@code null}. */
    public SolutionState decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        ObjectNode state;
        if (node.isObject()) {
            state = (ObjectNode) node;
        } else {
            state = JsonNodeFactory.instance.objectNode();
            state.put("summary", node.isTextual() ? node.asText() : node.toString());
        }

        List<String> steps = firstArray(state, STEP_FIELDS);
        JsonNode recommended = state.get("recommended_fix");
        String fixText = recommended != null && recommended.isTextual() ? recommended.asText() : null;
        if (fixText == null) fixText = textOrNull(state.get("recommendation"));
        List<String> fixSteps = List.of();
        String fixNotes = null;
        boolean fixObject = recommended != null && recommended.isObject();
        if (fixObject) {
            fixSteps = strings(recommended.get("steps"));
            fixNotes = textOrNull(recommended.get("notes"));
        }
        SolutionState.Escalation escalation = escalation(state);

        if (fixText != null || fixObject) {
            return new SolutionState(SolutionState.Kind.RECOMMENDED_FIX, FIX_SUMMARY, steps,
                    fixText, fixSteps, fixNotes, escalation, state);
        }
        if (escalation != null) {
            return new SolutionState(SolutionState.Kind.ESCALATION, ESCALATION_SUMMARY, steps,
                    null, List.of(), null, escalation, state);
        }
        String summary = null;
        for (String field : SUMMARY_FIELDS) {
            summary = textOrNull(state.get(field));
            if (summary != null) break;
        }
        return new SolutionState(SolutionState.Kind.SUMMARY_ONLY, summary != null ? summary : FALLBACK_SUMMARY,
                steps, null, List.of(), null, null, state);
    }

    private static SolutionState.Escalation escalation(JsonNode state) {
        for (String field : ESCALATION_FIELDS) {
            JsonNode value = state.get(field);
            if (value == null || value.isNull()) continue;
            if (value.isTextual() && !value.asText().isBlank()) {
                return new SolutionState.Escalation(null, null, value.asText());
            }
            // an object counts even when empty; its fields are all optional
            if (value.isObject()) {
                String draft = textOrNull(value.get("email_draft"));
                if (draft == null) draft = textOrNull(value.get("body"));
                return new SolutionState.Escalation(textOrNull(value.get("reason")),
                        textOrNull(value.get("severity")), draft);
            }
        }
        return null;
    }

    private static List<String> firstArray(JsonNode state, String[] fields) {
        for (String field : fields) {
            JsonNode value = state.get(field);
            if (value != null && value.isArray()) return strings(value);
        }
        return List.of();
    }

    private static List<String> strings(JsonNode array) {
        if (array == null || !array.isArray()) return List.of();
        List<String> out = new ArrayList<>();
        array.forEach(item -> out.add(item.isTextual() ? item.asText() : item.toString()));
        return out;
    }

    private static String textOrNull(JsonNode value) {
        if (value == null || !value.isTextual()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
