package io.github.drompincen.sreflow.client.conversation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decoded output of the solution agent. Exactly one of the variants applies, chosen
 * by {@link SolutionDecoder}.
 *
 * @param steps      top-level remediation steps, possibly empty
 * @param fixText    recommended fix given as plain text
 * @param fixSteps   steps of a structured recommended fix
 * @param fixNotes   notes of a structured recommended fix
 * @param raw        the decoded JSON object
 */
public record SolutionState(
        Kind kind,
        String summary,
        List<String> steps,
        String fixText,
        List<String> fixSteps,
        String fixNotes,
        Escalation escalation,
        JsonNode raw
) {
    public enum Kind { RECOMMENDED_FIX, ESCALATION, SUMMARY_ONLY }

    public SolutionState {
        steps = steps != null ? List.copyOf(steps) : List.of();
        fixSteps = fixSteps != null ? List.copyOf(fixSteps) : List.of();
    }

    public record Escalation(String reason, String severity, String draft) {

        static final String DEFAULT_SUBJECT = "K8s incident escalation";
        private static final Pattern SUBJECT_LINE = Pattern.compile("^\\s*Subject:\\s*(.+)$", Pattern.MULTILINE);

        /**
         * The embedded {@code Subject:} line of the draft, else {@code [SEVERITY] reason},
         * else the reason alone.
         */
        public String subject() {
            if (draft != null) {
                Matcher m = SUBJECT_LINE.matcher(draft);
                if (m.find()) return m.group(1).trim();
            }
            String base = reason != null && !reason.isBlank() ? reason : DEFAULT_SUBJECT;
            return severity != null && !severity.isBlank()
                    ? "[" + severity.toUpperCase(Locale.ROOT) + "] " + base
                    : base;
        }

        /** The draft with a leading {@code Subject:} line removed. */
        public String bodyWithoutSubject() {
            return draft != null ? draft.replaceFirst("^\\s*Subject:.*\\r?\\n", "") : "";
        }
    }
}
