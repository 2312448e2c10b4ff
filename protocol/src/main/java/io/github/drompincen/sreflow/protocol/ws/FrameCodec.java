package io.github.drompincen.sreflow.protocol.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON codec for workflow frames.
 *
 * <p>Decoding is total: malformed JSON, an unknown tag or a frame missing a required
 * field yields {@link Optional#empty()} and never throws. Encoding only fails on
 * programming errors.
 */
public class FrameCodec {

    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

    private final ObjectMapper objectMapper;

    public FrameCodec() {
        this(defaultMapper());
    }

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    // ---- encoding ----

    public String encode(ServerFrame frame) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event", frame.type().wireName());
        if (frame instanceof ServerFrame.Diagnostic d) {
            node.set("state", objectMapper.valueToTree(d.state()));
            node.put("diag_thread_id", d.diagThreadId());
        } else if (frame instanceof ServerFrame.History h) {
            node.set("diag_history", objectMapper.valueToTree(h.diagHistory()));
            node.set("sol_history", objectMapper.valueToTree(h.solHistory()));
            node.put("diag_thread_id", h.diagThreadId());
            putIfPresent(node, "sol_thread_id", h.solThreadId());
        } else if (frame instanceof ServerFrame.AwaitingApproval a) {
            node.put("question", a.question());
        } else if (frame instanceof ServerFrame.Handoff h) {
            node.put("sol_thread_id", h.solThreadId());
            if (h.state() != null && !h.state().isNull()) {
                node.set("state", h.state());
            }
        } else if (frame instanceof ServerFrame.Complete c) {
            node.put("diag_thread_id", c.diagThreadId());
            putIfPresent(node, "sol_thread_id", c.solThreadId());
        } else if (frame instanceof ServerFrame.Error e) {
            node.put("message", e.message());
        } else {
            throw new IllegalArgumentException("Unsupported server frame: " + frame.getClass().getName());
        }
        return write(node);
    }

    public String encode(ClientFrame frame) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", frame.type().wireName());
        if (frame instanceof ClientFrame.Start s) {
            node.set("issue", objectMapper.valueToTree(s.issue()));
        } else if (frame instanceof ClientFrame.Intervene i) {
            node.put("decision", i.decision().wireName());
            if (i.hasHint()) {
                node.put("hint", i.hint());
            }
        } else if (frame instanceof ClientFrame.Resume r) {
            node.put("decision", r.decision().wireName());
        } else {
            throw new IllegalArgumentException("Unsupported client frame: " + frame.getClass().getName());
        }
        return write(node);
    }

    // ---- decoding ----

    public Optional<ServerFrame> decodeServer(String text) {
        JsonNode node = readObject(text);
        if (node == null) return Optional.empty();
        FrameType type = FrameType.fromWire(node.path("event").asText(null));
        if (type == null || type.isClientFrame()) {
            log.debug("Dropping server frame with unknown event tag: {}", node.path("event"));
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(switch (type) {
                case DIAGNOSTIC -> decodeDiagnostic(node);
                case HISTORY -> new ServerFrame.History(
                        messages(node.path("diag_history")),
                        messages(node.path("sol_history")),
                        text(node, "diag_thread_id"),
                        text(node, "sol_thread_id"));
                case AWAITING_APPROVAL, HANDOFF_APPROVAL, RESUME_AVAILABLE -> new ServerFrame.AwaitingApproval(
                        text(node, "question"), DecisionKind.fromWire(type.wireName()));
                case HANDOFF -> new ServerFrame.Handoff(
                        text(node, "sol_thread_id"),
                        node.hasNonNull("state") ? node.get("state") : null);
                case COMPLETE -> new ServerFrame.Complete(
                        text(node, "diag_thread_id"), text(node, "sol_thread_id"));
                case ERROR -> new ServerFrame.Error(
                        node.hasNonNull("message") ? node.get("message").asText() : text(node, "error"));
                default -> null;
            });
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Dropping malformed {} frame: {}", type.wireName(), e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<ClientFrame> decodeClient(String text) {
        JsonNode node = readObject(text);
        if (node == null) return Optional.empty();
        FrameType type = FrameType.fromWire(node.path("type").asText(null));
        if (type == null || !type.isClientFrame()) {
            log.debug("Dropping client frame with unknown type: {}", node.path("type"));
            return Optional.empty();
        }
        try {
            ClientFrame frame = switch (type) {
                case START -> node.path("issue").isObject()
                        ? new ClientFrame.Start(objectMapper.treeToValue(node.get("issue"), Issue.class))
                        : null;
                case INTERVENE -> {
                    InterventionDecision decision = InterventionDecision.fromWire(text(node, "decision"));
                    yield decision != null ? new ClientFrame.Intervene(decision, text(node, "hint")) : null;
                }
                case RESUME -> {
                    // an absent decision means "yes", matching the client default
                    String raw = node.hasNonNull("decision") ? text(node, "decision") : ResumeDecision.YES.wireName();
                    ResumeDecision decision = ResumeDecision.fromWire(raw);
                    yield decision != null ? new ClientFrame.Resume(decision) : null;
                }
                default -> null;
            };
            return Optional.ofNullable(frame);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Dropping malformed {} frame: {}", type.wireName(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Parses free text as a JSON object, or returns {@code null}. */
    public JsonNode readObject(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private ServerFrame decodeDiagnostic(JsonNode node) throws JsonProcessingException {
        if (!node.path("state").isObject()) return null;
        AgentStateSnapshot state = objectMapper.treeToValue(node.get("state"), AgentStateSnapshot.class);
        return new ServerFrame.Diagnostic(state, text(node, "diag_thread_id"));
    }

    /** Bare strings in a history array are accepted as role-less messages. */
    private List<MessageItem> messages(JsonNode node) throws JsonProcessingException {
        if (!node.isArray()) return List.of();
        List<MessageItem> items = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isTextual()) {
                items.add(new MessageItem(null, element.asText(), null));
            } else if (element.isObject()) {
                items.add(objectMapper.treeToValue(element, MessageItem.class));
            }
        }
        return items;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) node.put(field, value);
    }
}
