package io.github.drompincen.sreflow.protocol.ws;

import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrameTypeTest {

    @Test
    void clientAndServerTagsAreSeparated() {
        assertThat(FrameType.START.isClientFrame()).isTrue();
        assertThat(FrameType.RESUME.isClientFrame()).isTrue();
        assertThat(FrameType.DIAGNOSTIC.isClientFrame()).isFalse();
        assertThat(FrameType.ERROR.isClientFrame()).isFalse();
    }

    @Test
    void everyDecisionKindHasItsOwnTag() {
        for (DecisionKind kind : DecisionKind.values()) {
            FrameType type = FrameType.forDecision(kind);
            assertThat(type.isDecisionRequest()).isTrue();
            assertThat(type.wireName()).isEqualTo(kind.wireName());
        }
    }

    @Test
    void fromWireReturnsNullForUnknownTags() {
        assertThat(FrameType.fromWire("handoff")).isEqualTo(FrameType.HANDOFF);
        assertThat(FrameType.fromWire("HANDOFF")).isNull();
        assertThat(FrameType.fromWire(null)).isNull();
    }
}
