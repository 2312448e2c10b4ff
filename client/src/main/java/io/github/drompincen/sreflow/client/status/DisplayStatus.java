package io.github.drompincen.sreflow.client.status;

public enum DisplayStatus {
    NOT_STARTED("Not Started"),
    HANDING_OFF("Handing Off"),
    RESUMING("Resuming"),
    HANDOFF("Handed Off"),
    AWAIT_USER_APPROVAL("Awaiting Approval"),
    AWAIT_HANDOFF_APPROVAL("Awaiting Handoff Approval"),
    IN_PROGRESS("In Progress");

    private final String label;

    DisplayStatus(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Transient statuses last only while a decision is on its way to the server. */
    public boolean isTransient() {
        return this == HANDING_OFF || this == RESUMING;
    }
}
