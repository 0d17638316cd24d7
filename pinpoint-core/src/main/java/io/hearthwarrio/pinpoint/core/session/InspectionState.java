package io.hearthwarrio.pinpoint.core.session;

public enum InspectionState {
    IDLE,
    INSPECTING
}
