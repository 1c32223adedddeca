package org.rostilos.atlassian.bitbucket.model;

import java.util.Locale;

/**
 * Review verdict of a pull request participant. Absent when the participant has not voted.
 */
public enum EParticipantState {
    APPROVED("approved"),
    CHANGES_REQUESTED("changes_requested");

    private final String value;

    EParticipantState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EParticipantState fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        for (EParticipantState state : values()) {
            if (state.value.equals(normalized)) {
                return state;
            }
        }
        return null;
    }
}
