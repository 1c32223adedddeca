package org.rostilos.atlassian.bitbucket.model;

import java.util.Locale;

public enum EParticipantRole {
    PARTICIPANT,
    REVIEWER;

    public static EParticipantRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
