package org.rostilos.atlassian.bitbucket.model;

import java.util.Locale;

public enum EPullRequestState {
    OPEN,
    MERGED,
    DECLINED,
    SUPERSEDED;

    /**
     * @return the matching state, or {@code null} for a missing or unrecognised value
     */
    public static EPullRequestState fromValue(String value) {
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
