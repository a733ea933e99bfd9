package com.profitshare.eligibility;

import java.util.Locale;

/**
 * Roles known to the profit-sharing rules, keyed by the lower-case {@code cargo} value.
 */
public enum Role {
    ESTAGIARIO("estagiario", "Trainee");

    private final String title;
    private final String ruleName;

    Role(String title, String ruleName) {
        this.title = title;
        this.ruleName = ruleName;
    }

    public String title() {
        return title;
    }

    public String ruleName() {
        return ruleName;
    }

    public boolean matches(String candidateTitle) {
        return candidateTitle != null && title.equals(candidateTitle.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolve a role from its enum name, title or rule name.
     *
     * @return the role, or null if not found
     */
    public static Role fromString(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        for (Role role : values()) {
            if (role.name().equalsIgnoreCase(normalized)
                    || role.title.equalsIgnoreCase(normalized)
                    || role.ruleName.equalsIgnoreCase(normalized)) {
                return role;
            }
        }
        return null;
    }
}
