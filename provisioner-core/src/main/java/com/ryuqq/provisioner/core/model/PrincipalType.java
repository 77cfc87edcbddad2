package com.ryuqq.provisioner.core.model;

/**
 * 디렉터리 주체 종류.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum PrincipalType {

    USER("User"),
    GROUP("Group");

    private final String value;

    PrincipalType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
