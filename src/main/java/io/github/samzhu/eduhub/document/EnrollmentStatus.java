package io.github.samzhu.eduhub.document;

import java.util.Arrays;
import java.util.Optional;

/**
 * 選課狀態，文件中以小寫字串儲存。
 */
public enum EnrollmentStatus {

    ACTIVE("active"),
    COMPLETED("completed"),
    DROPPED("dropped");

    public static final String PATTERN = "active|completed|dropped";

    private final String value;

    EnrollmentStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EnrollmentStatus> fromValue(String value) {
        return Arrays.stream(values()).filter(s -> s.value.equals(value)).findFirst();
    }
}
