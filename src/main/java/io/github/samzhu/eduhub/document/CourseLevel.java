package io.github.samzhu.eduhub.document;

/**
 * 課程難度，文件中以小寫字串儲存。
 */
public enum CourseLevel {

    BEGINNER("beginner"),
    INTERMEDIATE("intermediate"),
    ADVANCED("advanced");

    public static final String PATTERN = "beginner|intermediate|advanced";

    private final String value;

    CourseLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
