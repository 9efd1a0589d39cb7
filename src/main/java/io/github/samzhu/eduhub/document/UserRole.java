package io.github.samzhu.eduhub.document;

/**
 * 用戶角色。
 *
 * <p>文件中以小寫字串儲存（{@code student} / {@code instructor}），此列舉僅提供合法值與 ID 前綴，
 * 建立後角色不可變更。
 */
public enum UserRole {

    STUDENT("student", "STU"),
    INSTRUCTOR("instructor", "INST");

    /** 供 {@code @Pattern} 使用的合法值正規表示式 */
    public static final String PATTERN = "student|instructor";

    private final String value;
    private final String idPrefix;

    UserRole(String value, String idPrefix) {
        this.value = value;
        this.idPrefix = idPrefix;
    }

    public String value() {
        return value;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
