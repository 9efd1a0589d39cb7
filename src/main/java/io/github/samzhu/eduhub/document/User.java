package io.github.samzhu.eduhub.document;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * 用戶文件（學生或講師）。
 *
 * <p>設計原則：
 * <ul>
 *   <li>{@code _id} 由 MongoDB 自動產生 ObjectId，{@code userId} 為顯示用 ID（如 {@code STU_001}）</li>
 *   <li>{@code email} 與 {@code userId} 皆為唯一索引</li>
 *   <li>不刪除用戶，停用時將 {@code isActive} 設為 false</li>
 * </ul>
 */
@Document(collection = "users")
public record User(
    @Id String id,

    @NotBlank(message = "Missing required field: userId")
    @Indexed(unique = true) String userId,

    @NotBlank(message = "Missing required field: email")
    @Pattern(regexp = User.EMAIL_PATTERN, message = "Invalid email format")
    @Indexed(unique = true) String email,

    @NotBlank(message = "Missing required field: firstName")
    String firstName,

    @NotBlank(message = "Missing required field: lastName")
    String lastName,

    @NotBlank(message = "Missing required field: role")
    @Pattern(regexp = UserRole.PATTERN, message = "Role must be 'student' or 'instructor'")
    @Indexed String role,

    Instant dateJoined,
    @Valid Profile profile,
    boolean isActive
) {

    public static final String EMAIL_PATTERN = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$";

    /**
     * 用戶公開簡介。
     *
     * @param bio 自我介紹
     * @param avatar 頭像 URL
     * @param skills 技能清單
     */
    public record Profile(
        String bio,
        String avatar,
        List<String> skills
    ) {}
}
