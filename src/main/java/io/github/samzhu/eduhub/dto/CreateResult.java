package io.github.samzhu.eduhub.dto;

import java.util.List;

/**
 * 建立操作的結果。
 *
 * <p>建立操作不拋出例外，呼叫端依 {@link Status} 判斷結果：
 * <ul>
 *   <li>{@code CREATED} - 已寫入，{@code displayId} 為新 ID</li>
 *   <li>{@code ALREADY_ENROLLED} - 學生已選過此課程，未寫入，{@code displayId} 為既有選課 ID</li>
 *   <li>{@code INVALID} - 驗證失敗，未寫入，{@code messages} 為錯誤訊息</li>
 *   <li>{@code DUPLICATE_KEY} - 違反唯一索引，可換一組值重試</li>
 *   <li>{@code FAILED} - 其他資料庫錯誤</li>
 * </ul>
 *
 * @param status 結果狀態
 * @param displayId 顯示用 ID（若有）
 * @param messages 錯誤訊息，成功時為空
 */
public record CreateResult(
    Status status,
    String displayId,
    List<String> messages
) {

    public enum Status {
        CREATED,
        ALREADY_ENROLLED,
        INVALID,
        DUPLICATE_KEY,
        FAILED
    }

    public CreateResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static CreateResult created(String displayId) {
        return new CreateResult(Status.CREATED, displayId, List.of());
    }

    public static CreateResult alreadyEnrolled(String enrollmentId) {
        return new CreateResult(Status.ALREADY_ENROLLED, enrollmentId, List.of());
    }

    public static CreateResult invalid(List<String> messages) {
        return new CreateResult(Status.INVALID, null, messages);
    }

    public static CreateResult duplicateKey(String message) {
        return new CreateResult(Status.DUPLICATE_KEY, null, List.of(String.valueOf(message)));
    }

    public static CreateResult failed(String message) {
        return new CreateResult(Status.FAILED, null, List.of(String.valueOf(message)));
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
