package io.github.samzhu.eduhub.dto.analytics;

import java.util.List;

/**
 * 學生成績表現。
 *
 * @param studentId 學生 ID
 * @param studentName 顯示名稱（名 + 空白 + 姓）
 * @param averageGrade 平均分數，未評分的繳交不計入；全部未評分時為 null
 * @param totalSubmissions 繳交數（含未評分）
 * @param coursesParticipated 有繳交作業的課程 ID（不重複）
 * @param coursesCount 課程數
 */
public record StudentPerformance(
    String studentId,
    String studentName,
    Double averageGrade,
    long totalSubmissions,
    List<String> coursesParticipated,
    long coursesCount
) {}
