package io.github.samzhu.eduhub.validation;

import java.util.List;
import java.util.Set;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import org.springframework.stereotype.Component;

/**
 * 寫入前的文件驗證。
 *
 * <p>依文件類別上的 Bean Validation 註解檢查必填欄位、email 格式與列舉值，
 * 回傳人類可讀的錯誤訊息（已排序、去重）。空清單表示驗證通過。
 */
@Component
public class DocumentValidator {

    private final Validator validator;

    public DocumentValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> List<String> validate(T document) {
        Set<ConstraintViolation<T>> violations = validator.validate(document);
        return violations.stream()
            .map(ConstraintViolation::getMessage)
            .distinct()
            .sorted()
            .toList();
    }
}
