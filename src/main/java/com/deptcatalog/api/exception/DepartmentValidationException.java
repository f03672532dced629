package com.deptcatalog.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 필드 위반을 모두 수집한 검증 실패. 첫 번째 위반 메시지가 예외 메시지가 된다.
 */
@Getter
public class DepartmentValidationException extends BusinessException {

    private final List<String> violations;

    public DepartmentValidationException(List<String> violations) {
        super(ErrorCode.DEPARTMENT_VALIDATION_FAILED, violations.get(0));
        this.violations = List.copyOf(violations);
    }
}
