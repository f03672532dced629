package com.deptcatalog.service.department;

import com.deptcatalog.api.exception.BusinessException;
import com.deptcatalog.api.exception.DepartmentValidationException;
import com.deptcatalog.api.exception.ErrorCode;
import com.deptcatalog.config.DepartmentProperties;
import com.deptcatalog.domain.department.Department;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class DepartmentValidator {

    // 위반 메시지 정렬 기준: 엔티티 필드 선언 순서
    private static final List<String> FIELD_ORDER = List.of("name", "description");

    private final Validator validator;
    private final DepartmentProperties departmentProperties;

    public void validateForAdd(Department department) {
        requireDepartment(department);
        validateFields(department);
        // 0 또는 null 만 미저장 상태로 인정
        Long id = department.getId();
        if (id != null && id != 0) {
            log.warn("신규 부서에 ID 지정됨: {}", id);
            throw new BusinessException(ErrorCode.DEPARTMENT_ID_NOT_ALLOWED);
        }
    }

    public void validateForUpdate(Department department) {
        requireDepartment(department);
        validateId(department.getId());
        validateFields(department);
    }

    public void validateId(Long id) {
        if (id == null || id <= 0) {
            log.warn("유효하지 않은 부서 ID: {}", id);
            throw new BusinessException(ErrorCode.INVALID_DEPARTMENT_ID);
        }
    }

    public void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.DEPARTMENT_NAME_REQUIRED);
        }
    }

    public void validateKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new BusinessException(ErrorCode.SEARCH_KEYWORD_REQUIRED);
        }
    }

    private void requireDepartment(Department department) {
        if (department == null) {
            throw new BusinessException(ErrorCode.DEPARTMENT_REQUIRED);
        }
    }

    private void validateFields(Department department) {
        if (departmentProperties.getValidation().getMode() == DepartmentProperties.ValidationMode.ANNOTATION) {
            validateAnnotations(department);
        } else {
            validateInOrder(department);
        }
    }

    private void validateInOrder(Department department) {
        String name = department.getName();
        if (name == null || name.isBlank()) {
            log.warn("부서명이 비어 있음");
            throw new BusinessException(ErrorCode.DEPARTMENT_NAME_REQUIRED);
        }
        if (name.length() > Department.NAME_MAX_LENGTH) {
            log.warn("부서명 길이 초과: {}자", name.length());
            throw new BusinessException(ErrorCode.DEPARTMENT_NAME_TOO_LONG);
        }

        String description = department.getDescription();
        if (description != null && description.length() > Department.DESCRIPTION_MAX_LENGTH) {
            log.warn("부서 설명 길이 초과: {}자", description.length());
            throw new BusinessException(ErrorCode.DEPARTMENT_DESCRIPTION_TOO_LONG);
        }
    }

    private void validateAnnotations(Department department) {
        List<String> violations = validator.validate(department).stream()
                .sorted(Comparator.comparingInt(this::fieldIndex))
                .map(ConstraintViolation::getMessage)
                .toList();

        if (!violations.isEmpty()) {
            log.warn("부서 검증 실패: {}", violations);
            throw new DepartmentValidationException(violations);
        }
    }

    private int fieldIndex(ConstraintViolation<Department> violation) {
        int index = FIELD_ORDER.indexOf(violation.getPropertyPath().toString());
        return index < 0 ? FIELD_ORDER.size() : index;
    }
}
