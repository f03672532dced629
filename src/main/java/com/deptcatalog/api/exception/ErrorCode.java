package com.deptcatalog.api.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    DEPARTMENT_REQUIRED(ErrorType.INVALID_INPUT, "부서 정보가 비어 있습니다."),
    DEPARTMENT_NAME_REQUIRED(ErrorType.INVALID_INPUT, "부서명은 비어 있을 수 없습니다."),
    DEPARTMENT_NAME_TOO_LONG(ErrorType.INVALID_INPUT, "부서명은 100자를 초과할 수 없습니다."),
    DEPARTMENT_DESCRIPTION_TOO_LONG(ErrorType.INVALID_INPUT, "부서 설명은 500자를 초과할 수 없습니다."),
    DEPARTMENT_VALIDATION_FAILED(ErrorType.INVALID_INPUT, "부서 정보가 유효하지 않습니다."),
    INVALID_DEPARTMENT_ID(ErrorType.INVALID_INPUT, "부서 ID는 0보다 커야 합니다."),
    DEPARTMENT_ID_NOT_ALLOWED(ErrorType.INVALID_INPUT, "신규 부서에는 ID를 지정할 수 없습니다."),
    SEARCH_KEYWORD_REQUIRED(ErrorType.INVALID_INPUT, "검색어는 비어 있을 수 없습니다."),
    INVALID_REQUEST(ErrorType.INVALID_INPUT, "요청 값이 올바르지 않습니다."),
    DEPARTMENT_NOT_FOUND(ErrorType.NOT_FOUND, "부서를 찾을 수 없습니다."),
    DUPLICATE_DEPARTMENT_NAME(ErrorType.CONFLICT, "이미 존재하는 부서명입니다."),
    PERSISTENCE_FAILURE(ErrorType.PERSISTENCE_FAILURE, "부서 정보를 저장소에 반영하지 못했습니다.");

    private final ErrorType type;
    private final String message;
}
