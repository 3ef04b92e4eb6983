package com.jdc.recipe_store.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),
    DUPLICATE_RECIPE_ID(HttpStatus.CONFLICT, "202", "이미 존재하는 레시피 ID입니다."),
    INVALID_RECIPE_PAYLOAD(HttpStatus.BAD_REQUEST, "203", "레시피 스키마 검증에 실패했습니다."),

    // --- Storage (800) ---
    RECIPE_STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "801", "레시피 저장소 처리 중 오류가 발생했습니다."),

    // --- Common (900) ---
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    INVALID_JSON_BODY(HttpStatus.BAD_REQUEST, "905", "요청 본문이 올바른 JSON 형식이 아닙니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "906", "지원하지 않는 Content-Type 입니다."),
    UNKNOWN_ENDPOINT(HttpStatus.NOT_FOUND, "907", "존재하지 않는 API 경로입니다."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
