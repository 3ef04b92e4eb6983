package com.jdc.recipe_store.exception;

import lombok.Getter;

/**
 * 서비스 계층에서 발생하는 모든 API 오류.
 * 응답 상태와 코드는 {@link ErrorCode}가 결정하고, detail은 검증 실패 필드처럼 호출자에게 보여줄 부가 정보만 담습니다.
 */
@Getter
public class CustomException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String detail;

    public CustomException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.detail = null;
    }

    public CustomException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + " " + detail);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public CustomException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.detail = null;
    }
}
