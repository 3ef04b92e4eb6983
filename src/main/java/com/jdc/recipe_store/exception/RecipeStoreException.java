package com.jdc.recipe_store.exception;

/**
 * 저장소 백엔드 공통 예외. 백엔드는 이 계층의 예외만 던지고, 서비스가 {@link ErrorCode}로 변환합니다.
 */
public abstract class RecipeStoreException extends RuntimeException {

    protected RecipeStoreException(String message) {
        super(message);
    }

    protected RecipeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
