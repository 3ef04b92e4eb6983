package com.jdc.recipe_store.exception;

/**
 * 디스크 I/O, DB 연결 실패처럼 백엔드 자체가 요청을 처리하지 못한 경우.
 */
public class RecipeStorageException extends RecipeStoreException {

    public RecipeStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
