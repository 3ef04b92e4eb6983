package com.jdc.recipe_store.domain.repository;

import com.jdc.recipe_store.domain.model.Recipe;
import com.jdc.recipe_store.domain.type.RecipeStoreType;
import com.jdc.recipe_store.exception.RecipeAlreadyExistsException;
import com.jdc.recipe_store.exception.RecipeNotFoundException;
import com.jdc.recipe_store.exception.RecipeStorageException;

import java.util.List;

/**
 * 레시피 저장소 계약. 메모리, 파일시스템, RDB 백엔드가 모두 같은 방식으로 동작해야 합니다.
 * <p>
 * 모든 연산은 레코드 단위로 원자적입니다. 어떤 호출도 일부만 기록된 레시피를 관찰하지 않습니다.
 * 백엔드 고유의 실패(I/O, DB 연결 등)는 {@link RecipeStorageException}으로 감싸서 던집니다.
 */
public interface RecipeStore {

    /**
     * 새 id로 레시피를 저장합니다. 전달된 레시피의 id 값은 무시됩니다.
     *
     * @return 주어진 id가 부여된 저장본
     * @throws RecipeAlreadyExistsException id가 이미 사용 중인 경우
     */
    Recipe create(String id, Recipe recipe);

    /**
     * @throws RecipeNotFoundException id에 해당하는 레시피가 없는 경우
     */
    Recipe get(String id);

    /**
     * 저장된 모든 레시피를 id 오름차순으로 반환합니다.
     */
    List<Recipe> list();

    /**
     * 기존 레시피를 통째로 교체합니다. 새 레시피에 없는 값은 보존되지 않습니다.
     *
     * @throws RecipeNotFoundException id에 해당하는 레시피가 없는 경우
     */
    Recipe update(String id, Recipe recipe);

    /**
     * @throws RecipeNotFoundException id에 해당하는 레시피가 없는 경우
     */
    void delete(String id);

    void clearAll();

    long count();

    RecipeStoreType backend();
}
