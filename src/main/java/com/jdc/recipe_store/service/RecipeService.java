package com.jdc.recipe_store.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.jdc.recipe_store.domain.dto.recipe.RecipeRequestDto;
import com.jdc.recipe_store.domain.dto.recipe.RecipeResponseDto;
import com.jdc.recipe_store.domain.model.Recipe;
import com.jdc.recipe_store.domain.repository.RecipeStore;
import com.jdc.recipe_store.exception.CustomException;
import com.jdc.recipe_store.exception.ErrorCode;
import com.jdc.recipe_store.exception.RecipeAlreadyExistsException;
import com.jdc.recipe_store.exception.RecipeNotFoundException;
import com.jdc.recipe_store.exception.RecipeStorageException;
import com.jdc.recipe_store.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeService {

    private final RecipeStore recipeStore;
    private final RecipePayloadValidator payloadValidator;

    private static final int MAX_TRIES = 3;

    public RecipeResponseDto createRecipe(JsonNode payload) {
        RecipeRequestDto request = payloadValidator.validate(payload);
        Recipe recipe = RecipeMapper.toRecipe(null, request);

        for (int attempt = 1; ; attempt++) {
            String id = newRecipeId();
            try {
                Recipe stored = call(() -> recipeStore.create(id, recipe));
                log.info("레시피 생성: id={}", id);
                return RecipeMapper.toDto(stored);
            } catch (CustomException e) {
                if (e.getErrorCode() != ErrorCode.DUPLICATE_RECIPE_ID || attempt >= MAX_TRIES) {
                    throw e;
                }
                log.warn("레시피 ID 충돌, 재발급 후 재시도: id={}, attempt={}", id, attempt);
            }
        }
    }

    public RecipeResponseDto getRecipe(String id) {
        return RecipeMapper.toDto(call(() -> recipeStore.get(id)));
    }

    public List<RecipeResponseDto> listRecipes() {
        return call(recipeStore::list).stream()
                .map(RecipeMapper::toDto)
                .toList();
    }

    /**
     * 전체 교체. 페이로드에 없는 선택 필드(rating)는 이전 값이 유지되지 않습니다.
     */
    public RecipeResponseDto updateRecipe(String id, JsonNode payload) {
        RecipeRequestDto request = payloadValidator.validate(payload);
        Recipe stored = call(() -> recipeStore.update(id, RecipeMapper.toRecipe(id, request)));
        log.info("레시피 수정: id={}", id);
        return RecipeMapper.toDto(stored);
    }

    public void deleteRecipe(String id) {
        call(() -> {
            recipeStore.delete(id);
            return null;
        });
        log.info("레시피 삭제: id={}", id);
    }

    public void clearAllRecipes() {
        call(() -> {
            recipeStore.clearAll();
            return null;
        });
    }

    private <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RecipeNotFoundException e) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        } catch (RecipeAlreadyExistsException e) {
            throw new CustomException(ErrorCode.DUPLICATE_RECIPE_ID);
        } catch (RecipeStorageException e) {
            log.error("레시피 저장소 오류 (backend={}): {}", recipeStore.backend(), e.getMessage());
            throw new CustomException(ErrorCode.RECIPE_STORAGE_FAILURE, e);
        }
    }

    private static String newRecipeId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
