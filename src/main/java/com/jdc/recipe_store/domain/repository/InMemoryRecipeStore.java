package com.jdc.recipe_store.domain.repository;

import com.jdc.recipe_store.domain.model.Recipe;
import com.jdc.recipe_store.domain.type.RecipeStoreType;
import com.jdc.recipe_store.exception.RecipeAlreadyExistsException;
import com.jdc.recipe_store.exception.RecipeNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 프로세스 로컬 저장소. 재시작하면 데이터가 사라지므로 테스트와 임시 배포에만 사용합니다.
 */
@Slf4j
public class InMemoryRecipeStore implements RecipeStore {

    private final Map<String, Recipe> recipes = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Recipe create(String id, Recipe recipe) {
        Objects.requireNonNull(id, "id");
        lock.writeLock().lock();
        try {
            if (recipes.containsKey(id)) {
                throw new RecipeAlreadyExistsException(id);
            }
            Recipe stored = recipe.withId(id);
            recipes.put(id, stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Recipe get(String id) {
        lock.readLock().lock();
        try {
            Recipe recipe = id == null ? null : recipes.get(id);
            if (recipe == null) {
                throw new RecipeNotFoundException(id);
            }
            return recipe;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Recipe> list() {
        lock.readLock().lock();
        try {
            return recipes.values().stream()
                    .sorted(Comparator.comparing(Recipe::getId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Recipe update(String id, Recipe recipe) {
        lock.writeLock().lock();
        try {
            if (id == null || !recipes.containsKey(id)) {
                throw new RecipeNotFoundException(id);
            }
            Recipe stored = recipe.withId(id);
            recipes.put(id, stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) {
        lock.writeLock().lock();
        try {
            if (id == null || recipes.remove(id) == null) {
                throw new RecipeNotFoundException(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clearAll() {
        lock.writeLock().lock();
        try {
            log.info("메모리 저장소 전체 삭제: {}건", recipes.size());
            recipes.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return recipes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public RecipeStoreType backend() {
        return RecipeStoreType.MEMORY;
    }
}
