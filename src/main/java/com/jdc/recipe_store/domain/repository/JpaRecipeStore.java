package com.jdc.recipe_store.domain.repository;

import com.jdc.recipe_store.domain.entity.RecipeEntity;
import com.jdc.recipe_store.domain.model.Recipe;
import com.jdc.recipe_store.domain.type.RecipeStoreType;
import com.jdc.recipe_store.exception.RecipeAlreadyExistsException;
import com.jdc.recipe_store.exception.RecipeNotFoundException;
import com.jdc.recipe_store.exception.RecipeStorageException;
import com.jdc.recipe_store.mapper.RecipeMapper;
import jakarta.persistence.EntityExistsException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * recipe_entries 테이블 한 행에 레시피 한 건을 저장합니다.
 * 각 호출은 하나의 트랜잭션으로 실행되며, 트랜잭션 타임아웃은 설정값(recipes-db.sql.query-timeout)을 따릅니다.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaRecipeStore implements RecipeStore {

    private final RecipeEntityRepository repository;
    private final EntityManager em;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Recipe create(String id, Recipe recipe) {
        try {
            return transactionTemplate.execute(status -> {
                if (repository.existsById(id)) {
                    throw new RecipeAlreadyExistsException(id);
                }
                RecipeEntity entity = RecipeMapper.toEntity(recipe.withId(id));
                // save()는 id가 채워진 엔티티를 merge하므로 신규 저장은 persist로 강제합니다.
                em.persist(entity);
                return RecipeMapper.fromEntity(entity);
            });
        } catch (DataIntegrityViolationException | EntityExistsException e) {
            // 존재 확인과 insert 사이에 다른 트랜잭션이 같은 id를 먼저 커밋한 경우만 중복으로 봅니다.
            if (Boolean.TRUE.equals(inTransaction(status -> repository.existsById(id)))) {
                throw new RecipeAlreadyExistsException(id, e);
            }
            throw storageFailure(e);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw storageFailure(e);
        }
    }

    @Override
    public Recipe get(String id) {
        return inTransaction(status -> repository.findById(id)
                .map(RecipeMapper::fromEntity)
                .orElseThrow(() -> new RecipeNotFoundException(id)));
    }

    @Override
    public List<Recipe> list() {
        return inTransaction(status -> repository.findAll(Sort.by("id")).stream()
                .map(RecipeMapper::fromEntity)
                .toList());
    }

    @Override
    public Recipe update(String id, Recipe recipe) {
        return inTransaction(status -> {
            RecipeEntity entity = repository.findById(id)
                    .orElseThrow(() -> new RecipeNotFoundException(id));
            entity.replaceWith(RecipeMapper.toEntity(recipe.withId(id)));
            return RecipeMapper.fromEntity(entity);
        });
    }

    @Override
    public void delete(String id) {
        inTransaction(status -> {
            RecipeEntity entity = repository.findById(id)
                    .orElseThrow(() -> new RecipeNotFoundException(id));
            repository.delete(entity);
            return null;
        });
    }

    @Override
    public void clearAll() {
        inTransaction(status -> {
            long removed = repository.count();
            repository.deleteAllInBatch();
            log.info("DB 저장소 전체 삭제: {}건", removed);
            return null;
        });
    }

    @Override
    public long count() {
        Long count = inTransaction(status -> repository.count());
        return count == null ? 0L : count;
    }

    @Override
    public RecipeStoreType backend() {
        return RecipeStoreType.SQL;
    }

    private <T> T inTransaction(TransactionCallback<T> callback) {
        try {
            return transactionTemplate.execute(callback);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw storageFailure(e);
        }
    }

    private RecipeStorageException storageFailure(RuntimeException e) {
        log.error("레시피 DB 처리 실패", e);
        return new RecipeStorageException("레시피 DB 처리 실패", e);
    }
}
