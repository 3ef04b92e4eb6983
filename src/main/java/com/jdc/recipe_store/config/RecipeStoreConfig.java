package com.jdc.recipe_store.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.recipe_store.domain.repository.FileSystemRecipeStore;
import com.jdc.recipe_store.domain.repository.InMemoryRecipeStore;
import com.jdc.recipe_store.domain.repository.JpaRecipeStore;
import com.jdc.recipe_store.domain.repository.RecipeEntityRepository;
import com.jdc.recipe_store.domain.repository.RecipeStore;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;

/**
 * recipes-db.type 값에 따라 시작 시점에 저장소 백엔드 하나만 등록합니다. 실행 중 교체는 지원하지 않습니다.
 */
@Slf4j
@Configuration
public class RecipeStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "recipes-db", name = "type", havingValue = "memory", matchIfMissing = true)
    public RecipeStore inMemoryRecipeStore() {
        log.info("레시피 저장소: memory");
        return new InMemoryRecipeStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "recipes-db", name = "type", havingValue = "fs")
    public RecipeStore fileSystemRecipeStore(RecipeStoreProperties props, ObjectMapper objectMapper) {
        Path root = Path.of(props.getFs().getPath());
        FileSystemRecipeStore store = new FileSystemRecipeStore(root, objectMapper);
        log.info("레시피 저장소: fs ({})", store.getRoot());
        return store;
    }

    @Bean
    @ConditionalOnProperty(prefix = "recipes-db", name = "type", havingValue = "sql")
    public RecipeStore jpaRecipeStore(RecipeStoreProperties props,
                                      RecipeEntityRepository repository,
                                      EntityManager em,
                                      PlatformTransactionManager transactionManager) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setTimeout((int) props.getSql().getQueryTimeout().toSeconds());

        // 초기화 시점에 연결을 확인하여 DB에 접근할 수 없으면 기동 자체를 실패시킵니다.
        JpaRecipeStore store = new JpaRecipeStore(repository, em, transactionTemplate);
        log.info("레시피 저장소: sql (기존 레시피 {}건)", store.count());
        return store;
    }
}
