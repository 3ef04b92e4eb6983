package com.jdc.recipe_store.config;

import com.jdc.recipe_store.domain.entity.RecipeEntity;
import com.jdc.recipe_store.domain.repository.RecipeEntityRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * sql 백엔드일 때만 엔티티와 JPA 리포지토리를 등록합니다.
 */
@Configuration
@ConditionalOnProperty(prefix = "recipes-db", name = "type", havingValue = "sql")
@EntityScan(basePackageClasses = RecipeEntity.class)
@EnableJpaRepositories(basePackageClasses = RecipeEntityRepository.class)
public class RecipeJpaConfig {
}
