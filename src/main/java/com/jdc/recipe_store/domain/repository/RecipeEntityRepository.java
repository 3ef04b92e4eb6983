package com.jdc.recipe_store.domain.repository;

import com.jdc.recipe_store.domain.entity.RecipeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RecipeEntityRepository extends JpaRepository<RecipeEntity, String> {
}
