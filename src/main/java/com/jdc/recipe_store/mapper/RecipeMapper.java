package com.jdc.recipe_store.mapper;

import com.jdc.recipe_store.domain.dto.recipe.NutritionDto;
import com.jdc.recipe_store.domain.dto.recipe.RecipeRequestDto;
import com.jdc.recipe_store.domain.dto.recipe.RecipeResponseDto;
import com.jdc.recipe_store.domain.entity.RecipeEntity;
import com.jdc.recipe_store.domain.model.Nutrition;
import com.jdc.recipe_store.domain.model.Recipe;

import java.util.List;

public class RecipeMapper {

    public static Recipe toRecipe(String id, RecipeRequestDto dto) {
        NutritionDto nutrition = dto.getNutrition();

        return Recipe.builder()
                .id(id)
                .name(dto.getName())
                .datePublished(dto.getDatePublished())
                .description(dto.getDescription())
                .rating(dto.getRating())
                .prepTime(dto.getPrepTime())
                .cookTime(dto.getCookTime())
                .ingredients(List.copyOf(dto.getIngredients()))
                .instructions(List.copyOf(dto.getInstructions()))
                .nutrition(Nutrition.builder()
                        .servingSize(nutrition.getServingSize())
                        .calories(nutrition.getCalories())
                        .build())
                .build();
    }

    public static RecipeResponseDto toDto(Recipe recipe) {
        Nutrition nutrition = recipe.getNutrition();

        return RecipeResponseDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .datePublished(recipe.getDatePublished())
                .description(recipe.getDescription())
                .rating(recipe.getRating())
                .prepTime(recipe.getPrepTime())
                .cookTime(recipe.getCookTime())
                .ingredients(recipe.getIngredients())
                .instructions(recipe.getInstructions())
                .nutrition(nutrition == null ? null : NutritionDto.builder()
                        .servingSize(nutrition.getServingSize())
                        .calories(nutrition.getCalories())
                        .build())
                .build();
    }

    public static RecipeEntity toEntity(Recipe recipe) {
        return RecipeEntity.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .datePublished(recipe.getDatePublished())
                .description(recipe.getDescription())
                .rating(recipe.getRating())
                .prepTime(recipe.getPrepTime())
                .cookTime(recipe.getCookTime())
                .ingredients(recipe.getIngredients())
                .instructions(recipe.getInstructions())
                .calories(recipe.getNutrition().getCalories())
                .servingSize(recipe.getNutrition().getServingSize())
                .build();
    }

    public static Recipe fromEntity(RecipeEntity entity) {
        return Recipe.builder()
                .id(entity.getId())
                .name(entity.getName())
                .datePublished(entity.getDatePublished())
                .description(entity.getDescription())
                .rating(entity.getRating())
                .prepTime(entity.getPrepTime())
                .cookTime(entity.getCookTime())
                .ingredients(List.copyOf(entity.getIngredients()))
                .instructions(List.copyOf(entity.getInstructions()))
                .nutrition(Nutrition.builder()
                        .servingSize(entity.getServingSize())
                        .calories(entity.getCalories())
                        .build())
                .build();
    }
}
