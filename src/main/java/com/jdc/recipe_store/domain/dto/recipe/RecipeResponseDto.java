package com.jdc.recipe_store.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecipeResponseDto {
    private String id;
    private String name;
    private String datePublished;
    private String description;
    private Double rating;
    private String prepTime;
    private String cookTime;
    private List<String> ingredients;
    private List<String> instructions;
    private NutritionDto nutrition;
}
