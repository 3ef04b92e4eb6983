package com.jdc.recipe_store.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 저장소에 보관되는 레시피 한 건.
 * <p>
 * datePublished는 ISO-8601 날짜(yyyy-MM-dd), prepTime/cookTime은 ISO-8601 기간(PT15M) 문자열로 주고받습니다.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Recipe {
    String id;
    String name;
    String datePublished;
    String description;
    Double rating;
    String prepTime;
    String cookTime;
    List<String> ingredients;
    List<String> instructions;
    Nutrition nutrition;

    public Recipe withId(String newId) {
        return toBuilder().id(newId).build();
    }
}
