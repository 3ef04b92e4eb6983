package com.jdc.recipe_store.exception;

import lombok.Getter;

@Getter
public class RecipeNotFoundException extends RecipeStoreException {

    private final String recipeId;

    public RecipeNotFoundException(String recipeId) {
        super(recipeId + " does not exist");
        this.recipeId = recipeId;
    }
}
