package com.jdc.recipe_store.exception;

import lombok.Getter;

@Getter
public class RecipeAlreadyExistsException extends RecipeStoreException {

    private final String recipeId;

    public RecipeAlreadyExistsException(String recipeId) {
        super(recipeId + " already exists");
        this.recipeId = recipeId;
    }

    public RecipeAlreadyExistsException(String recipeId, Throwable cause) {
        super(recipeId + " already exists", cause);
        this.recipeId = recipeId;
    }
}
