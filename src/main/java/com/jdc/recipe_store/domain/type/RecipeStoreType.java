package com.jdc.recipe_store.domain.type;

public enum RecipeStoreType {
    MEMORY,
    FS,
    SQL
}
