package com.jdc.recipe_store.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Nutrition {
    String servingSize;
    Double calories;
}
