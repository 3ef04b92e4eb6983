package com.jdc.recipe_store.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

@Getter @Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NutritionDto {

    @Schema(description = "1회 제공량", example = "1 bowl")
    @NotBlank(message = "nutrition.servingSize는 필수입니다.")
    private String servingSize;

    @Schema(description = "열량 (kcal)", example = "450")
    @NotNull(message = "nutrition.calories는 필수입니다.")
    @PositiveOrZero(message = "nutrition.calories는 0 이상이어야 합니다.")
    private Double calories;
}
