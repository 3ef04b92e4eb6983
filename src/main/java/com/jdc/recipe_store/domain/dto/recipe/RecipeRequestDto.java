package com.jdc.recipe_store.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

/**
 * 레시피 생성/수정 요청. id는 받지 않으며 정의되지 않은 필드는 거부됩니다.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeRequestDto {

    @Schema(description = "레시피 이름", example = "Kimchi Fried Rice")
    @NotBlank(message = "name은 필수입니다.")
    private String name;

    @Schema(description = "게시일 (yyyy-MM-dd)", example = "2020-03-14")
    @NotBlank(message = "datePublished는 필수입니다.")
    private String datePublished;

    @Schema(description = "설명 (10~500자)")
    @NotNull(message = "description은 필수입니다.")
    @Size(min = 10, max = 500, message = "description은 10자 이상 500자 이하여야 합니다.")
    private String description;

    @Schema(description = "평점 (0~5, 선택)", example = "4.5")
    @DecimalMin(value = "0.0", message = "rating은 0 이상이어야 합니다.")
    @DecimalMax(value = "5.0", message = "rating은 5 이하여야 합니다.")
    private Double rating;

    @Schema(description = "준비 시간 (ISO-8601 기간)", example = "PT10M")
    @NotBlank(message = "prepTime은 필수입니다.")
    private String prepTime;

    @Schema(description = "조리 시간 (ISO-8601 기간)", example = "PT20M")
    @NotBlank(message = "cookTime은 필수입니다.")
    private String cookTime;

    @NotEmpty(message = "ingredients는 최소 1개 이상이어야 합니다.")
    private List<@NotBlank(message = "ingredients 항목은 비어 있을 수 없습니다.") String> ingredients;

    @NotEmpty(message = "instructions는 최소 1개 이상이어야 합니다.")
    private List<@NotBlank(message = "instructions 항목은 비어 있을 수 없습니다.") String> instructions;

    @NotNull(message = "nutrition은 필수입니다.")
    @Valid
    private NutritionDto nutrition;
}
