package com.jdc.recipe_store.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.jdc.recipe_store.domain.dto.recipe.RecipeResponseDto;
import com.jdc.recipe_store.service.RecipeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/v1/recipes")
@RequiredArgsConstructor
@Tag(name = "레시피 API", description = "레시피 생성, 조회, 수정, 삭제를 위한 API입니다.")
public class RecipeController {

    private static final String RECIPE_ENTRY_URI = "/v1/recipes/{id}";

    private final RecipeService recipeService;

    @PostMapping
    @Operation(summary = "레시피 생성", description = "스키마 검증 후 새 ID를 발급하여 저장합니다. Location 헤더로 생성된 리소스 경로를 반환합니다.")
    public ResponseEntity<RecipeResponseDto> createRecipe(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "레시피 (id 제외)")
            @RequestBody JsonNode payload) {

        RecipeResponseDto created = recipeService.createRecipe(payload);
        URI location = UriComponentsBuilder.fromPath(RECIPE_ENTRY_URI)
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @GetMapping
    @Operation(summary = "레시피 전체 조회", description = "저장된 모든 레시피를 id 순으로 반환합니다.")
    public ResponseEntity<List<RecipeResponseDto>> listRecipes() {
        return ResponseEntity.ok(recipeService.listRecipes());
    }

    @GetMapping("/{id}")
    @Operation(summary = "레시피 단건 조회")
    public ResponseEntity<RecipeResponseDto> getRecipe(
            @Parameter(description = "레시피 ID") @PathVariable String id) {
        return ResponseEntity.ok(recipeService.getRecipe(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "레시피 수정", description = "레시피 전체를 교체합니다. 요청에 없는 선택 필드는 유지되지 않습니다.")
    public ResponseEntity<RecipeResponseDto> updateRecipe(
            @Parameter(description = "레시피 ID") @PathVariable String id,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "교체할 레시피 (id 제외)")
            @RequestBody JsonNode payload) {
        return ResponseEntity.ok(recipeService.updateRecipe(id, payload));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "레시피 삭제")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "레시피 ID") @PathVariable String id) {
        recipeService.deleteRecipe(id);
        return ResponseEntity.noContent().build();
    }
}
