package com.jdc.recipe_store.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.jdc.recipe_store.domain.dto.recipe.NutritionDto;
import com.jdc.recipe_store.domain.dto.recipe.RecipeResponseDto;
import com.jdc.recipe_store.exception.CustomException;
import com.jdc.recipe_store.exception.ErrorCode;
import com.jdc.recipe_store.exception.RecipeStorageException;
import com.jdc.recipe_store.interceptor.RequestLoggingInterceptor;
import com.jdc.recipe_store.service.RecipeService;
import com.jdc.recipe_store.support.RecipeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RecipeController.class)
class RecipeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecipeService recipeService;

    private static RecipeResponseDto response(String id, String name) {
        return RecipeResponseDto.builder()
                .id(id)
                .name(name)
                .datePublished("2020-03-14")
                .description("A quick weeknight dish with leftover rice.")
                .rating(4.5)
                .prepTime("PT10M")
                .cookTime("PT20M")
                .ingredients(List.of("2 cups cooked rice", "1 cup kimchi", "1 egg"))
                .instructions(List.of("Heat the pan"))
                .nutrition(NutritionDto.builder().servingSize("1 bowl").calories(450.0).build())
                .build();
    }

    @Test
    @DisplayName("POST /v1/recipes: 201과 Location 헤더")
    void create_returnsCreatedWithLocation() throws Exception {
        when(recipeService.createRecipe(any(JsonNode.class)))
                .thenReturn(response("0123456789abcdef0123456789abcdef", "Kimchi Fried Rice"));

        mockMvc.perform(post("/v1/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RecipeFixtures.payload().toString()))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/v1/recipes/0123456789abcdef0123456789abcdef"))
                .andExpect(header().string(RequestLoggingInterceptor.REQUEST_ID_HEADER, matchesPattern("[0-9a-f]{32}")))
                .andExpect(jsonPath("$.id").value("0123456789abcdef0123456789abcdef"))
                .andExpect(jsonPath("$.nutrition.calories").value(450.0));
    }

    @Test
    @DisplayName("POST: JSON 문법 오류는 400 / 905, 서비스는 호출되지 않음")
    void create_malformedJson_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("905"));

        verifyNoInteractions(recipeService);
    }

    @Test
    @DisplayName("POST: JSON이 아닌 Content-Type은 415")
    void create_wrongContentType_returnsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/v1/recipes")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.code").value("906"));
    }

    @Test
    @DisplayName("POST: 스키마 위반은 400 / 203, 실패 사유가 메시지에 포함")
    void create_invalidPayload_returnsBadRequest() throws Exception {
        when(recipeService.createRecipe(any(JsonNode.class)))
                .thenThrow(new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD, "description은 10자 이상 500자 이하여야 합니다."));

        mockMvc.perform(post("/v1/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("203"))
                .andExpect(jsonPath("$.message", containsString("description")))
                .andExpect(jsonPath("$.errorId").doesNotExist());
    }

    @Test
    @DisplayName("GET /v1/recipes/{id}: 없는 ID는 404 / 201")
    void get_missing_returnsNotFound() throws Exception {
        when(recipeService.getRecipe("missing")).thenThrow(new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        mockMvc.perform(get("/v1/recipes/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("201"));
    }

    @Test
    @DisplayName("GET /v1/recipes/{id}: 200, rating이 없으면 필드 생략")
    void get_returnsRecipe() throws Exception {
        RecipeResponseDto noRating = RecipeResponseDto.builder()
                .id("r-1")
                .name("Plain")
                .ingredients(List.of("rice"))
                .build();
        when(recipeService.getRecipe("r-1")).thenReturn(noRating);

        mockMvc.perform(get("/v1/recipes/r-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Plain"))
                .andExpect(jsonPath("$.rating").doesNotExist());
    }

    @Test
    @DisplayName("GET /v1/recipes: 전체 목록")
    void list_returnsArray() throws Exception {
        when(recipeService.listRecipes()).thenReturn(List.of(response("a", "First"), response("b", "Second")));

        mockMvc.perform(get("/v1/recipes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("a"))
                .andExpect(jsonPath("$[1].name").value("Second"));
    }

    @Test
    @DisplayName("PUT /v1/recipes/{id}: 200과 교체된 레시피")
    void update_returnsOk() throws Exception {
        when(recipeService.updateRecipe(eq("r-1"), any(JsonNode.class))).thenReturn(response("r-1", "Renamed"));

        mockMvc.perform(put("/v1/recipes/r-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RecipeFixtures.payload().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Renamed"));

        verify(recipeService).updateRecipe(eq("r-1"), any(JsonNode.class));
    }

    @Test
    @DisplayName("DELETE /v1/recipes/{id}: 204, 없는 ID는 404")
    void delete_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/v1/recipes/r-1"))
                .andExpect(status().isNoContent());

        doThrow(new CustomException(ErrorCode.RECIPE_NOT_FOUND)).when(recipeService).deleteRecipe("gone");
        mockMvc.perform(delete("/v1/recipes/gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("201"));
    }

    @Test
    @DisplayName("저장소 장애는 500 / 801, errorId 포함, 내부 메시지 미노출")
    void storageFailure_returnsServerError() throws Exception {
        when(recipeService.listRecipes()).thenThrow(new CustomException(ErrorCode.RECIPE_STORAGE_FAILURE,
                new RecipeStorageException("Connection refused: db.internal:3306", null)));

        mockMvc.perform(get("/v1/recipes"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("801"))
                .andExpect(jsonPath("$.errorId").isNotEmpty())
                .andExpect(jsonPath("$.message", not(containsString("db.internal"))));
    }

    @Test
    @DisplayName("지원하지 않는 메소드는 405 / 902")
    void unsupportedMethod_returnsMethodNotAllowed() throws Exception {
        mockMvc.perform(patch("/v1/recipes/r-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.code").value("902"));
    }
}
