package com.jdc.recipe_store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jdc.recipe_store.domain.repository.InMemoryRecipeStore;
import com.jdc.recipe_store.domain.repository.RecipeStore;
import com.jdc.recipe_store.support.RecipeFixtures;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.ApplicationContext;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class RecipeStoreApplicationTests {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ApplicationContext context;

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    @Test
    @DisplayName("memory 백엔드로 기동하면 DataSource와 JPA를 만들지 않음")
    void memoryBackend_startsWithoutDatabase() {
        assertThat(context.getBean(RecipeStore.class)).isInstanceOf(InMemoryRecipeStore.class);
        assertThat(context.getBeanNamesForType(DataSource.class)).isEmpty();
        assertThat(context.getBeanNamesForType(EntityManagerFactory.class)).isEmpty();
    }

    @Test
    @DisplayName("헬스 체크")
    void health() {
        ResponseEntity<String> res = restTemplate.getForEntity("/v1/health", String.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(res.getBody()).isEqualTo("OK");
    }

    @Test
    @DisplayName("생성 → 조회 → 수정 → 삭제 전체 흐름")
    void crudRoundTrip() {
        ResponseEntity<JsonNode> created = restTemplate.postForEntity(
                "/v1/recipes", json(RecipeFixtures.payload().toString()), JsonNode.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String id = created.getBody().get("id").asText();
        assertThat(created.getHeaders().getLocation()).hasToString("/v1/recipes/" + id);

        ResponseEntity<JsonNode> found = restTemplate.getForEntity("/v1/recipes/" + id, JsonNode.class);
        assertThat(found.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(found.getBody()).isEqualTo(created.getBody());

        ObjectNode replacement = RecipeFixtures.payload();
        replacement.put("name", "Renamed");
        replacement.remove("rating");
        ResponseEntity<JsonNode> updated = restTemplate.exchange(
                "/v1/recipes/" + id, HttpMethod.PUT, json(replacement.toString()), JsonNode.class);
        assertThat(updated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(updated.getBody().get("name").asText()).isEqualTo("Renamed");
        assertThat(updated.getBody().has("rating")).isFalse();

        ResponseEntity<Void> deleted = restTemplate.exchange(
                "/v1/recipes/" + id, HttpMethod.DELETE, null, Void.class);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

        ResponseEntity<JsonNode> gone = restTemplate.getForEntity("/v1/recipes/" + id, JsonNode.class);
        assertThat(gone.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(gone.getBody().get("code").asText()).isEqualTo("201");
    }

    @Test
    @DisplayName("검증 실패는 400 / 203, 저장되지 않음")
    void invalidPayload_isRejected() {
        ObjectNode payload = RecipeFixtures.payload();
        payload.put("description", "short");

        ResponseEntity<JsonNode> res = restTemplate.postForEntity("/v1/recipes", json(payload.toString()), JsonNode.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(res.getBody().get("code").asText()).isEqualTo("203");
    }

    @Test
    @DisplayName("등록되지 않은 경로는 404 / 907")
    void unknownEndpoint() {
        ResponseEntity<JsonNode> res = restTemplate.getForEntity("/v1/unknown", JsonNode.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(res.getBody().get("code").asText()).isEqualTo("907");
    }
}
