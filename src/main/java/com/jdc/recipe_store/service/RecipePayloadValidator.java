package com.jdc.recipe_store.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.jdc.recipe_store.domain.dto.recipe.RecipeRequestDto;
import com.jdc.recipe_store.exception.CustomException;
import com.jdc.recipe_store.exception.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 레시피 JSON 페이로드를 스키마 기준으로 검증합니다.
 * <ul>
 *     <li>정의되지 않은 필드(id 포함)는 거부</li>
 *     <li>문자열/숫자/불리언 간 자동 형변환 없음</li>
 *     <li>필수값, 길이, 범위는 Bean Validation 제약으로 검사</li>
 * </ul>
 */
@Slf4j
@Component
public class RecipePayloadValidator {

    private final ObjectReader reader;
    private final Validator validator;

    public RecipePayloadValidator(ObjectMapper objectMapper, Validator validator) {
        this.reader = strictCopyOf(objectMapper).readerFor(RecipeRequestDto.class);
        this.validator = validator;
    }

    public RecipeRequestDto validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD, "요청 본문은 JSON 객체여야 합니다.");
        }

        rejectExplicitNulls(payload, "");
        RecipeRequestDto request = bind(payload);

        Set<ConstraintViolation<RecipeRequestDto>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining(" "));
            log.debug("레시피 검증 실패: {}", detail);
            throw new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD, detail);
        }
        return request;
    }

    /**
     * 필드를 생략하는 것만 "값 없음"으로 인정합니다. 명시적인 null은 선택 필드(rating)라도 타입 오류입니다.
     */
    private static void rejectExplicitNulls(JsonNode node, String prefix) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = prefix + field.getKey();
            if (field.getValue().isNull()) {
                throw new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD, "필드 타입이 올바르지 않습니다: " + path);
            }
            if (field.getValue().isObject()) {
                rejectExplicitNulls(field.getValue(), path + ".");
            }
        }
    }

    private RecipeRequestDto bind(JsonNode payload) {
        try {
            return reader.readValue(payload);
        } catch (UnrecognizedPropertyException e) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD,
                    "정의되지 않은 필드입니다: " + describePath(e.getPath()));
        } catch (MismatchedInputException e) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD,
                    "필드 타입이 올바르지 않습니다: " + describePath(e.getPath()));
        } catch (IOException e) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_PAYLOAD, "레시피를 해석할 수 없습니다.");
        }
    }

    private static String describePath(List<JsonMappingException.Reference> path) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : path) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? "(root)" : sb.toString();
    }

    private static ObjectMapper strictCopyOf(ObjectMapper objectMapper) {
        ObjectMapper strict = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, false);

        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        strict.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return strict;
    }
}
