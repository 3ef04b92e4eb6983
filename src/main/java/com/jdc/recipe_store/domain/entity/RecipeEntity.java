package com.jdc.recipe_store.domain.entity;

import com.jdc.recipe_store.domain.entity.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.util.List;

/**
 * 텍스트 컬럼은 길이 제한 없이 TEXT로 저장합니다.
 */
@Entity
@Table(name = "recipe_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecipeEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String name;

    @Column(name = "date_published", columnDefinition = "TEXT", nullable = false)
    private String datePublished;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;

    @Column
    private Double rating;

    @Column(name = "prep_time", columnDefinition = "TEXT", nullable = false)
    private String prepTime;

    @Column(name = "cook_time", columnDefinition = "TEXT", nullable = false)
    private String cookTime;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> ingredients;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> instructions;

    @Column(nullable = false)
    private Double calories;

    @Column(name = "serving_size", columnDefinition = "TEXT", nullable = false)
    private String servingSize;

    /**
     * 전체 교체 방식의 수정. id를 제외한 모든 컬럼을 새 값으로 덮어씁니다.
     */
    public void replaceWith(RecipeEntity source) {
        this.name = source.name;
        this.datePublished = source.datePublished;
        this.description = source.description;
        this.rating = source.rating;
        this.prepTime = source.prepTime;
        this.cookTime = source.cookTime;
        this.ingredients = source.ingredients;
        this.instructions = source.instructions;
        this.calories = source.calories;
        this.servingSize = source.servingSize;
    }
}
