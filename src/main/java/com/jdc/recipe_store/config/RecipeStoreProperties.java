package com.jdc.recipe_store.config;

import com.jdc.recipe_store.domain.type.RecipeStoreType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "recipes-db")
@Getter @Setter
public class RecipeStoreProperties {

    /** memory | fs | sql */
    private RecipeStoreType type = RecipeStoreType.MEMORY;

    private final Fs fs = new Fs();
    private final Sql sql = new Sql();

    @Getter @Setter
    public static class Fs {
        private String path = "./data/recipes";
    }

    @Getter @Setter
    public static class Sql {
        private Duration queryTimeout = Duration.ofSeconds(30);
    }
}
