package com.jdc.recipe_store.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.config.ConfigDataEnvironmentPostProcessor;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * recipes-db.type이 sql이 아니면 DataSource/JPA 자동 설정을 제외합니다.
 * memory, fs 백엔드는 spring.datasource 설정과 무관하게 DB 연결 없이 기동됩니다.
 */
public class RecipeStoreEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String EXCLUDE_PROPERTY = "spring.autoconfigure.exclude";
    static final String PROPERTY_SOURCE_NAME = "recipeStoreAutoConfigurationExcludes";

    static final List<String> JPA_AUTO_CONFIGURATIONS = List.of(
            DataSourceAutoConfiguration.class.getName(),
            DataSourceTransactionManagerAutoConfiguration.class.getName(),
            HibernateJpaAutoConfiguration.class.getName(),
            JpaRepositoriesAutoConfiguration.class.getName()
    );

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Binder binder = Binder.get(environment);
        String type = binder.bind("recipes-db.type", String.class).orElse("memory");
        if ("sql".equalsIgnoreCase(type.trim())) {
            return;
        }

        List<String> excludes = new ArrayList<>(
                binder.bind(EXCLUDE_PROPERTY, Bindable.listOf(String.class)).orElse(List.of()));
        excludes.addAll(JPA_AUTO_CONFIGURATIONS);
        environment.getPropertySources().addFirst(
                new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(EXCLUDE_PROPERTY, String.join(",", excludes))));
    }

    @Override
    public int getOrder() {
        // application.yml과 프로파일별 설정이 로드된 뒤에 실행
        return ConfigDataEnvironmentPostProcessor.ORDER + 1;
    }
}
