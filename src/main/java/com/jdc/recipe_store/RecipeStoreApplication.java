package com.jdc.recipe_store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecipeStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(RecipeStoreApplication.class, args);
	}

}
