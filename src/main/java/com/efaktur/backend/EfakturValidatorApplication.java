package com.efaktur.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import com.efaktur.backend.config.DotenvLoader;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EfakturValidatorApplication {

	public static void main(String[] args) {
		DotenvLoader.loadFromWorkingDirectoryIfPresent();
		SpringApplication.run(EfakturValidatorApplication.class, args);
	}

}
