package org.iceforge.sqlapi;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SqlApiProperties.class)
public class SqlApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(SqlApiApplication.class, args);
	}
}
