package ru.datana.integration.dataparc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("ru.datana.integration.dataparc.config")
public class DataParcConnectorApplication {

	public static void main(String[] args) {
		SpringApplication.run(DataParcConnectorApplication.class, args);
	}
}
