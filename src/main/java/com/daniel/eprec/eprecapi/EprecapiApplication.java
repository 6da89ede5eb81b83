package com.daniel.eprec.eprecapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
// Used to start app. RefreshScheduler starts with the context, controllers serve queries.
@ConfigurationPropertiesScan
// Binds eprec.* values from application.properties into EprecProperties.

public class EprecapiApplication {

	public static void main(String[] args) {
		SpringApplication.run(EprecapiApplication.class, args);
	}

}
