package com.helmet.corpus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

@EnableRetry
@EnableScheduling
@SpringBootApplication
@ConfigurationPropertiesScan
public class CorpusCuratorApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(CorpusCuratorApplication.class);

		// --stage=... turns the service into a one-shot run command
		boolean commandMode = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--stage"));
		if (commandMode) {
			application.setWebApplicationType(WebApplicationType.NONE);
		}

		ConfigurableApplicationContext context = application.run(args);

		if (commandMode) {
			System.exit(SpringApplication.exit(context));
		}
	}
}
