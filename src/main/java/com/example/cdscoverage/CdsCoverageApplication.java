package com.example.cdscoverage;

import com.example.cdscoverage.batch.BatchCommandRunner;
import com.example.cdscoverage.config.CoverageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.util.Arrays;

@SpringBootApplication
@EnableConfigurationProperties(CoverageProperties.class)
public class CdsCoverageApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(CdsCoverageApplication.class);
		if (isBatch(args)) {
			// Batch mode: no HTTP server, exit with the batch status
			application.setWebApplicationType(WebApplicationType.NONE);
			System.exit(SpringApplication.exit(application.run(args)));
		}
		application.run(args);
	}

	static boolean isBatch(String[] args) {
		String option = "--" + BatchCommandRunner.DOCUMENTS;
		return Arrays.stream(args).anyMatch(a -> a.equals(option) || a.startsWith(option + "="));
	}

}
