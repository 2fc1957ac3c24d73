/*
 * Where: Lab jobs application entry point
 * What: Boots Spring, scheduling and configuration-properties scanning
 * Why: One process hosts the tick engine and the action/configuration API
 */
package com.example.labjobs;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class LabJobsApplication {

	public static void main(String[] args) {
		SpringApplication.run(LabJobsApplication.class, args);
	}
}
