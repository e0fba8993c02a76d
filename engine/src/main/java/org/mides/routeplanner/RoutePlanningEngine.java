package org.mides.routeplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoutePlanningEngine {

	public static void main(String[] args) {
		SpringApplication.run(RoutePlanningEngine.class, args);
	}
}
