package com.bbthechange.tvguide;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TvGuideApplication {

	private static final Logger logger = LoggerFactory.getLogger(TvGuideApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(TvGuideApplication.class);
		app.run(args);
	}

	@EventListener(ApplicationReadyEvent.class)
	public void onApplicationReady(ApplicationReadyEvent event) {
		logger.info("TV Guide is ready (profiles: {})",
				String.join(",", event.getApplicationContext().getEnvironment().getActiveProfiles()));
	}

}
