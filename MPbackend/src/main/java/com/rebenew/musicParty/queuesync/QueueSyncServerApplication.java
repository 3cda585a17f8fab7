package com.rebenew.musicParty.queuesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QueueSyncServerApplication {
	public static void main(String[] args) {
		SpringApplication.run(QueueSyncServerApplication.class, args);
	}
}
