package com.deskpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeskPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeskPilotApplication.class, args);
    }
}
