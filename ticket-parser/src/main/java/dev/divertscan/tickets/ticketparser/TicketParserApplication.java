package dev.divertscan.tickets.ticketparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the ticket extraction service.
 */
@SpringBootApplication
public class TicketParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketParserApplication.class, args);
    }
}
