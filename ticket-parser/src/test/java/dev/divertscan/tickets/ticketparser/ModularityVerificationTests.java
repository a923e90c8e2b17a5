package dev.divertscan.tickets.ticketparser;

import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModules;

class ModularityVerificationTests {

    @Test
    void modulesShouldRespectDeclaredBoundaries() {
        ApplicationModules.of(TicketParserApplication.class).verify();
    }
}
