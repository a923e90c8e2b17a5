package dev.divertscan.tickets.ticketparser.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JsonObjectLocatorTest {

    @Test
    void findsObjectSurroundedByProse() {
        assertThat(JsonObjectLocator.firstObject("Sure! {\"a\": 1} Hope this helps."))
            .contains("{\"a\": 1}");
    }

    @Test
    void keepsNestedObjectsTogether() {
        assertThat(JsonObjectLocator.firstObject("x {\"a\": {\"b\": [1, {\"c\": 2}]}} y"))
            .contains("{\"a\": {\"b\": [1, {\"c\": 2}]}}");
    }

    @Test
    void ignoresBracesInsideStrings() {
        assertThat(JsonObjectLocator.firstObject("{\"note\": \"closing } and \\\" quote\", \"n\": 2}"))
            .contains("{\"note\": \"closing } and \\\" quote\", \"n\": 2}");
    }

    @Test
    void skipsUnbalancedOpeningBrace() {
        assertThat(JsonObjectLocator.firstObject("{ broken {\"ok\": true}"))
            .contains("{\"ok\": true}");
    }

    @Test
    void returnsEmptyWithoutObject() {
        assertThat(JsonObjectLocator.firstObject("no json here")).isEmpty();
        assertThat(JsonObjectLocator.firstObject(null)).isEmpty();
    }
}
