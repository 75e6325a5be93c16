package com.castlewars;

import com.castlewars.config.GameProperties;
import com.castlewars.service.GameService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"castlewars.distance=30", "castlewars.unit.health=8", "castlewars.random-seed=99"})
class CastleWarsApplicationTest {

    @Autowired
    private GameProperties properties;

    @Autowired
    private GameService gameService;

    @Autowired
    private TestRestTemplate rest;

    @Test
    void testPropertiesBound() {
        assertEquals(30, properties.getDistance());
        assertEquals(8, properties.getUnit().getHealth());
        assertEquals(99L, properties.getRandomSeed().longValue());
        assertEquals(15, properties.getTicksPerTurn(), "Untouched values keep their defaults");
    }

    @Test
    void testServiceUsesBoundProperties() {
        gameService.onPlayerConnect("ctx");
        assertEquals(30, gameService.snapshot("ctx").distance);
        assertEquals(31, gameService.getGame("ctx").getComputer().getCastle().getPosition());
        assertEquals(8, gameService.getGame("ctx").getHuman().getUnitHealth());
    }

    @Test
    @DisplayName("Rules are served over HTTP without authentication")
    void testRulesEndpointOpen() {
        ResponseEntity<String> response = rest.getForEntity("/api/rules", String.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().contains("\"spawnCost\":200"), response.getBody());
        assertTrue(response.getBody().contains("\"distance\":30"), response.getBody());
    }

    @Test
    void testOtherPathsNeedAuthentication() {
        ResponseEntity<String> response = rest.getForEntity("/internal/status", String.class);
        assertTrue(response.getStatusCode().is4xxClientError(), "Got " + response.getStatusCode());
        assertNotEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }
}
