package com.propertyintel.gap.config;

import com.propertyintel.gap.model.ScrapeRun;
import com.propertyintel.gap.service.GapCollectionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeControllerTest {

    private GapCollectionService service;
    private ScrapeController controller;

    @BeforeEach
    void setUp() {
        service = mock(GapCollectionService.class);
        controller = new ScrapeController(service, new GapScraperProperties());
    }

    @Test
    void trigger_shouldStartRunInBackground() {
        ResponseEntity<Map<String, Object>> response = controller.trigger(37.4, 127.1, 16);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals("accepted", response.getBody().get("status"));
        verify(service, timeout(2000)).collect(37.4, 127.1, 16);
    }

    @Test
    void trigger_shouldFallBackToStartCoordinates() {
        controller.trigger(null, null, null);

        verify(service, timeout(2000)).collect(37.5608, 126.9888, 15);
    }

    @Test
    void trigger_shouldRejectWhileRunActive() {
        when(service.isRunning()).thenReturn(true);

        ResponseEntity<Map<String, Object>> response = controller.trigger(37.4, 127.1, 16);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        verify(service, never()).collect(anyDouble(), anyDouble(), anyInt());
    }

    @Test
    void status_shouldReportLastRun() {
        ScrapeRun run = ScrapeRun.builder().runId("r-1").status("SUCCESS").candidates(3).build();
        when(service.getLastRun()).thenReturn(Optional.of(run));

        Map<String, Object> body = controller.status().getBody();

        assertEquals(false, body.get("running"));
        assertEquals(run, body.get("lastRun"));
    }
}
