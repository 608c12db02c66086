package org.rewardledger.controller;

import org.rewardledger.dto.LedgerEventView;
import org.rewardledger.service.LedgerEventService;
import org.rewardledger.service.LedgerEventStream;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
@RequestMapping("/api/events")
public class EventController {

    @Autowired
    private LedgerEventService eventService;

    @Autowired
    private LedgerEventStream eventStream;

    // derniers faits émis pour l'appelant, du plus récent au plus ancien
    @GetMapping("/me")
    public ResponseEntity<?> mine(@RequestParam(defaultValue = "20") int limit, Authentication authentication) {
        String caller = Callers.address(authentication);
        List<LedgerEventView> events = eventService.recent(caller, limit).stream()
                .map(LedgerEventView::fromEntity)
                .toList();
        return ResponseEntity.ok(events);
    }

    // GET /api/events/stream : flux SSE des faits commités
    @GetMapping("/stream")
    public SseEmitter stream(Authentication authentication) {
        return eventStream.register(Callers.address(authentication));
    }
}
