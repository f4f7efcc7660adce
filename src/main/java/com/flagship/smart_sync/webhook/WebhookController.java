package com.flagship.smart_sync.webhook;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives rail webhooks. The raw body is kept as a string because signatures
 * are computed over the exact bytes the rail sent.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookIntakeService intakeService;

    @PostMapping("/{rail}")
    public ResponseEntity<WebhookIntakeResult> receive(@PathVariable("rail") String rail,
                                                       @RequestHeader HttpHeaders headers,
                                                       @RequestBody String body) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(intakeService.accept(rail, body, headers));
    }
}
