package com.myorg.msgstore.app.web;

import com.myorg.msgstore.contracts.core.exception.PublishException;
import com.myorg.msgstore.kafka.publish.MessagePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

// Body được gửi nguyên dạng bytes; không parse, không validate schema.
@Slf4j
@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "msgstore.app", name = "http-enabled", havingValue = "true", matchIfMissing = true)
public class MessageController {

    private final MessagePublisher publisher;

    @PostMapping
    public ResponseEntity<Void> publish(@RequestParam(name = "topic", required = false) String topic,
                                        @RequestParam(name = "key", required = false) String key,
                                        @RequestBody(required = false) byte[] body) {
        byte[] payload = body == null ? new byte[0] : body;
        try {
            publisher.publish(topic, key, payload);
        } catch (PublishException e) {
            HttpStatus status = e.getFailure().isRetryable()
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.INTERNAL_SERVER_ERROR;
            throw new ResponseStatusException(status, "publish failed: " + e.getFailure(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return ResponseEntity.accepted().build();
    }
}
