package com.tracebridge.reference.web;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/** Downstream collaborator called by the queue consumer. */
@Slf4j
@RestController
@RequiredArgsConstructor
public class TimeController {
    private final Clock clock;

    @GetMapping(path = "/api/time/dbtime", produces = MediaType.TEXT_PLAIN_VALUE)
    public String dbTime(@RequestHeader(name = "traceparent", required = false) String traceparent) {
        Instant now = clock.instant();
        log.debug("dbtime requested (traceparent={})", traceparent);
        return now.toString();
    }
}
