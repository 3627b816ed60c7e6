package com.github.dimitryivaniuta.remotefirewall.web;

import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogEntry;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogService;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogStatistics;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the call log. Every response is a copy taken at request time.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/firewall/logs")
public class CallLogController {

    private final CallLogService callLog;

    @GetMapping
    public List<CallLogEntry> all() {
        return callLog.retrieveAll();
    }

    @GetMapping("/by-sender/{callerId}")
    public List<CallLogEntry> bySender(@PathVariable String callerId) {
        return callLog.retrieveBySender(callerId);
    }

    @GetMapping("/by-time")
    public List<CallLogEntry> byTimeRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (from.isAfter(to)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "'from' must not be after 'to'");
        }
        return callLog.retrieveByTimeRange(from, to);
    }

    @GetMapping("/by-min-info")
    public List<CallLogEntry> withMinInfoCount(@RequestParam @Min(0) long count) {
        return callLog.retrieveWithMinInfoCount(count);
    }

    @GetMapping("/statistics")
    public CallLogStatistics statistics() {
        return callLog.statistics();
    }

    @GetMapping("/{index}")
    public CallLogEntry one(@PathVariable long index) {
        return callLog.find(index)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Log entry not found or evicted"));
    }
}
