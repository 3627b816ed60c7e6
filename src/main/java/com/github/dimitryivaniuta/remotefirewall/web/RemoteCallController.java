package com.github.dimitryivaniuta.remotefirewall.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.CallResult;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.CallStage;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointRegistration;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteCallKind;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteHandler;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValues;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * HTTP transport for remote calls. The host authenticates the caller and passes its identity
 * in {@value #CALLER_HEADER}; the body is a JSON array of positional arguments.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/remote")
public class RemoteCallController {

    public static final String CALLER_HEADER = "X-Caller-Id";

    private final RemoteHandler handler;
    private final ObjectMapper mapper;

    public record RemoteCallResponse(
            boolean success,
            JsonNode value,
            CallStage stage,
            String reason,
            long logIndex
    ) {}

    @PostMapping("/{endpoint}")
    public ResponseEntity<RemoteCallResponse> call(@PathVariable String endpoint,
                                                   @RequestHeader(CALLER_HEADER) String callerId,
                                                   @RequestBody(required = false) JsonNode body) {
        EndpointRegistration reg = handler.find(endpoint)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown endpoint"));

        List<RemoteValue> args = RemoteValues.argsFromJson(body, mapper);

        if (reg.kind() == RemoteCallKind.EVENT) {
            handler.fire(reg.name(), callerId, args);
            return ResponseEntity.accepted().build();
        }

        CallResult result = handler.invoke(reg.name(), callerId, args);
        return ResponseEntity.ok(toResponse(result));
    }

    private RemoteCallResponse toResponse(CallResult r) {
        if (!r.isSuccess()) {
            return new RemoteCallResponse(false, null, r.failedStage().orElse(null), r.reason(), r.logIndex());
        }
        JsonNode value = r.value().map(v -> RemoteValues.toJson(v, mapper)).orElse(null);
        return new RemoteCallResponse(true, value, null, null, r.logIndex());
    }
}
