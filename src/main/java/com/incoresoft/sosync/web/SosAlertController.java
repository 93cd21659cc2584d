package com.incoresoft.sosync.web;

import com.incoresoft.sosync.domain.sos.dto.CancelSosRequest;
import com.incoresoft.sosync.domain.sos.dto.SendSosRequest;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import com.incoresoft.sosync.domain.sos.service.SosAlertCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.incoresoft.sosync.web.GroupController.USER_HEADER;

@RestController
@RequiredArgsConstructor
public class SosAlertController {
    private final SosAlertCoordinator coordinator;

    @PostMapping("/groups/{groupId}/sos")
    public ResponseEntity<SosAlert> send(@RequestHeader(USER_HEADER) String userId,
                                         @PathVariable String groupId,
                                         @Valid @RequestBody SendSosRequest request) {
        SosAlert alert = coordinator.sendDirect(userId, groupId, request.location(), request.message());
        return ResponseEntity.status(HttpStatus.CREATED).body(alert);
    }

    /**
     * GET /groups/{id}/sos?active=true
     */
    @GetMapping("/groups/{groupId}/sos")
    public List<SosAlert> list(@RequestHeader(USER_HEADER) String userId,
                               @PathVariable String groupId,
                               @RequestParam(name = "active", defaultValue = "false") boolean activeOnly) {
        return coordinator.findAlerts(groupId, userId, activeOnly);
    }

    @PostMapping("/sos/{alertId}/cancel")
    public SosAlert cancel(@RequestHeader(USER_HEADER) String userId,
                           @PathVariable String alertId,
                           @RequestBody(required = false) CancelSosRequest request) {
        return coordinator.cancel(alertId, userId, request == null ? null : request.reason());
    }
}
