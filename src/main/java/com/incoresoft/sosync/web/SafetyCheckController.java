package com.incoresoft.sosync.web;

import com.incoresoft.sosync.domain.check.dto.RespondRequest;
import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.service.SafetyCheckCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.incoresoft.sosync.web.GroupController.USER_HEADER;

@RestController
@RequiredArgsConstructor
public class SafetyCheckController {
    private final SafetyCheckCoordinator coordinator;

    @PostMapping("/groups/{groupId}/safety-checks")
    public ResponseEntity<SafetyCheck> initiate(@RequestHeader(USER_HEADER) String userId,
                                                @PathVariable String groupId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(coordinator.initiate(groupId, userId));
    }

    @GetMapping("/groups/{groupId}/safety-checks")
    public List<SafetyCheck> list(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        return coordinator.listChecks(groupId, userId);
    }

    @GetMapping("/safety-checks/{checkId}")
    public SafetyCheck get(@RequestHeader(USER_HEADER) String userId, @PathVariable String checkId) {
        return coordinator.getCheck(checkId, userId);
    }

    /**
     * POST /safety-checks/{checkId}/responses
     * Body: {"status": "safe|sos|noResponse", "location": {...}, "message": "...", "groupId": "..."}
     * Returns the check as it reads after completion evaluation.
     */
    @PostMapping("/safety-checks/{checkId}/responses")
    public SafetyCheck respond(@RequestHeader(USER_HEADER) String userId,
                               @PathVariable String checkId,
                               @Valid @RequestBody RespondRequest request) {
        return coordinator.respond(checkId, userId, request.status(), request.location(),
                request.message(), request.groupId());
    }
}
