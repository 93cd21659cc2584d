package com.incoresoft.sosync.web;

import com.incoresoft.sosync.domain.group.dto.CreateGroupRequest;
import com.incoresoft.sosync.domain.group.dto.GroupSettingsRequest;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.InviteRequest;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.group.service.GroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Group membership and settings. The caller is identified by the {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/groups")
@RequiredArgsConstructor
public class GroupController {
    static final String USER_HEADER = "X-User-Id";

    private final GroupService groupService;

    @PostMapping
    public ResponseEntity<SafetyGroup> create(@RequestHeader(USER_HEADER) String userId,
                                              @Valid @RequestBody CreateGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(groupService.createGroup(userId, request.name()));
    }

    @GetMapping
    public List<SafetyGroup> mine(@RequestHeader(USER_HEADER) String userId) {
        return groupService.listGroupsForUser(userId);
    }

    @GetMapping("/{groupId}")
    public SafetyGroup get(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        return groupService.getGroup(groupId, userId);
    }

    /**
     * GET /groups/{id}/status
     * Returns {"groupId": "...", "status": "...", "displayName": "..."}
     */
    @GetMapping("/{groupId}/status")
    public Map<String, Object> status(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        GroupStatus status = groupService.getGroup(groupId, userId).getCurrentStatus();
        return Map.of("groupId", groupId, "status", status, "displayName", status.getDisplayName());
    }

    @PatchMapping("/{groupId}/settings")
    public SafetyGroup updateSettings(@RequestHeader(USER_HEADER) String userId,
                                      @PathVariable String groupId,
                                      @RequestBody GroupSettingsRequest request) {
        return groupService.updateSettings(groupId, userId, request);
    }

    @DeleteMapping("/{groupId}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        groupService.deleteGroup(groupId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{groupId}/invitations")
    public SafetyGroup invite(@RequestHeader(USER_HEADER) String userId,
                              @PathVariable String groupId,
                              @Valid @RequestBody InviteRequest request) {
        return groupService.invite(groupId, userId, request.userId().trim());
    }

    @PostMapping("/{groupId}/invitations/accept")
    public SafetyGroup accept(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        return groupService.acceptInvitation(groupId, userId);
    }

    @PostMapping("/{groupId}/invitations/decline")
    public ResponseEntity<Void> decline(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        groupService.declineInvitation(groupId, userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{groupId}/members/{memberId}")
    public SafetyGroup removeMember(@RequestHeader(USER_HEADER) String userId,
                                    @PathVariable String groupId,
                                    @PathVariable String memberId) {
        return groupService.removeMember(groupId, userId, memberId);
    }

    @PostMapping("/{groupId}/leave")
    public ResponseEntity<Void> leave(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        groupService.leaveGroup(groupId, userId);
        return ResponseEntity.noContent().build();
    }
}
