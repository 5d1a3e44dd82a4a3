package com.satmobile.backend.modules.admin.presentation;

import jakarta.validation.Valid;

import com.satmobile.backend.global.web.RequestIdFilter;
import com.satmobile.backend.modules.admin.application.AdminSyncService;
import com.satmobile.backend.modules.admin.presentation.dto.CounterRecomputeResponse;
import com.satmobile.backend.modules.admin.presentation.dto.CrossCategorySyncRequest;
import com.satmobile.backend.modules.admin.presentation.dto.MirrorSyncResponse;
import com.satmobile.backend.modules.admin.presentation.dto.PurgeInactiveResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Admin Sync", description = "Counter repair and mirror maintenance")
@RestController
@RequestMapping("/admin/sync")
public class AdminSyncController {

    private final AdminSyncService adminSyncService;

    public AdminSyncController(AdminSyncService adminSyncService) {
        this.adminSyncService = adminSyncService;
    }

    @Operation(summary = "Recompute member counters", description = "Overwrites every tenant and administrator memberCount with an exact count.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recompute finished"),
            @ApiResponse(responseCode = "403", description = "Administrator role required")
    })
    @PostMapping("/counters/recompute")
    public ResponseEntity<CounterRecomputeResponse> recomputeCounters(
            @RequestHeader(name = RequestIdFilter.CALLER_ID_HEADER, required = false) String callerId
    ) {
        return ResponseEntity.ok(CounterRecomputeResponse.from(adminSyncService.recomputeCounters(callerId)));
    }

    @Operation(summary = "Purge inactive members", description = "Deletes every member with isActive == false, then recomputes counters.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Purge finished"),
            @ApiResponse(responseCode = "403", description = "Administrator role required")
    })
    @PostMapping("/members/purge-inactive")
    public ResponseEntity<PurgeInactiveResponse> purgeInactiveMembers(
            @RequestHeader(name = RequestIdFilter.CALLER_ID_HEADER, required = false) String callerId
    ) {
        return ResponseEntity.ok(PurgeInactiveResponse.from(adminSyncService.purgeInactiveMembers(callerId)));
    }

    @Operation(summary = "Backfill mirrors of a source tenant")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Backfill finished"),
            @ApiResponse(responseCode = "403", description = "Administrator role required"),
            @ApiResponse(responseCode = "409", description = "Tenant is not a source tenant")
    })
    @PostMapping("/mirrors/backfill/{tenantId}")
    public ResponseEntity<MirrorSyncResponse> backfillMirrors(
            @RequestHeader(name = RequestIdFilter.CALLER_ID_HEADER, required = false) String callerId,
            @PathVariable String tenantId
    ) {
        return ResponseEntity.ok(MirrorSyncResponse.from(adminSyncService.backfillMirrors(callerId, tenantId)));
    }

    @Operation(summary = "Sync one category across all source tenants")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sync finished"),
            @ApiResponse(responseCode = "400", description = "Category label missing"),
            @ApiResponse(responseCode = "403", description = "Administrator role required")
    })
    @PostMapping("/mirrors/cross-category")
    public ResponseEntity<MirrorSyncResponse> syncCategory(
            @RequestHeader(name = RequestIdFilter.CALLER_ID_HEADER, required = false) String callerId,
            @Valid @RequestBody CrossCategorySyncRequest request
    ) {
        return ResponseEntity.ok(MirrorSyncResponse.from(adminSyncService.syncCategory(callerId, request.categoryLabel())));
    }
}
