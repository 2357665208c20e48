package com.casebridge.sync.poller.api;

import com.casebridge.sync.auth.service.CallerAuthorizer;
import com.casebridge.sync.common.api.ApiResponse;
import com.casebridge.sync.poller.service.ReconciliationPoller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/poller")
public class PollerController {

    private final ReconciliationPoller poller;
    private final CallerAuthorizer authorizer;

    public PollerController(ReconciliationPoller poller, CallerAuthorizer authorizer) {
        this.poller = poller;
        this.authorizer = authorizer;
    }

    /**
     * {@code data} is null until the first cycle has finished.
     */
    @GetMapping("/last-cycle")
    public ApiResponse<PollCycleView> lastCycle(
            @RequestHeader(value = "Authorization", required = false) String authorization
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_ADMIN);
        return ApiResponse.ok(poller.lastCycle().map(PollCycleView::of).orElse(null));
    }
}
