package com.casebridge.sync.cases.api;

import com.casebridge.sync.auth.service.CallerAuthorizer;
import com.casebridge.sync.cases.model.Conversation;
import com.casebridge.sync.cases.repo.SupportCaseRepository;
import com.casebridge.sync.cases.service.CaseRegistryService;
import com.casebridge.sync.cases.service.ChatReplyService;
import com.casebridge.sync.common.api.ApiResponse;
import com.casebridge.sync.lifecycle.ConversationLifecycleService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/mappings")
public class CaseMappingController {

    private final CaseRegistryService registry;
    private final ConversationLifecycleService lifecycleService;
    private final ChatReplyService replyService;
    private final SupportCaseRepository caseRepository;
    private final CallerAuthorizer authorizer;

    public CaseMappingController(
            CaseRegistryService registry,
            ConversationLifecycleService lifecycleService,
            ChatReplyService replyService,
            SupportCaseRepository caseRepository,
            CallerAuthorizer authorizer
    ) {
        this.registry = registry;
        this.lifecycleService = lifecycleService;
        this.replyService = replyService;
        this.caseRepository = caseRepository;
        this.authorizer = authorizer;
    }

    @PostMapping
    public ApiResponse<ConversationView> create(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody CreateMappingRequest req
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_COMMAND);
        var conv = registry.createMapping(
                req.account_key().trim(),
                req.case_id().trim(),
                req.conversation_id().trim(),
                req.creator_id().trim(),
                req.display_id() == null || req.display_id().isBlank() ? null : req.display_id().trim()
        );
        return ApiResponse.ok(view(conv));
    }

    @GetMapping("/by-case")
    public ApiResponse<ConversationView> byCase(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam("account_key") String accountKey,
            @RequestParam("case_id") String caseId
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_COMMAND, CallerAuthorizer.ROLE_TRANSPORT);
        var conv = registry.lookupByCase(accountKey, caseId)
                .orElseThrow(() -> new IllegalArgumentException("mapping_not_found"));
        return ApiResponse.ok(view(conv));
    }

    @GetMapping("/by-participant/{participantId}")
    public ApiResponse<List<ConversationView>> byParticipant(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("participantId") String participantId,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_COMMAND);
        var items = registry.listByParticipant(participantId, limit).stream()
                .map(this::view)
                .toList();
        return ApiResponse.ok(items);
    }

    @GetMapping("/{conversationId}")
    public ApiResponse<ConversationView> byConversation(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("conversationId") String conversationId
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_COMMAND, CallerAuthorizer.ROLE_TRANSPORT);
        var mapping = registry.lookupByConversation(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("conversation_not_found"));
        return ApiResponse.ok(ConversationView.of(mapping.conversation(), mapping.supportCase()));
    }

    @PostMapping("/{conversationId}/archive")
    public ApiResponse<ConversationView> archive(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("conversationId") String conversationId,
            @Valid @RequestBody ArchiveRequest req
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_COMMAND);
        var conv = lifecycleService.archiveByRequest(conversationId, req.requester_id().trim());
        return ApiResponse.ok(view(conv));
    }

    @PostMapping("/{conversationId}/replies")
    public ApiResponse<ReplyView> reply(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("conversationId") String conversationId,
            @Valid @RequestBody ReplyRequest req
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_TRANSPORT);
        return ApiResponse.ok(ReplyView.of(replyService.forward(conversationId, req.sender_name(), req.text())));
    }

    private ConversationView view(Conversation conv) {
        return ConversationView.of(conv, caseRepository.find(conv.accountKey(), conv.caseId()).orElse(null));
    }
}
