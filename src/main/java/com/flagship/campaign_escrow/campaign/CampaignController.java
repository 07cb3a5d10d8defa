package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.campaign.dto.CampaignResponse;
import com.flagship.campaign_escrow.campaign.dto.ContributeRequest;
import com.flagship.campaign_escrow.campaign.dto.ContributionResponse;
import com.flagship.campaign_escrow.campaign.dto.ContributorResponse;
import com.flagship.campaign_escrow.campaign.dto.CreateCampaignRequest;
import com.flagship.campaign_escrow.observability.CorrelationContext;
import com.flagship.campaign_escrow.settlement.PayoutOutcome;
import com.flagship.campaign_escrow.settlement.SettlementReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST Controller for campaign operations.
 *
 * The acting identity of every mutating call comes from the X-Caller-Id header.
 * Authenticating that identity is left to whatever sits in front of this service.
 */
@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
@Slf4j
public class CampaignController {

    static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final CampaignService campaignService;

    /**
     * Creates a campaign owned by {@code owner}; its deadline is now plus the configured duration.
     */
    @PostMapping
    public ResponseEntity<CampaignResponse> createCampaign(@Valid @RequestBody CreateCampaignRequest request) {
        log.info("Received campaign creation request: owner={}, goal={}",
                request.getOwner(), request.getGoalAmount());

        Campaign campaign = campaignService.createCampaign(request.getOwner(), request.getGoalAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(CampaignResponse.from(campaign.snapshot()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CampaignResponse> getCampaign(@PathVariable("id") UUID campaignId) {
        return ResponseEntity.ok(CampaignResponse.from(campaignService.getCampaign(campaignId)));
    }

    @PostMapping("/{id}/contributions")
    public ResponseEntity<ContributionResponse> contribute(
            @PathVariable("id") UUID campaignId,
            @Valid @RequestBody ContributeRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        ContributionReceipt receipt = campaignService.contribute(campaignId, caller, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContributionResponse.from(receipt));
    }

    @GetMapping("/{id}/contributions/{contributor}")
    public ResponseEntity<ContributorResponse> getContributor(
            @PathVariable("id") UUID campaignId,
            @PathVariable("contributor") String contributor) {

        return ResponseEntity.ok(new ContributorResponse(contributor,
                campaignService.balanceOf(campaignId, contributor),
                campaignService.credentialsOf(campaignId, contributor)));
    }

    /**
     * Owner cancels the campaign. Every contributor is refunded; the report lists
     * any refund that failed and is waiting for a retry.
     */
    @PostMapping("/{id}/close")
    public ResponseEntity<SettlementReport> close(
            @PathVariable("id") UUID campaignId,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(campaignService.close(campaignId, caller));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<PayoutOutcome> refund(
            @PathVariable("id") UUID campaignId,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(campaignService.refund(campaignId, caller));
    }

    @PostMapping("/{id}/withdraw")
    public ResponseEntity<PayoutOutcome> withdraw(
            @PathVariable("id") UUID campaignId,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(campaignService.withdraw(campaignId, caller));
    }

    @PostMapping("/{id}/payouts/retry")
    public ResponseEntity<SettlementReport> retryFailedPayouts(
            @PathVariable("id") UUID campaignId,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(campaignService.retryFailedPayouts(campaignId, caller));
    }
}
