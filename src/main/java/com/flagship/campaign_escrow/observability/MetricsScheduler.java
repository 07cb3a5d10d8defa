package com.flagship.campaign_escrow.observability;

import com.flagship.campaign_escrow.campaign.CampaignRepository;
import com.flagship.campaign_escrow.campaign.CampaignStatus;
import com.flagship.campaign_escrow.campaign.PendingPayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Refreshes gauges that would be too costly to compute on every scrape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final CampaignMetrics campaignMetrics;
    private final CampaignRepository campaignRepository;
    private final PendingPayoutRepository pendingPayoutRepository;
    private final Clock clock;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        refreshEscrowGauges();
    }

    /**
     * Campaigns past their deadline count as closed even while their stored status is
     * still ACTIVE.
     */
    void refreshEscrowGauges() {
        long active = campaignRepository.countByStatusAndDeadlineAfter(CampaignStatus.ACTIVE, clock.instant());
        long outstanding = campaignRepository.sumWithdrawableAmount();
        long pending = pendingPayoutRepository.sumAmount();

        campaignMetrics.updateEscrowGauges(active, outstanding, pending);
        log.debug("Escrow gauges refreshed: active={}, outstanding={}, pending={}", active, outstanding, pending);
    }
}
