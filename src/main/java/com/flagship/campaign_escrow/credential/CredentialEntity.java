package com.flagship.campaign_escrow.credential;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A credential held by a contributor of a campaign. Written only when the contribution
 * that minted it commits.
 */
@Entity
@Table(name = "campaign_credentials")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CredentialEntity {

    @Id
    @Column(name = "credential_id", nullable = false, updatable = false)
    private Long credentialId;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(nullable = false, updatable = false)
    private String holder;
}
