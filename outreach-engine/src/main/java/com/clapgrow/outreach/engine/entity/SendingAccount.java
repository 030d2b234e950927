package com.clapgrow.outreach.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outbound account that campaigns send from. Channel credentials live outside this service;
 * {@code channelConnected} mirrors whether a valid authenticated credential is currently held.
 */
@Entity
@Table(name = "sending_accounts", indexes = {
    @Index(name = "idx_sending_accounts_handle", columnList = "handle", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SendingAccount extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "handle", nullable = false, length = 100)
    private String handle;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "channel_connected", nullable = false)
    private boolean channelConnected;

    @Column(name = "active", nullable = false)
    private boolean active = true;
}
