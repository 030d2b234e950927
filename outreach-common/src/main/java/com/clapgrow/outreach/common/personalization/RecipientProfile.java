package com.clapgrow.outreach.common.personalization;

/**
 * Recipient attributes available to message templates. Any attribute may be null.
 */
public record RecipientProfile(
    String username,
    String displayName,
    Integer followerCount,
    Integer followingCount
) {
}
