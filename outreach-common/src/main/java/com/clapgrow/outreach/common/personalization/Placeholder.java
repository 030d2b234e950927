package com.clapgrow.outreach.common.personalization;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Template placeholders understood by {@link MessagePersonalizer}.
 * Each one resolves to a non-null value: names fall back to the username, counts to "0".
 */
public enum Placeholder {

    NAME("{name}", profile -> nameOrUsername(profile)),
    USERNAME("{username}", profile -> orEmpty(profile.username())),
    DISPLAY_NAME("{display_name}", profile -> nameOrUsername(profile)),
    FOLLOWER_COUNT("{follower_count}", profile -> countOrZero(profile.followerCount())),
    FOLLOWING_COUNT("{following_count}", profile -> countOrZero(profile.followingCount()));

    private static final Map<String, Placeholder> BY_TOKEN = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Placeholder::token, Function.identity()));

    private final String token;
    private final Function<RecipientProfile, String> resolver;

    Placeholder(String token, Function<RecipientProfile, String> resolver) {
        this.token = token;
        this.resolver = resolver;
    }

    public String token() {
        return token;
    }

    public String resolve(RecipientProfile profile) {
        return resolver.apply(profile);
    }

    public static Optional<Placeholder> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    private static String nameOrUsername(RecipientProfile profile) {
        String displayName = profile.displayName();
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return orEmpty(profile.username());
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String countOrZero(Integer count) {
        return count != null ? String.valueOf(count) : "0";
    }
}
