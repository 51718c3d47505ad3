package net.kairos.core.model;

import java.time.Instant;

public record Lease(
        String jobName,
        String holderId,     // 임차한 인스턴스 식별자
        Instant acquiredAt,
        Instant expiresAt
) {
    public boolean heldBy(String holder, Instant now) {
        return holderId != null && holderId.equals(holder) && expiresAt != null && now.isBefore(expiresAt);
    }

    public boolean expired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
