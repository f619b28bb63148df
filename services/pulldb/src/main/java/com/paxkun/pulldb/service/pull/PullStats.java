package com.paxkun.pulldb.service.pull;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pull counts for one user.
 */
public record PullStats(long ignored, @JsonProperty("new") long newCount, long unread, long read, long total) {
}
