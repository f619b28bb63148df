package com.paxkun.pulldb.service.watch;

import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.Issue;

/**
 * An issue released after a watch's start date that the user has no pull for yet.
 *
 * @param issue      the catalog issue
 * @param volume     volume the issue belongs to, if known
 * @param collection the watched collection that surfaced it
 */
public record NewIssue(Issue issue, Long volume, CollectionRef collection) {
}
