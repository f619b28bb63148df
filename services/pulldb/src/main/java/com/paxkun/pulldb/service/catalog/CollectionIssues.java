package com.paxkun.pulldb.service.catalog;

import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.store.StoredEntity;

import java.util.List;

/**
 * A volume or story arc with its issues in publication order.
 */
public record CollectionIssues(StoredEntity collection, List<Issue> issues) {

    public CollectionIssues {
        issues = List.copyOf(issues);
    }
}
