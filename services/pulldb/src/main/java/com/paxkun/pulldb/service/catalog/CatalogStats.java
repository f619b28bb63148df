package com.paxkun.pulldb.service.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Catalog backlog counts. {@code total} is only present when it was asked for.
 *
 * @param queued  collections catalog sync has not completed
 * @param toindex collections not yet in the search index
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogStats(long queued, long toindex, Long total) {
}
