package com.paxkun.pulldb.service.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.paxkun.pulldb.model.Publisher;
import com.paxkun.pulldb.model.StoryArc;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArcContext(StoryArc arc, Publisher publisher) {
}
