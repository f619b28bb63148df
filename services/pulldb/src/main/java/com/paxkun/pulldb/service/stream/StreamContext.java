package com.paxkun.pulldb.service.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Publisher;
import com.paxkun.pulldb.model.Stream;
import com.paxkun.pulldb.model.Volume;

import java.util.List;

/**
 * A stream with its member records loaded, when context was requested. Members missing from the catalog are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamContext(Stream stream, List<Publisher> publishers, List<Volume> volumes, List<Issue> issues) {

    public static StreamContext bare(Stream stream) {
        return new StreamContext(stream, null, null, null);
    }
}
