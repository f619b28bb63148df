package com.paxkun.pulldb.service.pull;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.model.Watch;

/**
 * A pull together with its related records. Related records are all absent when the
 * pull was returned without context.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PullContext(Pull pull, Issue issue, Volume volume, Watch watch) {

    public static PullContext bare(Pull pull) {
        return new PullContext(pull, null, null, null);
    }
}
