package com.paxkun.pulldb.service.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.paxkun.pulldb.model.Publisher;
import com.paxkun.pulldb.model.Volume;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VolumeContext(Volume volume, Publisher publisher) {
}
