package com.paxkun.pulldb.service.stream;

import java.util.List;

/**
 * Catalog ids to add to and delete from one member list of a stream.
 */
public record MembershipChange(List<Object> add, List<Object> delete) {

    public MembershipChange {
        add = add != null ? add : List.of();
        delete = delete != null ? delete : List.of();
    }
}
