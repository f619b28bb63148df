package com.paxkun.pulldb.service.pull;

/**
 * Ordering and filtering switches for a pull listing.
 *
 * @param weighted       order by weight instead of publication date
 * @param reverse        descending order
 * @param includeIgnored for {@link PullListType#NEW}, also list ignored pulls
 */
public record PullListOptions(boolean weighted, boolean reverse, boolean includeIgnored) {

    public static final PullListOptions DEFAULT = new PullListOptions(false, false, false);

    public String orderField() {
        return weighted ? "weight" : "pubdate";
    }
}
