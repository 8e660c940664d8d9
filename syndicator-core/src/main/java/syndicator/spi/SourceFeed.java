package syndicator.spi;

import syndicator.SourceItem;

import java.util.List;
import java.util.Set;

/**
 * Source of the originating account's posts.
 *
 * <p>Implementations normalize their native records into {@link SourceItem} and decide which
 * replies are eligible for syndication at all.
 */
public interface SourceFeed {

    /**
     * Most recent items of the account, newest first.
     */
    List<SourceItem> fetchRecentOwnItems(int limit) throws Exception;

    /**
     * Ids of every item currently live at the source, following pagination to the end.
     */
    Set<String> fetchAllLiveIds() throws Exception;
}
