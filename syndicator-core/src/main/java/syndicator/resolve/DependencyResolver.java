package syndicator.resolve;

import syndicator.ReplyRef;
import syndicator.SourceItem;
import syndicator.ledger.Ledger;

import java.util.Objects;

/**
 * Decides whether a reply can be posted on a target by looking up the remote ids of its
 * parent and thread root on that same target.
 *
 * <p>The direct parent is preferred; when only the root is known the reply attaches to the
 * root, producing a flatter but still connected thread. Items marked deleted in the ledger
 * never serve as reply anchors.
 */
public final class DependencyResolver {
    private final Ledger ledger;

    public DependencyResolver(Ledger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public Resolution resolve(SourceItem item, String target) {
        ReplyRef reply = item.reply();
        if (reply == null) {
            return Resolution.postable(null);
        }
        String parentRemoteId = liveRemoteId(reply.parentId(), target);
        String rootRemoteId = liveRemoteId(reply.rootId(), target);
        if (parentRemoteId == null && rootRemoteId == null) {
            return new Resolution.DependencyNotReady(reply.rootId(), reply.parentId());
        }
        return Resolution.postable(parentRemoteId != null ? parentRemoteId : rootRemoteId);
    }

    private String liveRemoteId(String sourceId, String target) {
        if (sourceId == null || ledger.isDeleted(sourceId)) {
            return null;
        }
        return ledger.getRemoteId(sourceId, target);
    }
}
