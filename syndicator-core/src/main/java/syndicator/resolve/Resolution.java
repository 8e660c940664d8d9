package syndicator.resolve;

/**
 * Whether a source item can be posted to a target right now.
 */
public sealed interface Resolution {

    static Resolution postable(String replyToRemoteId) {
        return new Postable(replyToRemoteId);
    }

    /**
     * The item can be posted.
     *
     * @param replyToRemoteId remote id to reply to on the target, or {@code null} for a new thread
     */
    record Postable(String replyToRemoteId) implements Resolution {
    }

    /**
     * Neither the parent nor the thread root has a remote id on the target yet.
     */
    record DependencyNotReady(String rootId, String parentId) implements Resolution {

        public String describe() {
            return "reply dependency not ready (root=" + rootId + ", parent=" + parentId + ")";
        }
    }
}
