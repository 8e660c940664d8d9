package syndicator;

import java.util.Objects;

/**
 * Reply linkage of a source item: the thread root and the direct parent, both as source ids.
 */
public record ReplyRef(String rootId, String parentId) {

    public ReplyRef {
        Objects.requireNonNull(rootId, "rootId");
        Objects.requireNonNull(parentId, "parentId");
    }
}
