package syndicator.spi;

import syndicator.PublishException;
import syndicator.PublishRequest;
import syndicator.PublishResult;

/**
 * Target adapter: turns prepared thread text into remote posts and removes them again.
 *
 * <p>One instance serves one target and may be called from several dispatcher threads when the
 * target's concurrency is above one. Wire formats, authentication and media upload belong to
 * the implementation.
 */
public interface Publisher {

    /** Target name; must match a configured {@link syndicator.TargetProfile}. */
    String name();

    /**
     * Prepares the adapter (login, session refresh). A failure disables the target.
     */
    default void init() throws PublishException {
    }

    /**
     * Posts the request's segments as one thread, replying to
     * {@link syndicator.PublishRequest#replyToRemoteId()} when set. Returns only once the whole
     * thread is posted.
     *
     * @throws PublishException with a status code and rate-limit hints where available
     */
    PublishResult publish(PublishRequest request) throws PublishException;

    /**
     * Deletes one remote post. A post that no longer exists is reported with
     * {@link PublishException#alreadyGone} or status 404.
     */
    void delete(String remoteId) throws PublishException;

    default void shutdown() {
    }
}
