package com.telesync.upstream;

import com.telesync.shared.model.Credentials;
import com.telesync.shared.model.UpstreamItem;

import java.time.Instant;
import java.util.List;

/**
 * Request/response contract of the chat platform. Implementations throw
 * {@link com.telesync.shared.error.UpstreamFetchException} for transport or rate-limit
 * failures, {@link com.telesync.shared.error.CredentialException} when the platform rejects the
 * app credentials and {@link com.telesync.shared.error.ChallengeException} for a wrong login code.
 */
public interface UpstreamClient {

    /** Asks the platform to deliver a one-time login code to the account. */
    void requestCode(Credentials credentials);

    void signIn(Credentials credentials, String code);

    /** Items posted in {@code sourceRef} after {@code since}; {@code since == null} means everything available. */
    List<UpstreamItem> fetchNewItems(Credentials credentials, String sourceRef, Instant since);

    /** Fetches the item's bytes, reporting progress on the calling thread. */
    FetchedContent download(Credentials credentials, String sourceRef, UpstreamItem item, ProgressListener listener);

    boolean isReachable();
}
