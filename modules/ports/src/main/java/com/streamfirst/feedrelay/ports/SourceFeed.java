package com.streamfirst.feedrelay.ports;

import com.streamfirst.feedrelay.domain.*;

import java.util.List;

/**
 * Port for the source chat/channel API the relay reads from.
 * Implementations own HTTP calls, authentication headers and response parsing.
 * Network failures and upstream rejections are reported as {@link FeedException}.
 */
public interface SourceFeed {

    /**
     * Fetches messages posted after the given cursor.
     *
     * @param sourceId the channel or thread to read
     * @param afterId only messages newer than this id are returned; null returns the most recent ones
     * @param limit maximum number of messages to return
     * @return messages in no guaranteed order, possibly containing repeats
     */
    List<SourceMessage> fetchSince(String sourceId, String afterId, int limit);

    /**
     * Fetches the messages currently pinned in a channel.
     */
    List<SourceMessage> fetchPinned(String sourceId);

    /**
     * Lists the threads currently open in a forum channel.
     */
    List<ForumThread> fetchThreads(String sourceId);

    /**
     * Checks whether the channel exists and the configured credential can read it.
     */
    boolean checkAccessible(String sourceId);

    /**
     * Verifies a credential against the source API.
     *
     * @param credential the credential to verify
     * @return success carrying the normalized credential (may differ in prefix or whitespace),
     *         or failure with the reason
     */
    Result<String> verifyCredential(String credential);

    /**
     * Checks that the configured proxy forwards requests.
     */
    Result<Void> checkProxy(NetworkOptions network);

    /**
     * Sets the credential used by subsequent calls.
     */
    void setCredential(String credential);

    /**
     * Applies proxy and user agent settings to subsequent calls.
     */
    void setNetworkOptions(NetworkOptions network);
}
