package com.smurthy.ai.insights.session;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads cookies for one domain from a browser's on-disk cookie database.
 * Implementations never write to or lock the store.
 */
public interface CookieStoreReader {

    /**
     * @return true if this reader understands the given browser's store format
     */
    boolean supports(BrowserProfile profile);

    /**
     * Reads every cookie whose host is {@code domain} or a subdomain of it.
     *
     * @throws com.smurthy.ai.insights.exception.SessionNotFoundException if the store cannot be read
     * @throws com.smurthy.ai.insights.exception.SessionStoreLockedException if another process holds the store
     */
    List<CookieRecord> read(BrowserProfile profile, Path store, String domain);
}
