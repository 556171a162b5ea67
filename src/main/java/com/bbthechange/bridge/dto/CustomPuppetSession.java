package com.bbthechange.bridge.dto;

import java.net.URI;

/**
 * An active double puppeting session for a real Matrix account linked to a puppet.
 *
 * @param customMxid       the real account
 * @param remoteUserKey    the puppet it is linked to
 * @param homeserverUrl    client-server API base URL of the account's homeserver
 * @param syncToken        position to resume syncing from, null for a fresh sync
 * @param syncEnabled      whether the bridge syncs the account's events
 * @param sharedSecretLogin whether a login shared secret is configured for the account's server
 */
public record CustomPuppetSession(String customMxid,
                                  String remoteUserKey,
                                  URI homeserverUrl,
                                  String syncToken,
                                  boolean syncEnabled,
                                  boolean sharedSecretLogin) {
}
