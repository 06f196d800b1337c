package org.mimir.team;

import java.util.List;

/**
 * JSON document stored as a bundle's content. Creation time is deliberately absent so the
 * same member set and member digests always produce the same bundle digest.
 */
public record BundleManifest(String name, String team, String description, List<Member> members) {

    /** @param digest cached digest of the member, null when it was not cached at publish time */
    public record Member(String reference, String digest) {}
}
