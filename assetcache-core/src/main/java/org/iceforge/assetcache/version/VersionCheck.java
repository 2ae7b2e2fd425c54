package org.iceforge.assetcache.version;

/**
 * Outcome of comparing the running build identifier with the persisted one.
 */
public enum VersionCheck {
    /** Nothing was persisted yet; the current identifier has been recorded. */
    FRESH_INSTALL,
    UNCHANGED,
    /** The identifier differs from the persisted one; discovery metadata has been invalidated. */
    CHANGED;

    public boolean changed() {
        return this == CHANGED;
    }
}
