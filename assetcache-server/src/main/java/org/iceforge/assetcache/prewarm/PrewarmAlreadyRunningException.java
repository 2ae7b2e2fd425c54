package org.iceforge.assetcache.prewarm;

public class PrewarmAlreadyRunningException extends RuntimeException {

    public PrewarmAlreadyRunningException() {
        super("A prewarm run is already in progress");
    }
}
