package org.dxworks.trustforge.error;

public class AssetNotFoundException extends TrustforgeException {

    private final String asset;

    public AssetNotFoundException(String asset) {
        super("Asset not found: " + asset);
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}
