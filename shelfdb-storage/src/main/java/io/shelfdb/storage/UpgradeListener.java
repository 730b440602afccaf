package io.shelfdb.storage;

@FunctionalInterface
public interface UpgradeListener {

    UpgradeListener NONE = (oldVersion, newVersion) -> {};

    void onUpgrade(long oldVersion, long newVersion);
}
