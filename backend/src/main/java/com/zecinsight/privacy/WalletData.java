package com.zecinsight.privacy;

/**
 * Wallet payload returned after an access check; the concrete type follows the granted {@link DataLevel}.
 */
public interface WalletData {

    DataLevel dataLevel();
}
