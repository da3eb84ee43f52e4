package com.zecinsight.domain;

import java.util.Collection;
import java.util.List;

public interface ProductivityScoreRepositoryCustom {

    /** Latest score per wallet for the given wallet ids. Wallets without a score are absent. */
    List<ProductivityScore> findLatestByWalletIds(Collection<String> walletIds);
}
