package com.work.bond.core.ledger;

import java.math.BigInteger;

/**
 * 外部锁仓金库：存款时选择 stake 的用户直接获得一个锁仓头寸，而不是 bond。
 */
public interface LockVault {

    String getAddress();

    /**
     * 从 funder 拉取（需事先 approve 金库）amount 数量的奖励资产，为 owner 创建一个到 end 才可提取的锁仓。
     *
     * @return 新锁仓的 id
     */
    long createLock(String funder, String owner, BigInteger amount, long end);
}
