package org.rewardledger.model;

public enum LedgerEventType {
    SIGNUP,
    SWAP,
    STAKE,
    UNSTAKE,
    CLAIM,
    WITHDRAWAL,
    REFERRAL_REWARD,
    BALANCE_SET,
    SWEEP
}
